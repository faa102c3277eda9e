package com.flamingo.ai.knowledgebase.service.health;

/** Overall system condition. */
public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  ERROR
}
