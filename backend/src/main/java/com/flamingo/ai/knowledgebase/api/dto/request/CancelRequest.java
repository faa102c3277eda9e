package com.flamingo.ai.knowledgebase.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional reason attached to a cancellation. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {

  private String reason;
}
