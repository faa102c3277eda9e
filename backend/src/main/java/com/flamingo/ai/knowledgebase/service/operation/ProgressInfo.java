package com.flamingo.ai.knowledgebase.service.operation;

import java.time.Duration;
import java.util.Optional;

/** Snapshot of a tracked operation's progress. */
public record ProgressInfo(int current, int total, String message, Duration elapsed) {

  /** Completed fraction in [0, 1]. */
  public double rate() {
    if (total <= 0) {
      return 0.0;
    }
    return Math.min((double) current / total, 1.0);
  }

  public double percentage() {
    return rate() * 100;
  }

  /** Linear extrapolation from the elapsed time; empty before the first item or after the last. */
  public Optional<Duration> estimatedRemaining() {
    double rate = rate();
    if (current <= 0 || rate >= 1.0 || elapsed.isZero() || elapsed.isNegative()) {
      return Optional.empty();
    }
    double elapsedMillis = elapsed.toMillis();
    double totalMillis = elapsedMillis / rate;
    return Optional.of(Duration.ofMillis(Math.round(totalMillis * (1.0 - rate))));
  }
}
