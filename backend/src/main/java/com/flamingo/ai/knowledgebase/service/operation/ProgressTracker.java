package com.flamingo.ai.knowledgebase.service.operation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Counts completed work items and forwards progress to a {@link ProgressListener}.
 *
 * <p>Incremental updates closer together than the minimum interval are coalesced; explicit
 * positioning, completion and the first update are always delivered. A failing listener is
 * logged and never aborts the tracked operation.
 */
@Slf4j
public class ProgressTracker {

  /** Operations estimated below this duration do not need progress reporting. */
  public static final Duration DEFAULT_DISPLAY_THRESHOLD = Duration.ofSeconds(3);

  private final int total;
  private final String description;
  private final Clock clock;
  private final Duration minInterval;
  private final ProgressListener listener;
  private final Instant startedAt;
  private int current;
  private Instant lastNotified;
  private boolean cancelled;

  public ProgressTracker(
      int total, String description, Clock clock, Duration minInterval, ProgressListener listener) {
    this.total = Math.max(total, 0);
    this.description = description;
    this.clock = clock;
    this.minInterval = minInterval;
    this.listener = listener == null ? ProgressListener.NONE : listener;
    this.startedAt = clock.instant();
    notifyListener(description + " started");
  }

  public static boolean shouldShowProgress(Duration estimated) {
    return shouldShowProgress(estimated, DEFAULT_DISPLAY_THRESHOLD);
  }

  public static boolean shouldShowProgress(Duration estimated, Duration threshold) {
    return estimated.compareTo(threshold) >= 0;
  }

  public synchronized void update(int increment, String message) {
    if (cancelled) {
      return;
    }
    current = Math.min(current + increment, total);
    Instant now = clock.instant();
    if (lastNotified != null && Duration.between(lastNotified, now).compareTo(minInterval) < 0) {
      return;
    }
    notifyListener(message != null ? message : defaultMessage());
  }

  public synchronized void setCurrent(int position, String message) {
    if (cancelled) {
      return;
    }
    current = Math.min(Math.max(position, 0), total);
    notifyListener(message != null ? message : defaultMessage());
  }

  public synchronized void finish(String message) {
    current = total;
    notifyListener(message != null ? message : description + " complete");
    log.info("{} finished: {} item(s) in {} ms", description, total, elapsed().toMillis());
  }

  public synchronized void cancel() {
    cancelled = true;
    log.info("{} progress cancelled at {}/{}", description, current, total);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public synchronized ProgressInfo snapshot() {
    return new ProgressInfo(current, total, description, elapsed());
  }

  private Duration elapsed() {
    return Duration.between(startedAt, clock.instant());
  }

  private String defaultMessage() {
    return description + " (" + current + "/" + total + ")";
  }

  private void notifyListener(String message) {
    lastNotified = clock.instant();
    try {
      listener.onProgress(new ProgressInfo(current, total, message, elapsed()));
    } catch (RuntimeException e) {
      log.warn("Progress listener failed for '{}': {}", description, e.getMessage());
    }
  }
}
