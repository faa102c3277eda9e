package com.flamingo.ai.knowledgebase.service.operation;

import com.flamingo.ai.knowledgebase.config.KnowledgeBaseProperties;
import com.flamingo.ai.knowledgebase.exception.InvalidParameterException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Registry of outstanding cancellation tokens, so a cancel request can reach an in-flight
 * operation by id.
 *
 * <p>Registration, lookup and sweep are guarded by one lock. Tokens older than the configured
 * maximum age are dropped on a fixed schedule.
 */
@Component
@Slf4j
public class CancellationRegistry {

  private final Clock clock;
  private final Duration maxAge;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, CancellationToken> tokens = new LinkedHashMap<>();

  @Autowired
  public CancellationRegistry(Clock clock, KnowledgeBaseProperties properties) {
    this(clock, properties.getCancellation().getTokenMaxAge());
  }

  public CancellationRegistry(Clock clock, Duration maxAge) {
    this.clock = clock;
    this.maxAge = maxAge;
  }

  public CancellationToken create() {
    return create(null);
  }

  /**
   * Registers a token under a caller-chosen id, or a random one when {@code tokenId} is blank.
   *
   * @throws InvalidParameterException if the id is already in use
   */
  public CancellationToken create(String tokenId) {
    String id = tokenId == null || tokenId.isBlank() ? UUID.randomUUID().toString() : tokenId;
    CancellationToken token = new CancellationToken(id, clock);
    lock.lock();
    try {
      if (tokens.putIfAbsent(id, token) != null) {
        throw new InvalidParameterException("operationId", id, "an id not already in use");
      }
    } finally {
      lock.unlock();
    }
    log.debug("Registered cancellation token {}", token.getId());
    return token;
  }

  public Optional<CancellationToken> get(String tokenId) {
    lock.lock();
    try {
      return Optional.ofNullable(tokens.get(tokenId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels the token with the given id.
   *
   * @return {@code true} if the token exists and was not cancelled before
   */
  public boolean cancel(String tokenId, String reason) {
    return get(tokenId).map(token -> token.cancel(reason)).orElse(false);
  }

  /** Cancels every registered token; returns how many changed state. */
  public int cancelAll(String reason) {
    int count = 0;
    for (CancellationToken token : snapshot()) {
      if (token.cancel(reason)) {
        count++;
      }
    }
    log.info("Cancelled {} outstanding operation(s): {}", count, reason);
    return count;
  }

  /** Drops a token once its operation has finished. */
  public void release(String tokenId) {
    lock.lock();
    try {
      tokens.remove(tokenId);
    } finally {
      lock.unlock();
    }
  }

  @Scheduled(
      fixedDelayString = "${knowledge-base.cancellation.sweep-interval:PT5M}",
      initialDelayString = "${knowledge-base.cancellation.sweep-interval:PT5M}")
  public int sweepExpired() {
    Instant cutoff = clock.instant().minus(maxAge);
    int removed = 0;
    lock.lock();
    try {
      var iterator = tokens.values().iterator();
      while (iterator.hasNext()) {
        if (iterator.next().getCreatedAt().isBefore(cutoff)) {
          iterator.remove();
          removed++;
        }
      }
    } finally {
      lock.unlock();
    }
    if (removed > 0) {
      log.info("Swept {} expired cancellation token(s)", removed);
    }
    return removed;
  }

  public int activeCount() {
    int active = 0;
    for (CancellationToken token : snapshot()) {
      if (!token.isCancelled()) {
        active++;
      }
    }
    return active;
  }

  public Stats stats() {
    List<CancellationToken> all = snapshot();
    int cancelled = (int) all.stream().filter(CancellationToken::isCancelled).count();
    return new Stats(all.size(), all.size() - cancelled, cancelled);
  }

  private List<CancellationToken> snapshot() {
    lock.lock();
    try {
      return new ArrayList<>(tokens.values());
    } finally {
      lock.unlock();
    }
  }

  /** Counts of registered tokens. */
  public record Stats(int total, int active, int cancelled) {}
}
