package com.flamingo.ai.knowledgebase.service.operation;

import com.flamingo.ai.knowledgebase.exception.OperationCancelledException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation flag for one logical operation.
 *
 * <p>Long-running loops call {@link #throwIfCancelled()} at fixed checkpoints. Listeners are
 * attached with {@link #onCancel(Consumer)} and detached by closing the returned {@link
 * Registration}.
 */
@Slf4j
public class CancellationToken {

  private final String id;
  private final Instant createdAt;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Listener> listeners = new CopyOnWriteArrayList<>();
  private volatile Instant cancelledAt;
  private volatile String reason;

  public CancellationToken(String id, Clock clock) {
    this.id = id;
    this.clock = clock;
    this.createdAt = clock.instant();
  }

  /** A token owned by nobody; only the holder can cancel it. */
  public static CancellationToken detached() {
    return new CancellationToken(UUID.randomUUID().toString(), Clock.systemUTC());
  }

  public String getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public String getReason() {
    return reason;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Marks the token cancelled and notifies listeners once.
   *
   * @return {@code false} if the token was already cancelled
   */
  public boolean cancel(String cancelReason) {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    this.reason = cancelReason;
    this.cancelledAt = clock.instant();
    log.info("Operation {} cancelled: {}", id, cancelReason);
    for (Listener listener : listeners) {
      listener.fire();
    }
    return true;
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new OperationCancelledException(id, reason);
    }
  }

  /**
   * Registers a listener; runs it immediately when the token is already cancelled. A listener
   * runs at most once, even when registered while {@link #cancel(String)} is notifying.
   *
   * @return handle that removes the listener when closed
   */
  public Registration onCancel(Consumer<CancellationToken> callback) {
    Listener listener = new Listener(callback);
    listeners.add(listener);
    if (cancelled.get()) {
      listeners.remove(listener);
      listener.fire();
    }
    return () -> listeners.remove(listener);
  }

  int listenerCount() {
    return listeners.size();
  }

  private final class Listener {

    private final Consumer<CancellationToken> callback;
    private final AtomicBoolean fired = new AtomicBoolean(false);

    Listener(Consumer<CancellationToken> callback) {
      this.callback = callback;
    }

    void fire() {
      if (!fired.compareAndSet(false, true)) {
        return;
      }
      try {
        callback.accept(CancellationToken.this);
      } catch (RuntimeException e) {
        log.warn("Cancellation listener failed for operation {}: {}", id, e.getMessage());
      }
    }
  }

  /** Detaches a cancellation listener. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
