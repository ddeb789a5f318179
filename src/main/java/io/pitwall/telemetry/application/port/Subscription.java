package io.pitwall.telemetry.application.port;

/**
 * Handle returned to every registered listener; calling {@link #unsubscribe()} detaches it.
 *
 * <p>Implementations are idempotent: unsubscribing twice is harmless.</p>
 *
 * @since PITWALL 0.1.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
  /**
   * Detaches the listener; no further callbacks are delivered once this returns.
   */
  void unsubscribe();

  /**
   * Alias of {@link #unsubscribe()} for try-with-resources.
   */
  @Override
  default void close() {
    unsubscribe();
  }

  /** Subscription that holds nothing. */
  Subscription NONE = () -> {};
}
