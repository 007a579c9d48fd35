package cable;

/**
 * Lifecycle of a {@link Subscription}.
 *
 * <p>Transitions only move forward: {@code CREATED -> ACTIVE -> CANCELLING -> CLOSED}.
 * A subscription cancelled before its worker started goes straight to {@code CLOSED}.
 */
public enum SubscriptionState {
  /** Registered object exists but no worker is draining its queue yet. */
  CREATED,
  /** Worker running; messages are accepted into the queue. */
  ACTIVE,
  /** Cancellation requested; the worker has not exited yet. */
  CANCELLING,
  /** Worker exited. Terminal. */
  CLOSED
}
