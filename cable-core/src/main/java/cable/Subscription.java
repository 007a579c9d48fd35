package cable;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one registered handler on one channel.
 *
 * <p>Each subscription owns a bounded FIFO queue filled by the dispatcher and drained by its
 * own delivery worker. Instances are created by {@link SolidCable#subscribe} and stay valid
 * after {@link SolidCable#unsubscribe}, which only moves them to a terminal state.
 *
 * <p>The queue and state transition methods are public so the dispatcher package can drive
 * them; applications should only read from a subscription.
 *
 * @see SubscriptionState
 */
public final class Subscription {
  private static final AtomicLong LAST_NANOS = new AtomicLong();

  private final String id;
  private final String channel;
  private final MessageHandler handler;
  private final BlockingQueue<Message> queue;
  private final AtomicReference<SubscriptionState> state =
      new AtomicReference<>(SubscriptionState.CREATED);
  private final CountDownLatch closed = new CountDownLatch(1);

  /**
   * Creates a subscription in state {@link SubscriptionState#CREATED}.
   *
   * @param channel       exact channel name or {@code "*"}
   * @param handler       callback for delivered messages
   * @param queueCapacity bound of the delivery queue, must be &gt; 0
   */
  public Subscription(String channel, MessageHandler handler, int queueCapacity) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.handler = Objects.requireNonNull(handler, "handler");
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    this.queue = new ArrayBlockingQueue<>(queueCapacity);
    this.id = channel + "-" + nextNanos();
  }

  // Epoch nanoseconds, bumped so two subscriptions never share an id.
  private static long nextNanos() {
    long now = System.currentTimeMillis() * 1_000_000L + System.nanoTime() % 1_000_000L;
    return LAST_NANOS.updateAndGet(last -> Math.max(last + 1, now));
  }

  public String id() {
    return id;
  }

  public String channel() {
    return channel;
  }

  public MessageHandler handler() {
    return handler;
  }

  public SubscriptionState state() {
    return state.get();
  }

  public boolean isActive() {
    return state.get() == SubscriptionState.ACTIVE;
  }

  /**
   * Returns the number of messages waiting in the delivery queue.
   *
   * @return queued message count
   */
  public int pendingCount() {
    return queue.size();
  }

  /**
   * Enqueues a message without blocking.
   *
   * @param message the message to deliver
   * @return {@code false} if the queue is full or the subscription is not active
   */
  public boolean offer(Message message) {
    if (!isActive()) {
      return false;
    }
    return queue.offer(message);
  }

  /**
   * Waits up to {@code timeoutMs} for the next queued message.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return the next message, or {@code null} on timeout
   * @throws InterruptedException if the worker thread is interrupted
   */
  public Message poll(long timeoutMs) throws InterruptedException {
    return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Moves {@code CREATED -> ACTIVE}. Called when the delivery worker has been scheduled.
   *
   * @return {@code true} if the transition happened
   */
  public boolean markActive() {
    return state.compareAndSet(SubscriptionState.CREATED, SubscriptionState.ACTIVE);
  }

  /**
   * Requests cancellation and discards queued messages. Idempotent.
   *
   * <p>An active subscription moves to {@code CANCELLING} and its worker finishes the
   * transition; one that never started moves straight to {@code CLOSED}.
   */
  public void cancel() {
    if (state.compareAndSet(SubscriptionState.CREATED, SubscriptionState.CLOSED)) {
      closed.countDown();
    } else {
      state.compareAndSet(SubscriptionState.ACTIVE, SubscriptionState.CANCELLING);
    }
    queue.clear();
  }

  /**
   * Marks the subscription {@code CLOSED}. Called by the worker on exit.
   */
  public void markClosed() {
    state.set(SubscriptionState.CLOSED);
    queue.clear();
    closed.countDown();
  }

  /**
   * Blocks until the worker has exited or the timeout elapses.
   *
   * @param timeout maximum wait
   * @param unit    unit of {@code timeout}
   * @return {@code true} if the subscription reached {@code CLOSED}
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException {
    return closed.await(timeout, unit);
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", state=" + state.get() + "}";
  }
}
