package cable.dispatch;

import cable.Message;
import cable.Subscription;
import cable.poller.MessagePollerHandler;
import cable.registry.SubscriptionRegistry;
import cable.spi.MetricsExporter;
import cable.util.DaemonThreadFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans polled messages out to subscription queues and runs one delivery worker per
 * subscription.
 *
 * <p>For each message the dispatcher takes a snapshot of the matching subscriptions from the
 * {@link SubscriptionRegistry} (exact channel plus wildcard, or everyone for a broadcast) and
 * offers the message to each queue without blocking. A full queue drops the message for that
 * subscription only; the poller and the other subscriptions are never held up.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see MessageDispatcher.Builder
 * @see DeliveryWorker
 */
public final class MessageDispatcher implements MessagePollerHandler, AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageDispatcher.class.getName());

  private final SubscriptionRegistry registry;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final ExecutorService workers;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private MessageDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("cable-subscriber-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the delivery worker for a new subscription and marks it active.
   *
   * @param subscription a subscription in state {@code CREATED}
   * @throws IllegalStateException if the dispatcher is closed or the subscription was
   *                               already started or cancelled
   */
  public void startWorker(Subscription subscription) {
    if (!accepting.get()) {
      throw new IllegalStateException("MessageDispatcher has been closed");
    }
    if (!subscription.markActive()) {
      throw new IllegalStateException("Subscription cannot be started: " + subscription);
    }
    try {
      workers.execute(new DeliveryWorker(subscription, metrics));
    } catch (RejectedExecutionException e) {
      subscription.cancel();
      subscription.markClosed();
      throw new IllegalStateException("MessageDispatcher has been closed", e);
    }
  }

  @Override
  public void onBatch(List<Message> batch) {
    for (Message message : batch) {
      dispatch(message);
    }
  }

  /**
   * Offers one message to every matching subscription.
   *
   * @param message the message to fan out
   * @return the number of subscriptions that accepted the message
   */
  public int dispatch(Message message) {
    if (!accepting.get()) {
      return 0;
    }
    int accepted = 0;
    for (Subscription subscription : registry.subscribersFor(message.channel())) {
      if (!subscription.isActive()) {
        continue;
      }
      if (subscription.offer(message)) {
        accepted++;
      } else if (subscription.isActive()) {
        metrics.incrementDropped();
        logger.log(Level.WARNING, "Queue full for subscription " + subscription.id()
            + "; dropped message id=" + message.id());
      }
    }
    return accepted;
  }

  /**
   * Cancels every registered subscription, then waits for their workers to exit within the
   * configured drain timeout before interrupting them.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    Collection<Subscription> remaining = registry.removeAll();
    for (Subscription subscription : remaining) {
      subscription.cancel();
    }
    metrics.recordActiveSubscriptions(0);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting delivery workers");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link MessageDispatcher}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the registry consulted for every dispatched message.
     *
     * <p><b>Required.</b>
     *
     * @param registry the subscription registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter for delivery, drop and handler-failure counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link MessageDispatcher#close()} waits for workers before interrupting them.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link MessageDispatcher} instance
     * @throws NullPointerException     if {@code registry} is null
     * @throws IllegalArgumentException if {@code drainTimeoutMs} is negative
     */
    public MessageDispatcher build() {
      return new MessageDispatcher(this);
    }
  }
}
