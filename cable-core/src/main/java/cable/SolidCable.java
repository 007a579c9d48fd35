package cable;

import cable.dispatch.MessageDispatcher;
import cable.poller.MessagePoller;
import cable.purge.RetentionSweeper;
import cable.registry.DefaultSubscriptionRegistry;
import cable.registry.SubscriptionRegistry;
import cable.spi.ConnectionProvider;
import cable.spi.MessageStore;
import cable.spi.MetricsExporter;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable publish/subscribe bus over a {@link MessageStore}.
 *
 * <p>Wires a {@link CablePublisher}, {@link MessagePoller}, {@link MessageDispatcher} and
 * optional {@link RetentionSweeper} into a single {@link AutoCloseable} unit. Publishing
 * appends a row to the store; the poller reads new rows on a fixed delay and the dispatcher
 * fans them out to the subscriptions registered on the message's channel and on the
 * wildcard channel {@code "*"}. A message published on {@code "*"} reaches every
 * subscription.
 *
 * <p>Delivery is at-most-once and best-effort: messages written before {@link Builder#build()}
 * are never delivered, a subscriber whose queue is full misses messages, and a subscription
 * made while a batch is in flight may miss that batch.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SolidCable cable = SolidCable.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .messageStore(JdbcMessageStores.detect(dataSource))
 *     .build()) {
 *
 *   Subscription sub = cable.subscribe("orders", message ->
 *       System.out.println("Received: " + message.payload()));
 *
 *   cable.publish("orders", "{\"orderId\":1}");
 *   // ...
 *   cable.unsubscribe(sub);
 * }
 * }</pre>
 *
 * @see SolidCable.Builder
 * @see Subscription
 */
public final class SolidCable implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SolidCable.class.getName());

  /** Broadcast channel name. */
  public static final String WILDCARD = SubscriptionRegistry.WILDCARD;

  private final ConnectionProvider connectionProvider;
  private final MessageStore messageStore;
  private final SubscriptionRegistry registry;
  private final CablePublisher publisher;
  private final MessageDispatcher dispatcher;
  private final MessagePoller poller;
  private final RetentionSweeper sweeper;
  private final MetricsExporter metrics;
  private final int queueCapacity;
  private final Object lifecycleLock = new Object();
  private volatile boolean closed;

  private SolidCable(Builder builder, MessageDispatcher dispatcher, MessagePoller poller,
      RetentionSweeper sweeper) {
    this.connectionProvider = builder.connectionProvider;
    this.messageStore = builder.messageStore;
    this.registry = builder.registry;
    this.metrics = builder.metrics;
    this.queueCapacity = builder.queueCapacity;
    this.publisher = new CablePublisher(connectionProvider, messageStore, metrics);
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.sweeper = sweeper;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Publishing ───────────────────────────────────────────────────

  /**
   * Publishes a message to a channel.
   *
   * @param channel target channel, non-empty
   * @param payload serialized payload
   * @return the store-assigned message id
   * @throws PublishException      if the store fails the write
   * @throws IllegalStateException if the bus is closed
   */
  public long publish(String channel, String payload) {
    return publishWithMetadata(channel, payload, null);
  }

  /**
   * Publishes a message with metadata to a channel.
   *
   * @param channel  target channel, non-empty
   * @param payload  serialized payload
   * @param metadata metadata delivered alongside the payload, may be {@code null}
   * @return the store-assigned message id
   * @throws PublishException      if the store fails the write
   * @throws IllegalStateException if the bus is closed
   */
  public long publishWithMetadata(String channel, String payload, Map<String, String> metadata) {
    ensureOpen();
    return publisher.publish(channel, payload, metadata);
  }

  /**
   * Publishes a message to every subscription regardless of channel.
   *
   * @param payload serialized payload
   * @return the store-assigned message id
   * @throws PublishException      if the store fails the write
   * @throws IllegalStateException if the bus is closed
   */
  public long broadcast(String payload) {
    return publish(WILDCARD, payload);
  }

  // ── Subscribing ──────────────────────────────────────────────────

  /**
   * Registers a handler on a channel and starts its delivery worker.
   *
   * <p>Subscribing to {@code "*"} receives messages from every channel.
   *
   * @param channel exact channel name or {@code "*"}
   * @param handler the message callback
   * @return the active subscription
   * @throws IllegalStateException if the bus is closed
   */
  public Subscription subscribe(String channel, MessageHandler handler) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(handler, "handler");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel cannot be empty");
    }
    synchronized (lifecycleLock) {
      ensureOpen();
      Subscription subscription = new Subscription(channel, handler, queueCapacity);
      dispatcher.startWorker(subscription);
      registry.add(subscription);
      metrics.recordActiveSubscriptions(registry.totalSubscriptions());
      logger.log(Level.FINE, "Subscribed {0}", subscription.id());
      return subscription;
    }
  }

  /**
   * Subscribes by pattern. Only {@code "*"} has pattern meaning; any other value is treated
   * as an exact channel name.
   *
   * @param pattern {@code "*"} or an exact channel name
   * @param handler the message callback
   * @return the active subscription
   */
  public Subscription subscribePattern(String pattern, MessageHandler handler) {
    return subscribe(pattern, handler);
  }

  /**
   * Cancels a subscription and removes it from its channel. Calling it again for the same
   * subscription has no effect.
   *
   * @param subscription the subscription returned by {@link #subscribe}
   * @throws NullSubscriptionException if {@code subscription} is null
   */
  public void unsubscribe(Subscription subscription) {
    if (subscription == null) {
      throw new NullSubscriptionException();
    }
    subscription.cancel();
    if (registry.remove(subscription)) {
      metrics.recordActiveSubscriptions(registry.totalSubscriptions());
      logger.log(Level.FINE, "Unsubscribed {0}", subscription.id());
    }
  }

  // ── Introspection ────────────────────────────────────────────────

  public boolean channelExists(String channel) {
    return registry.channelExists(channel);
  }

  public List<String> listChannels() {
    return registry.channels();
  }

  public int getSubscriptionCount(String channel) {
    return registry.subscriptionCount(channel);
  }

  /**
   * Returns subscription counts, stored message count, cursor and store size.
   *
   * @return a point-in-time snapshot
   * @throws CableException if the message count cannot be read
   */
  public CableStats getStats() {
    Map<String, Integer> channels = registry.channelCounts();
    long total;
    long size;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      total = messageStore.count(conn);
      size = sizeBytes(conn);
    } catch (SQLException | RuntimeException e) {
      throw new CableException("Failed to read message statistics", e);
    }
    return new CableStats(registry.totalSubscriptions(), channels.size(), channels,
        total, poller.cursor(), size);
  }

  private long sizeBytes(Connection conn) {
    try {
      return messageStore.sizeBytes(conn);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Store size unavailable", e);
      return -1L;
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("SolidCable has been closed");
    }
  }

  /**
   * Shuts down in order: sweeper, poller, subscriptions and their workers, connection
   * provider, metrics exporter. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    RuntimeException first = null;
    if (sweeper != null) {
      try {
        sweeper.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      poller.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    first = closeQuietly(connectionProvider, first);
    first = closeQuietly(metrics, first);
    logger.info("SolidCable closed");
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(Object resource, RuntimeException first) {
    if (resource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new CableException("Close failed", e);
        if (first == null) return re;
        first.addSuppressed(re);
      }
    }
    return first;
  }

  /**
   * Builder for {@link SolidCable}. Single use: {@link #build()} may be called once.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MessageStore messageStore;
    private SubscriptionRegistry registry;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private long pollIntervalMs = 100;
    private int batchSize = 100;
    private int queueCapacity = 100;
    private boolean retentionEnabled = true;
    private Duration retention = Duration.ofHours(24);
    private long sweepIntervalSeconds = 300;
    private int purgeBatchSize = 500;
    private long drainTimeoutMs = 5000;
    private boolean createSchema = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the connection provider shared by publishing, polling, sweeping and stats.
     *
     * <p><b>Required.</b> Closed with the bus if it implements {@link AutoCloseable}.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the message log.
     *
     * <p><b>Required.</b>
     *
     * @param messageStore the persistence backend
     * @return this builder
     */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /**
     * Sets the subscription registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultSubscriptionRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter. Closed with the bus if it implements {@link AutoCloseable}.
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
     * Sets the codec used to decode message metadata read from the store.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the JSON codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the delay between poll cycles.
     *
     * <p>Optional. Defaults to {@code 100} ms.
     *
     * @param pollIntervalMs polling interval in milliseconds
     * @return this builder
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * Sets the maximum number of messages read per poll cycle.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param batchSize max messages per poll
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the capacity of each subscription's delivery queue.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param queueCapacity max queued messages per subscription
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how long messages are kept before the sweeper deletes them.
     *
     * <p>Optional. Defaults to {@code 24 hours}.
     *
     * @param retention the retention window
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Enables or disables the retention sweeper.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param retentionEnabled whether expired messages are deleted
     * @return this builder
     */
    public Builder retentionEnabled(boolean retentionEnabled) {
      this.retentionEnabled = retentionEnabled;
      return this;
    }

    /**
     * Sets the interval between retention sweeps.
     *
     * <p>Optional. Defaults to {@code 300} seconds.
     *
     * @param sweepIntervalSeconds sweep interval in seconds
     * @return this builder
     */
    public Builder sweepIntervalSeconds(long sweepIntervalSeconds) {
      this.sweepIntervalSeconds = sweepIntervalSeconds;
      return this;
    }

    /**
     * Sets the maximum number of rows deleted per sweep statement.
     *
     * <p>Optional. Defaults to {@code 500}.
     *
     * @param purgeBatchSize max rows per delete
     * @return this builder
     */
    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    /**
     * Sets how long {@link SolidCable#close()} waits for delivery workers to exit.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Controls whether {@link MessageStore#createSchema} runs during {@link #build()}.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param createSchema whether to create the message table if missing
     * @return this builder
     */
    public Builder createSchema(boolean createSchema) {
      this.createSchema = createSchema;
      return this;
    }

    /**
     * Builds and starts the bus: creates the schema if enabled, positions the poller at the
     * newest stored message and starts the poller and sweeper.
     *
     * @return a running {@link SolidCable}
     * @throws NullPointerException     if {@code connectionProvider} or {@code messageStore} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     * @throws CableException           if the store cannot be reached
     * @throws IllegalStateException    if this builder was already used
     */
    public SolidCable build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(messageStore, "messageStore");
      if (queueCapacity <= 0) {
        throw new IllegalArgumentException("queueCapacity must be > 0");
      }
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      if (registry == null) {
        registry = new DefaultSubscriptionRegistry();
      }
      if (metrics == null) {
        metrics = MetricsExporter.NOOP;
      }
      if (createSchema) {
        createSchema();
      }

      MessageDispatcher dispatcher = MessageDispatcher.builder()
          .registry(registry)
          .metrics(metrics)
          .drainTimeoutMs(drainTimeoutMs)
          .build();
      MessagePoller poller;
      RetentionSweeper sweeper = null;
      try {
        poller = MessagePoller.builder()
            .connectionProvider(connectionProvider)
            .messageStore(messageStore)
            .handler(dispatcher)
            .batchSize(batchSize)
            .intervalMs(pollIntervalMs)
            .metrics(metrics)
            .jsonCodec(jsonCodec)
            .build();
        if (retentionEnabled) {
          sweeper = RetentionSweeper.builder()
              .connectionProvider(connectionProvider)
              .messageStore(messageStore)
              .metrics(metrics)
              .retention(retention)
              .intervalSeconds(sweepIntervalSeconds)
              .batchSize(purgeBatchSize)
              .build();
        }
      } catch (RuntimeException e) {
        dispatcher.close();
        throw e;
      }
      try {
        poller.start();
        if (sweeper != null) {
          sweeper.start();
        }
      } catch (RuntimeException e) {
        if (sweeper != null) {
          sweeper.close();
        }
        poller.close();
        dispatcher.close();
        throw e;
      }
      logger.log(Level.INFO, "SolidCable started (poll={0}ms, batch={1}, retention={2})",
          new Object[]{pollIntervalMs, batchSize, retentionEnabled ? retention : "disabled"});
      return new SolidCable(this, dispatcher, poller, sweeper);
    }

    private void createSchema() {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        messageStore.createSchema(conn);
      } catch (SQLException | RuntimeException e) {
        throw new CableException("Failed to create message schema", e);
      }
    }
  }
}
