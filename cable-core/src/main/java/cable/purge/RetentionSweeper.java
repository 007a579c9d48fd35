package cable.purge;

import cable.spi.ConnectionProvider;
import cable.spi.MessageStore;
import cable.spi.MetricsExporter;
import cable.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes messages older than a retention window.
 *
 * <p>Each cycle deletes in batches (default 500) until fewer than {@code batchSize} rows are
 * deleted, then sleeps until the next interval. Each batch uses its own auto-committed
 * connection to limit lock duration. Deletion runs independently of delivery: a message can
 * expire before a slow subscriber's queue reaches it, which only matters for messages the
 * poller has not read yet.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see RetentionSweeper.Builder
 * @see MessageStore#deleteOlderThan
 */
public final class RetentionSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionSweeper.class.getName());

  private final ConnectionProvider connectionProvider;
  private final MessageStore messageStore;
  private final MetricsExporter metrics;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private RetentionSweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.messageStore = Objects.requireNonNull(builder.messageStore, "messageStore");

    if (builder.retention != null && (builder.retention.isNegative() || builder.retention.isZero())) {
      throw new IllegalArgumentException("retention must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.retention = builder.retention != null ? builder.retention : Duration.ofHours(24);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled sweep loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("cable-sweeper-"));
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single sweep cycle, deleting batches until fewer than {@code batchSize} rows
   * are deleted. Each batch uses its own connection.
   *
   * <p>May be invoked directly for testing or one-off cleanups.
   *
   * @return the number of messages deleted in this cycle
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    long totalDeleted = 0;
    try {
      Instant cutoff = Instant.now().minus(retention);
      int deleted;
      do {
        deleted = deleteBatch(cutoff);
        totalDeleted += deleted;
      } while (deleted >= batchSize && !closed);
      if (totalDeleted > 0) {
        metrics.recordPurged(totalDeleted);
        logger.log(Level.INFO, "Deleted {0} messages older than {1}",
            new Object[]{totalDeleted, cutoff});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retention sweep failed", t);
    }
    return totalDeleted;
  }

  private int deleteBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return messageStore.deleteOlderThan(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for retention sweep", e);
      return 0;
    }
  }

  /** Cancels the sweep schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RetentionSweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private MessageStore messageStore;
    private MetricsExporter metrics;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 300;

    private Builder() {}

    /**
     * Sets the connection provider for obtaining JDBC connections during sweeps.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store whose expired messages are deleted.
     *
     * <p><b>Required.</b>
     *
     * @param messageStore the message log
     * @return this builder
     */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /**
     * Sets the metrics exporter for the purged counter.
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
     * Sets the retention window. Messages created longer ago than this are deleted.
     *
     * <p>Optional. Defaults to {@code 24 hours}. Must be &gt; 0.
     *
     * @param retention the retention duration
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the maximum number of messages deleted per statement.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize max messages per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the interval in seconds between sweeps.
     *
     * <p>Optional. Defaults to {@code 300} (5 minutes). Must be &gt; 0.
     *
     * @param intervalSeconds sweep interval in seconds
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * Builds the sweeper. Call {@link RetentionSweeper#start()} to begin.
     *
     * @return a new {@link RetentionSweeper} instance
     * @throws NullPointerException if {@code connectionProvider} or {@code messageStore} is null
     * @throws IllegalArgumentException if {@code retention} is not positive,
     *     {@code batchSize <= 0}, or {@code intervalSeconds <= 0}
     */
    public RetentionSweeper build() {
      return new RetentionSweeper(this);
    }
  }
}
