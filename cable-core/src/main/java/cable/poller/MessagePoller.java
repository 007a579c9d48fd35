package cable.poller;

import cable.CableException;
import cable.Message;
import cable.model.MessageRecord;
import cable.spi.ConnectionProvider;
import cable.spi.MessageStore;
import cable.spi.MetricsExporter;
import cable.util.DaemonThreadFactory;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled reader that pulls new messages from the store and hands them to a
 * {@link MessagePollerHandler}.
 *
 * <p>The poller owns the read cursor: the highest message id it has handed on. Each cycle
 * reads up to {@code batchSize} rows with {@code id > cursor}, advances the cursor to the
 * last id in the batch and passes the batch on. On {@link #start()} the cursor is positioned
 * at the store's current maximum id, so messages written before startup are not delivered.
 *
 * <p>A failed cycle is logged and the cursor stays put; the next cycle retries from the same
 * position. A single row that cannot form a {@link Message} (null channel or payload) is
 * logged and skipped, and the cursor moves past it.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see MessagePoller.Builder
 * @see MessagePollerHandler
 */
public final class MessagePoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(MessagePoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final MessageStore messageStore;
    private final MessagePollerHandler handler;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final JsonCodec jsonCodec;
    private final ReentrantLock pollLock = new ReentrantLock();

    private volatile long lastSeenId;
    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private MessagePoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.messageStore = Objects.requireNonNull(builder.messageStore, "messageStore");
        this.handler = Objects.requireNonNull(builder.handler, "handler");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }

        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Positions the cursor at the store's current maximum id and starts the polling schedule.
     * Subsequent calls are no-ops if already started.
     *
     * @throws CableException if the store cannot be read
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("MessagePoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        lastSeenId = readMaxId();
        metrics.recordCursor(lastSeenId);
        logger.log(Level.INFO, "Message poller starting at id {0}", lastSeenId);
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("cable-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private long readMaxId() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return messageStore.maxId(conn);
        } catch (SQLException | RuntimeException e) {
            throw new CableException("Failed to read the latest message id", e);
        }
    }

    /**
     * Executes a single poll cycle. Called automatically by the scheduler, but may also be
     * invoked directly for testing. Overlapping calls are skipped.
     */
    public void poll() {
        if (closed || !pollLock.tryLock()) {
            return;
        }
        try {
            List<MessageRecord> rows = fetchRows();
            if (rows == null) {
                return; // fetch failed, retry from the same cursor
            }
            if (rows.isEmpty()) {
                metrics.recordPollLagMs(0);
                return;
            }

            List<Message> batch = new ArrayList<>(rows.size());
            for (MessageRecord row : rows) {
                Message message = toMessage(row);
                if (message != null) {
                    batch.add(message);
                }
            }
            lastSeenId = rows.get(rows.size() - 1).id();
            metrics.recordCursor(lastSeenId);
            long lagMs = Duration.between(rows.get(0).createdAt(), Instant.now()).toMillis();
            metrics.recordPollLagMs(Math.max(0L, lagMs));

            if (!batch.isEmpty()) {
                handler.onBatch(batch);
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        } finally {
            pollLock.unlock();
        }
    }

    /**
     * Returns {@code null} on failure to distinguish it from an empty result.
     */
    private List<MessageRecord> fetchRows() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return messageStore.querySince(conn, lastSeenId, batchSize);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch messages after id " + lastSeenId, e);
            return null;
        }
    }

    /**
     * Returns {@code null} for a row that cannot form a message; the cursor still moves past it.
     */
    private Message toMessage(MessageRecord row) {
        Map<String, String> metadata;
        try {
            metadata = jsonCodec.parseObject(row.metadataJson());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Undecodable metadata on message id=" + row.id()
                + "; delivering without metadata", e);
            metadata = Map.of();
        }
        try {
            return new Message(row.id(), row.channel(), row.payload(), metadata, row.createdAt());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Skipping malformed message id=" + row.id(), e);
            return null;
        }
    }

    /**
     * Returns the id of the last message handed to the handler.
     *
     * @return the current cursor
     */
    public long cursor() {
        return lastSeenId;
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
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

    /**
     * Builder for {@link MessagePoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private MessageStore messageStore;
        private MessagePollerHandler handler;
        private int batchSize = 100;
        private long intervalMs = 100;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;

        private Builder() {
        }

        /**
         * Sets the connection provider used for every poll.
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
         * Sets the store to read messages from.
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
         * Sets the receiver of polled batches, normally the {@link cable.dispatch.MessageDispatcher}.
         *
         * <p><b>Required.</b>
         *
         * @param handler the batch callback
         * @return this builder
         */
        public Builder handler(MessagePollerHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the maximum number of messages read per cycle.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize max messages per poll
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the delay between the end of one cycle and the start of the next.
         *
         * <p>Optional. Defaults to {@code 100} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter for the cursor and lag gauges.
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
         * Sets the codec used to decode message metadata.
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
         * Builds the poller. Call {@link MessagePoller#start()} to begin polling.
         *
         * @return a new {@link MessagePoller} instance
         * @throws NullPointerException     if {@code connectionProvider}, {@code messageStore}
         *                                  or {@code handler} is null
         * @throws IllegalArgumentException if {@code batchSize <= 0} or {@code intervalMs <= 0}
         */
        public MessagePoller build() {
            return new MessagePoller(this);
        }
    }
}
