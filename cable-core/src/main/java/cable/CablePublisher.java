package cable;

import cable.spi.ConnectionProvider;
import cable.spi.MessageStore;
import cable.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes messages to the store in their own auto-committed statement.
 *
 * <p>A call returns only after the store acknowledged the insert, so a returned id is
 * durable. Delivery happens later, once the poller reads the row.
 *
 * @see SolidCable#publish
 * @see cable.spi.MessageStore#insert
 */
public final class CablePublisher {
    private static final Logger logger = Logger.getLogger(CablePublisher.class.getName());

    private final ConnectionProvider connectionProvider;
    private final MessageStore messageStore;
    private final MetricsExporter metrics;

    /**
     * Creates a publisher.
     *
     * @param connectionProvider source of connections, one per publish
     * @param messageStore       the message log
     * @param metrics            exporter for publish counters; {@code null} defaults to
     *                           {@link MetricsExporter#NOOP}
     */
    public CablePublisher(
            ConnectionProvider connectionProvider,
            MessageStore messageStore,
            MetricsExporter metrics
    ) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.messageStore = Objects.requireNonNull(messageStore, "messageStore");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Appends a message to the store.
     *
     * @param channel  target channel, non-empty; {@code "*"} reaches every subscription
     * @param payload  serialized payload, not interpreted by the bus
     * @param metadata optional metadata, may be {@code null}
     * @return the id the store assigned
     * @throws NullPointerException     if {@code channel} or {@code payload} is null
     * @throws IllegalArgumentException if {@code channel} is empty
     * @throws PublishException         if the store fails the write
     */
    public long publish(String channel, String payload, Map<String, String> metadata) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        if (channel.isEmpty()) {
            throw new IllegalArgumentException("channel cannot be empty");
        }

        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            long id = messageStore.insert(conn, channel, payload, metadata, Instant.now());
            metrics.incrementPublished();
            logger.log(Level.FINE, "Published message id={0} to channel {1}", new Object[]{id, channel});
            return id;
        } catch (SQLException | RuntimeException e) {
            metrics.incrementPublishFailure();
            throw new PublishException(channel, e);
        }
    }
}
