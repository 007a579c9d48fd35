package cable.spi;

import cable.model.MessageRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only, monotonically keyed message log.
 *
 * <p>All methods receive an explicit {@link Connection}; callers own the connection and its
 * auto-commit mode. Any ordered, keyed, durable store that can implement the four core
 * operations ({@link #insert}, {@link #querySince}, {@link #deleteOlderThan}, {@link #count})
 * can back the bus. Implementations live in the {@code cable-jdbc} module.
 *
 * <p>See {@code cable.jdbc.store.AbstractJdbcMessageStore} for the JDBC implementations.
 */
public interface MessageStore {

    /**
     * Appends a message and returns the id the store assigned to it.
     *
     * @param conn      the JDBC connection
     * @param channel   target channel, never empty
     * @param payload   opaque serialized payload
     * @param metadata  metadata map, may be {@code null} or empty
     * @param createdAt write timestamp used for retention
     * @return the generated id, strictly greater than every id assigned before it
     */
    long insert(Connection conn, String channel, String payload, Map<String, String> metadata, Instant createdAt);

    /**
     * Returns messages with {@code id > lastId}, ordered by id ascending.
     *
     * @param conn   the JDBC connection
     * @param lastId exclusive lower bound
     * @param limit  maximum number of rows
     * @return matching rows, oldest id first
     */
    List<MessageRecord> querySince(Connection conn, long lastId, int limit);

    /**
     * Deletes up to {@code limit} messages created strictly before {@code before}.
     *
     * @param conn   the JDBC connection
     * @param before exclusive age cutoff
     * @param limit  maximum number of rows deleted by this call
     * @return the number of rows deleted
     */
    int deleteOlderThan(Connection conn, Instant before, int limit);

    /**
     * Counts the messages currently stored.
     *
     * @param conn the JDBC connection
     * @return row count
     */
    long count(Connection conn);

    /**
     * Returns the highest id stored, used to position the poller cursor at startup.
     *
     * @param conn the JDBC connection
     * @return the maximum id, or {@code 0} if the store is empty
     */
    long maxId(Connection conn);

    /**
     * Reports the space the message log occupies.
     *
     * @param conn the JDBC connection
     * @return size in bytes, or {@code -1} if the store cannot report it
     */
    default long sizeBytes(Connection conn) {
        return -1L;
    }

    /**
     * Creates the message table and its indexes if they do not exist yet.
     *
     * @param conn the JDBC connection
     */
    default void createSchema(Connection conn) {
    }
}
