package cable.jdbc.store;

import cable.jdbc.JdbcTemplate;
import cable.jdbc.TableNames;
import cable.model.MessageRecord;
import cable.spi.MessageStore;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base JDBC message store with standard SQL implementations.
 *
 * <p>The table has columns {@code id} (generated, ascending), {@code channel}, {@code data},
 * {@code metadata} (JSON text or {@code NULL}) and {@code created_at}. {@code id} must be
 * the first column: some drivers return every column as generated keys. Subclasses provide
 * the dialect-specific DDL and may override the delete and size queries. Register custom
 * implementations via {@code META-INF/services/cable.jdbc.store.AbstractJdbcMessageStore}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore {

  protected static final JdbcTemplate.RowMapper<MessageRecord> MESSAGE_ROW_MAPPER = rs -> new MessageRecord(
      rs.getLong("id"),
      rs.getString("channel"),
      rs.getString("data"),
      rs.getString("metadata"),
      rs.getTimestamp("created_at").toInstant());

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcMessageStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcMessageStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcMessageStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to another table, keeping the codec.
   *
   * @param tableName the table to use
   * @return a new store of the same dialect
   */
  public abstract AbstractJdbcMessageStore withTableName(String tableName);

  /**
   * DDL run by {@link #createSchema}, each statement idempotent.
   */
  protected abstract List<String> schemaStatements();

  public String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public long insert(Connection conn, String channel, String payload, Map<String, String> metadata,
      Instant createdAt) {
    String sql = "INSERT INTO " + tableName() + " (channel, data, metadata, created_at) VALUES (?,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql,
        channel, payload, jsonCodec.toJson(metadata), Timestamp.from(createdAt));
  }

  @Override
  public List<MessageRecord> querySince(Connection conn, long lastId, int limit) {
    String sql = "SELECT id, channel, data, metadata, created_at FROM " + tableName() +
        " WHERE id > ? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, MESSAGE_ROW_MAPPER, lastId, limit);
  }

  /**
   * Subquery-based batch delete (H2 and PostgreSQL compatible).
   */
  @Override
  public int deleteOlderThan(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() + " WHERE created_at < ? ORDER BY id LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }

  @Override
  public long count(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + tableName(), 0L);
  }

  @Override
  public long maxId(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT MAX(id) FROM " + tableName(), 0L);
  }

  @Override
  public void createSchema(Connection conn) {
    JdbcTemplate.execute(conn, schemaStatements().toArray(String[]::new));
  }
}
