package cable.jdbc.store;

import cable.jdbc.JdbcTemplate;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL message store. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so batch deletes use
 * {@code DELETE...ORDER BY...LIMIT} directly. Size is read from
 * {@code information_schema.tables} and is an estimate maintained by the engine.
 */
public final class MySqlMessageStore extends AbstractJdbcMessageStore {

  public MySqlMessageStore() {
    super();
  }

  public MySqlMessageStore(String tableName) {
    super(tableName);
  }

  public MySqlMessageStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcMessageStore withTableName(String tableName) {
    return new MySqlMessageStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected List<String> schemaStatements() {
    String t = tableName();
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + t + " (" +
            "id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY, " +
            "channel VARCHAR(255) NOT NULL, " +
            "data MEDIUMTEXT NOT NULL, " +
            "metadata TEXT, " +
            "created_at DATETIME(6) NOT NULL, " +
            "INDEX idx_" + t + "_channel_id (channel, id), " +
            "INDEX idx_" + t + "_created_at (created_at))");
  }

  @Override
  public int deleteOlderThan(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE created_at < ? ORDER BY id LIMIT ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }

  @Override
  public long sizeBytes(Connection conn) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT data_length + index_length FROM information_schema.tables " +
            "WHERE table_schema = DATABASE() AND table_name = ?", -1L, tableName());
  }
}
