package cable.jdbc.store;

import cable.jdbc.JdbcTemplate;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL message store.
 *
 * <p>{@code id} is a {@code BIGSERIAL}. Sequence values can become visible out of order
 * under concurrent inserts, so a poller may read a higher id before a lower one commits;
 * the lower id is then skipped. Size is reported with {@code pg_total_relation_size},
 * including indexes.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

  public PostgresMessageStore() {
    super();
  }

  public PostgresMessageStore(String tableName) {
    super(tableName);
  }

  public PostgresMessageStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcMessageStore withTableName(String tableName) {
    return new PostgresMessageStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected List<String> schemaStatements() {
    String t = tableName();
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + t + " (" +
            "id BIGSERIAL PRIMARY KEY, " +
            "channel VARCHAR(255) NOT NULL, " +
            "data TEXT NOT NULL, " +
            "metadata TEXT, " +
            "created_at TIMESTAMP NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_" + t + "_channel_id ON " + t + " (channel, id)",
        "CREATE INDEX IF NOT EXISTS idx_" + t + "_created_at ON " + t + " (created_at)");
  }

  @Override
  public long sizeBytes(Connection conn) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT pg_total_relation_size(CAST(? AS regclass))", -1L, tableName());
  }
}
