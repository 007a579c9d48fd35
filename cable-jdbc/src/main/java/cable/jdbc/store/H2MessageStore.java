package cable.jdbc.store;

import cable.jdbc.JdbcTemplate;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * H2 message store. Primarily for testing and the demo.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

  public H2MessageStore() {
    super();
  }

  public H2MessageStore(String tableName) {
    super(tableName);
  }

  public H2MessageStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcMessageStore withTableName(String tableName) {
    return new H2MessageStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected List<String> schemaStatements() {
    String t = tableName();
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + t + " (" +
            "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
            "channel VARCHAR(255) NOT NULL, " +
            "data CLOB NOT NULL, " +
            "metadata CLOB, " +
            "created_at TIMESTAMP NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_" + t + "_channel_id ON " + t + " (channel, id)",
        "CREATE INDEX IF NOT EXISTS idx_" + t + "_created_at ON " + t + " (created_at)");
  }

  @Override
  public long sizeBytes(Connection conn) {
    return JdbcTemplate.queryForLong(conn,
        "SELECT DISK_SPACE_USED('" + tableName().toUpperCase() + "')", -1L);
  }
}
