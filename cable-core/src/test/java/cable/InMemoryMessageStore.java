package cable;

import cable.model.MessageRecord;
import cable.spi.ConnectionProvider;
import cable.spi.MessageStore;
import cable.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * List-backed MessageStore for unit tests that don't need real JDBC.
 */
public class InMemoryMessageStore implements MessageStore {
  private final List<MessageRecord> rows = new ArrayList<>();
  private final AtomicLong sequence = new AtomicLong();
  public final AtomicInteger queryCount = new AtomicInteger();
  public volatile boolean failQueries;
  public volatile boolean failInserts;

  /** Connection provider whose connections ignore every call. */
  public static ConnectionProvider stubCp() {
    return () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  @Override
  public synchronized long insert(Connection conn, String channel, String payload,
      Map<String, String> metadata, Instant createdAt) {
    if (failInserts) {
      throw new IllegalStateException("insert failed");
    }
    long id = sequence.incrementAndGet();
    rows.add(new MessageRecord(id, channel, payload, JsonCodec.getDefault().toJson(metadata), createdAt));
    return id;
  }

  /** Adds a row with an explicit metadata column, bypassing encoding. */
  public synchronized long insertRaw(String channel, String payload, String metadataJson, Instant createdAt) {
    long id = sequence.incrementAndGet();
    rows.add(new MessageRecord(id, channel, payload, metadataJson, createdAt));
    return id;
  }

  @Override
  public synchronized List<MessageRecord> querySince(Connection conn, long lastId, int limit) {
    queryCount.incrementAndGet();
    if (failQueries) {
      throw new IllegalStateException("query failed");
    }
    List<MessageRecord> result = new ArrayList<>();
    for (MessageRecord row : rows) {
      if (row.id() > lastId && result.size() < limit) {
        result.add(row);
      }
    }
    return result;
  }

  @Override
  public synchronized int deleteOlderThan(Connection conn, Instant before, int limit) {
    int deleted = 0;
    var it = rows.iterator();
    while (it.hasNext() && deleted < limit) {
      if (it.next().createdAt().isBefore(before)) {
        it.remove();
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public synchronized long count(Connection conn) {
    return rows.size();
  }

  @Override
  public synchronized long maxId(Connection conn) {
    return rows.isEmpty() ? 0 : rows.get(rows.size() - 1).id();
  }
}
