package cable.jdbc;

import cable.CableStats;
import cable.Message;
import cable.SolidCable;
import cable.Subscription;
import cable.jdbc.store.AbstractJdbcMessageStore;
import cable.jdbc.store.H2MessageStore;
import cable.purge.RetentionSweeper;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end bus behaviour over an in-memory H2 database.
 */
class SolidCableH2Test {
  private JdbcDataSource dataSource;
  private final AbstractJdbcMessageStore store = new H2MessageStore();
  private SolidCable cable;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:cable_e2e_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    cable = SolidCable.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .messageStore(store)
        .pollIntervalMs(20)
        .build();
  }

  @AfterEach
  void tearDown() throws SQLException {
    cable.close();
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("SHUTDOWN");
    }
  }

  @Test
  void twoSubscribersReceiveMessagesInOrder() throws Exception {
    List<String> first = new CopyOnWriteArrayList<>();
    List<String> second = new CopyOnWriteArrayList<>();
    CountDownLatch latch = new CountDownLatch(4);
    cable.subscribe("orders", m -> { first.add(m.payload()); latch.countDown(); });
    cable.subscribe("orders", m -> { second.add(m.payload()); latch.countDown(); });

    long id1 = cable.publish("orders", "1");
    long id2 = cable.publish("orders", "2");

    assertTrue(id2 > id1);
    assertTrue(latch.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("1", "2"), first);
    assertEquals(List.of("1", "2"), second);
  }

  @Test
  void wildcardSubscriberSeesEveryChannel() throws Exception {
    List<Message> all = new CopyOnWriteArrayList<>();
    List<Message> other = new CopyOnWriteArrayList<>();
    CountDownLatch latch = new CountDownLatch(3);
    cable.subscribePattern(SolidCable.WILDCARD, m -> { all.add(m); latch.countDown(); });
    cable.subscribe("other", m -> { other.add(m); latch.countDown(); });

    cable.publish("orders", "o");
    cable.broadcast("b");

    assertTrue(latch.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("o", "b"), all.stream().map(Message::payload).toList());
    assertEquals(1, other.size());
    assertTrue(other.get(0).isBroadcast());
  }

  @Test
  void channelsAreIsolated() throws Exception {
    List<String> a = new CopyOnWriteArrayList<>();
    CountDownLatch bDone = new CountDownLatch(1);
    cable.subscribe("a", m -> a.add(m.payload()));
    cable.subscribe("b", m -> bDone.countDown());

    cable.publish("b", "for-b");

    assertTrue(bDone.await(5, TimeUnit.SECONDS));
    assertTrue(a.isEmpty());
  }

  @Test
  void metadataRoundTripsThroughStore() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    List<Message> received = new CopyOnWriteArrayList<>();
    cable.subscribe("orders", m -> { received.add(m); latch.countDown(); });

    cable.publishWithMetadata("orders", "{}", Map.of("trace", "t-1", "user", "42"));

    assertTrue(latch.await(5, TimeUnit.SECONDS));
    assertEquals(Map.of("trace", "t-1", "user", "42"), received.get(0).metadata());
  }

  @Test
  void unsubscribedHandlerGetsNothingMore() throws Exception {
    List<String> received = new CopyOnWriteArrayList<>();
    CountDownLatch first = new CountDownLatch(1);
    Subscription sub = cable.subscribe("orders", m -> { received.add(m.payload()); first.countDown(); });

    cable.publish("orders", "before");
    assertTrue(first.await(5, TimeUnit.SECONDS));

    cable.unsubscribe(sub);
    assertFalse(cable.channelExists("orders"));

    CountDownLatch probe = new CountDownLatch(1);
    cable.subscribe("probe", m -> probe.countDown());
    cable.publish("orders", "after");
    cable.publish("probe", "p");
    assertTrue(probe.await(5, TimeUnit.SECONDS));

    assertEquals(List.of("before"), received);
  }

  @Test
  void statsReflectSubscriptionsAndStoredMessages() throws Exception {
    cable.subscribe("orders", m -> { });
    cable.subscribe("orders", m -> { });
    cable.subscribe("users", m -> { });
    CountDownLatch latch = new CountDownLatch(1);
    cable.subscribe("last", m -> latch.countDown());

    cable.publish("orders", "1");
    long last = cable.publish("last", "2");
    assertTrue(latch.await(5, TimeUnit.SECONDS));

    CableStats stats = cable.getStats();
    assertEquals(4, stats.totalSubscriptions());
    assertEquals(3, stats.totalChannels());
    assertEquals(2, stats.channels().get("orders"));
    assertEquals(2, stats.totalMessages());
    assertEquals(last, stats.lastMessageId());
    assertTrue(stats.storeSizeBytes() >= 0);
    assertEquals(List.of("orders", "users", "last"), cable.listChannels());
  }

  @Test
  void sweeperDeletesOnlyExpiredMessages() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, "orders", "stale", null, Instant.now().minus(Duration.ofHours(25)));
    }
    cable.publish("orders", "fresh");

    RetentionSweeper sweeper = RetentionSweeper.builder()
        .connectionProvider(dataSource::getConnection)
        .messageStore(store)
        .retention(Duration.ofHours(24))
        .build();

    assertEquals(1, sweeper.runOnce());
    assertEquals(1, cable.getStats().totalMessages());
  }

  @Test
  void closeStopsDeliveryAndRejectsPublish() throws Exception {
    cable.subscribe("orders", m -> { });
    cable.close();

    assertThrows(IllegalStateException.class, () -> cable.publish("orders", "x"));
    assertThrows(IllegalStateException.class, () -> cable.subscribe("orders", m -> { }));
    assertDoesNotThrow(cable::close);
  }
}
