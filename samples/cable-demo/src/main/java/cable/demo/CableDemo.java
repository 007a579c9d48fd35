package cable.demo;

import cable.CableStats;
import cable.MessageHandler;
import cable.SolidCable;
import cable.Subscription;
import cable.jdbc.DataSourceConnectionProvider;
import cable.jdbc.store.JdbcMessageStores;

import org.h2.jdbcx.JdbcDataSource;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Publishes to two channels on an in-memory H2 database and prints what each subscriber
 * receives, including a wildcard subscriber and a broadcast.
 *
 * <p>Run with: {@code mvn install -DskipTests && mvn -pl samples/cable-demo exec:java
 * -Dexec.mainClass=cable.demo.CableDemo}
 */
public final class CableDemo {

  public static void main(String[] args) throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:cable_demo;DB_CLOSE_DELAY=-1");

    try (SolidCable cable = SolidCable.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .messageStore(JdbcMessageStores.detect(dataSource))
        .pollIntervalMs(50)
        .retention(Duration.ofHours(1))
        .build()) {

      // ── Subscribers ──────────────────────────────────────────────
      // orders: 2 messages + broadcast, users: 1 + broadcast, wildcard: all 4
      CountDownLatch latch = new CountDownLatch(9);

      Subscription orders = cable.subscribe("orders", printer("orders", latch));
      cable.subscribe("users", printer("users", latch));
      cable.subscribePattern(SolidCable.WILDCARD, printer("audit", latch));

      // ── Publish ──────────────────────────────────────────────────
      System.out.println("=== SolidCable Demo ===\n");
      cable.publish("orders", "{\"orderId\":1,\"item\":\"widget\"}");
      cable.publishWithMetadata("orders", "{\"orderId\":2,\"item\":\"gadget\"}",
          Map.of("source", "checkout"));
      cable.publish("users", "{\"userId\":42,\"action\":\"signup\"}");
      cable.broadcast("{\"notice\":\"maintenance at 02:00\"}");

      boolean completed = latch.await(5, TimeUnit.SECONDS);
      System.out.println(completed
          ? "\nAll messages delivered."
          : "\nTimeout: some messages were not delivered.");

      // ── Stats ────────────────────────────────────────────────────
      CableStats stats = cable.getStats();
      System.out.printf("%nChannels: %s%n", stats.channels());
      System.out.printf("Subscriptions: %d, stored messages: %d, last id: %d%n",
          stats.totalSubscriptions(), stats.totalMessages(), stats.lastMessageId());

      cable.unsubscribe(orders);
      System.out.printf("After unsubscribe, 'orders' exists: %s%n", cable.channelExists("orders"));
    }
  }

  private static MessageHandler printer(String name, CountDownLatch latch) {
    return message -> {
      System.out.printf("[%-6s] #%d %-6s %s %s%n", name, message.id(), message.channel(),
          message.payload(), message.metadata().isEmpty() ? "" : message.metadata());
      latch.countDown();
    };
  }
}
