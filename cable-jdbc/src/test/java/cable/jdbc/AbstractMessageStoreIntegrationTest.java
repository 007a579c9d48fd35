package cable.jdbc;

import cable.SolidCable;
import cable.Subscription;
import cable.jdbc.store.AbstractJdbcMessageStore;
import cable.model.MessageRecord;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store behaviour shared by the real-database tests. Subclasses provide the DataSource
 * and a store whose table is empty before each test.
 */
abstract class AbstractMessageStoreIntegrationTest {

    abstract DataSource dataSource();

    abstract AbstractJdbcMessageStore store();

    @Test
    void insertAndQuerySince() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            long first = store().insert(conn, "orders", "{\"n\":1}", Map.of("source", "it"), Instant.now());
            long second = store().insert(conn, "orders", "{\"n\":2}", null, Instant.now());
            assertTrue(second > first);

            List<MessageRecord> rows = store().querySince(conn, 0, 10);
            assertEquals(2, rows.size());
            assertEquals(first, rows.get(0).id());
            assertEquals("orders", rows.get(0).channel());
            assertEquals("{\"n\":1}", rows.get(0).payload());
            assertTrue(rows.get(0).metadataJson().contains("\"source\""),
                    "Metadata should contain key: " + rows.get(0).metadataJson());
            assertNull(rows.get(1).metadataJson());

            assertEquals(List.of(second), store().querySince(conn, first, 10).stream()
                    .map(MessageRecord::id).toList());
            assertEquals(second, store().maxId(conn));
        }
    }

    @Test
    void deleteOlderThanInBatches() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            Instant old = Instant.now().minus(Duration.ofDays(3));
            for (int i = 0; i < 4; i++) {
                store().insert(conn, "c", "old", null, old);
            }
            store().insert(conn, "c", "fresh", null, Instant.now());
            Instant cutoff = Instant.now().minus(Duration.ofDays(1));

            assertEquals(3, store().deleteOlderThan(conn, cutoff, 3));
            assertEquals(1, store().deleteOlderThan(conn, cutoff, 3));
            assertEquals(0, store().deleteOlderThan(conn, cutoff, 3));
            assertEquals(1, store().count(conn));
        }
    }

    @Test
    void createSchemaIsIdempotent() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            store().createSchema(conn);
            store().createSchema(conn);
            assertEquals(0, store().count(conn));
        }
    }

    @Test
    void sizeIsReported() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            store().insert(conn, "c", "x".repeat(2048), null, Instant.now());
            assertTrue(store().sizeBytes(conn) >= 0);
        }
    }

    @Test
    void publishAndReceiveThroughBus() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> received = new AtomicReference<>();

        try (SolidCable cable = SolidCable.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource(), false))
                .messageStore(store())
                .pollIntervalMs(20)
                .retentionEnabled(false)
                .build()) {
            Subscription sub = cable.subscribe("orders", message -> {
                received.set(message.payload() + "|" + message.metadata().get("k"));
                latch.countDown();
            });

            cable.publishWithMetadata("orders", "hello", Map.of("k", "v"));

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals("hello|v", received.get());
            cable.unsubscribe(sub);
        }
    }
}
