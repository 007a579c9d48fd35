package cable.purge;

import cable.InMemoryMessageStore;
import cable.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetentionSweeperTest {

  private final InMemoryMessageStore store = new InMemoryMessageStore();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private RetentionSweeper.Builder sweeper() {
    return RetentionSweeper.builder()
        .connectionProvider(InMemoryMessageStore.stubCp())
        .messageStore(store)
        .metrics(metrics)
        .retention(Duration.ofHours(1));
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> RetentionSweeper.builder().build());
    assertThrows(IllegalArgumentException.class, () -> sweeper().retention(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> sweeper().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> sweeper().intervalSeconds(0).build());
  }

  @Test
  void deletesOnlyExpiredMessages() {
    Instant old = Instant.now().minus(Duration.ofHours(2));
    store.insert(null, "c", "old-1", null, old);
    store.insert(null, "c", "old-2", null, old);
    store.insert(null, "c", "fresh", null, Instant.now());

    try (RetentionSweeper s = sweeper().build()) {
      assertEquals(2, s.runOnce());
    }

    assertEquals(1, store.count(null));
    assertEquals(2, metrics.purged.get());
  }

  @Test
  void deletesInBatchesUntilShortBatch() {
    Instant old = Instant.now().minus(Duration.ofDays(2));
    for (int i = 0; i < 7; i++) {
      store.insert(null, "c", "m" + i, null, old);
    }
    int[] calls = {0};
    InMemoryMessageStore counting = new InMemoryMessageStore() {
      @Override
      public synchronized int deleteOlderThan(Connection conn, Instant before, int limit) {
        calls[0]++;
        return store.deleteOlderThan(conn, before, limit);
      }
    };

    try (RetentionSweeper s = sweeper().messageStore(counting).batchSize(3).build()) {
      assertEquals(7, s.runOnce());
    }
    assertEquals(3, calls[0]);
    assertEquals(0, store.count(null));
  }

  @Test
  void nothingToDeleteRecordsNothing() {
    store.insert(null, "c", "fresh", null, Instant.now());
    try (RetentionSweeper s = sweeper().build()) {
      assertEquals(0, s.runOnce());
    }
    assertEquals(0, metrics.purged.get());
  }

  @Test
  void storeFailureIsContained() {
    InMemoryMessageStore failing = new InMemoryMessageStore() {
      @Override
      public synchronized int deleteOlderThan(Connection conn, Instant before, int limit) {
        throw new IllegalStateException("down");
      }
    };
    try (RetentionSweeper s = sweeper().messageStore(failing).build()) {
      assertEquals(0, s.runOnce());
    }
  }

  @Test
  void closedSweeperDoesNothing() {
    store.insert(null, "c", "old", null, Instant.now().minus(Duration.ofDays(1)));
    RetentionSweeper s = sweeper().build();
    s.close();
    assertEquals(0, s.runOnce());
    assertThrows(IllegalStateException.class, s::start);
  }
}
