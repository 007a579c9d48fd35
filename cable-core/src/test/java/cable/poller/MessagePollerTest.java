package cable.poller;

import cable.CableException;
import cable.InMemoryMessageStore;
import cable.Message;
import cable.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessagePollerTest {

  private final InMemoryMessageStore store = new InMemoryMessageStore();
  private final List<Message> received = new CopyOnWriteArrayList<>();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private MessagePoller.Builder poller() {
    return MessagePoller.builder()
        .connectionProvider(InMemoryMessageStore.stubCp())
        .messageStore(store)
        .handler(received::addAll)
        .intervalMs(60_000)
        .metrics(metrics);
  }

  @Test
  void builderRejectsInvalidSettings() {
    assertThrows(NullPointerException.class, () -> MessagePoller.builder().build());
    assertThrows(IllegalArgumentException.class, () -> poller().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> poller().intervalMs(0).build());
  }

  @Test
  void startSkipsMessagesWrittenBefore() {
    store.insert(null, "orders", "old", null, Instant.now());
    store.insert(null, "orders", "older", null, Instant.now());

    try (MessagePoller p = poller().build()) {
      p.start();
      assertEquals(2, p.cursor());

      p.poll();
      assertTrue(received.isEmpty());

      store.insert(null, "orders", "new", null, Instant.now());
      p.poll();
    }

    assertEquals(1, received.size());
    assertEquals("new", received.get(0).payload());
    assertEquals(3, metrics.cursor.get());
  }

  @Test
  void malformedRowIsSkippedAndCursorMovesPast() {
    try (MessagePoller p = poller().build()) {
      p.start();
      store.insertRaw("orders", null, null, Instant.now());
      store.insertRaw(null, "no-channel", null, Instant.now());
      store.insert(null, "orders", "good", null, Instant.now());

      p.poll();
      assertEquals(3, p.cursor());

      p.poll();
    }

    assertEquals(List.of("good"), received.stream().map(Message::payload).toList());
  }

  @Test
  void batchOfOnlyMalformedRowsStillAdvances() {
    try (MessagePoller p = poller().build()) {
      p.start();
      store.insertRaw("orders", null, null, Instant.now());

      p.poll();
      assertEquals(1, p.cursor());
    }

    assertTrue(received.isEmpty());
  }

  @Test
  void pollsInBatchesAndAdvancesCursor() {
    try (MessagePoller p = poller().batchSize(2).build()) {
      p.start();
      for (int i = 1; i <= 5; i++) {
        store.insert(null, "c", "m" + i, null, Instant.now());
      }

      p.poll();
      assertEquals(2, p.cursor());
      p.poll();
      p.poll();
      assertEquals(5, p.cursor());
    }

    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), received.stream().map(Message::id).toList());
  }

  @Test
  void failedQueryKeepsCursorAndRetries() {
    try (MessagePoller p = poller().build()) {
      p.start();
      store.insert(null, "c", "m1", null, Instant.now());

      store.failQueries = true;
      p.poll();
      assertEquals(0, p.cursor());
      assertTrue(received.isEmpty());

      store.failQueries = false;
      p.poll();
      assertEquals(1, p.cursor());
    }
    assertEquals(1, received.size());
  }

  @Test
  void handlerFailureDoesNotStopPolling() {
    List<Long> seen = new CopyOnWriteArrayList<>();
    try (MessagePoller p = poller().handler(batch -> {
      batch.forEach(m -> seen.add(m.id()));
      if (seen.size() == 1) {
        throw new IllegalStateException("boom");
      }
    }).build()) {
      p.start();
      store.insert(null, "c", "m1", null, Instant.now());
      p.poll();
      store.insert(null, "c", "m2", null, Instant.now());
      p.poll();
    }
    assertEquals(List.of(1L, 2L), seen);
  }

  @Test
  void decodesMetadataAndToleratesGarbage() {
    try (MessagePoller p = poller().build()) {
      p.start();
      store.insert(null, "c", "m1", Map.of("user", "42"), Instant.now());
      store.insertRaw("c", "m2", "{not json", Instant.now());
      p.poll();
    }

    assertEquals(Map.of("user", "42"), received.get(0).metadata());
    assertEquals(Map.of(), received.get(1).metadata());
  }

  @Test
  void startFailsWhenStoreUnreachable() {
    InMemoryMessageStore broken = new InMemoryMessageStore() {
      @Override
      public synchronized long maxId(Connection conn) {
        throw new IllegalStateException("down");
      }
    };
    MessagePoller p = poller().messageStore(broken).build();
    assertThrows(CableException.class, p::start);
    p.close();
  }

  @Test
  void startAfterCloseRejected() {
    MessagePoller p = poller().build();
    p.close();
    assertThrows(IllegalStateException.class, p::start);
  }
}
