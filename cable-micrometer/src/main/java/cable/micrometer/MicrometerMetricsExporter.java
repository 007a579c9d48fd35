package cable.micrometer;

import cable.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code cable.published}: messages written by the publisher</li>
 *   <li>{@code cable.publish.failure}: publish attempts the store rejected</li>
 *   <li>{@code cable.delivered}: messages handled without error</li>
 *   <li>{@code cable.dropped}: messages dropped on a full subscriber queue</li>
 *   <li>{@code cable.handler.failure}: handler invocations that threw</li>
 *   <li>{@code cable.purged}: expired messages deleted by the sweeper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code cable.poll.cursor}: highest message id read by the poller</li>
 *   <li>{@code cable.poll.lag.ms}: age of the oldest message in the last batch</li>
 *   <li>{@code cable.subscriptions.active}: registered subscriptions</li>
 * </ul>
 *
 * <p>Closing the exporter removes its meters; {@link cable.SolidCable#close()} does that
 * when the exporter was handed to its builder.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter publishFailure;
  private final Counter delivered;
  private final Counter dropped;
  private final Counter handlerFailure;
  private final Counter purged;
  private final Gauge cursorGauge;
  private final Gauge lagGauge;
  private final Gauge subscriptionsGauge;

  private final AtomicLong cursor = new AtomicLong();
  private final AtomicLong pollLagMs = new AtomicLong();
  private final AtomicInteger activeSubscriptions = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "cable"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "cable");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several buses in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.cable"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = Counter.builder(namePrefix + ".published")
        .description("Messages written to the store")
        .register(registry);
    this.publishFailure = Counter.builder(namePrefix + ".publish.failure")
        .description("Publish attempts rejected by the store")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".delivered")
        .description("Messages processed by a handler")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".dropped")
        .description("Messages dropped (subscriber queue full)")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Handler invocations that threw")
        .register(registry);
    this.purged = Counter.builder(namePrefix + ".purged")
        .description("Expired messages deleted")
        .register(registry);

    this.cursorGauge = Gauge.builder(namePrefix + ".poll.cursor", cursor, AtomicLong::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".poll.lag.ms", pollLagMs, AtomicLong::get)
        .register(registry);
    this.subscriptionsGauge = Gauge.builder(namePrefix + ".subscriptions.active",
            activeSubscriptions, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementPublishFailure() {
    if (closed) return;
    publishFailure.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void recordPurged(long count) {
    if (closed) return;
    purged.increment(count);
  }

  @Override
  public void recordCursor(long lastSeenId) {
    if (closed) return;
    cursor.set(lastSeenId);
  }

  @Override
  public void recordPollLagMs(long lagMs) {
    if (closed) return;
    pollLagMs.set(lagMs);
  }

  @Override
  public void recordActiveSubscriptions(int count) {
    if (closed) return;
    activeSubscriptions.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, publishFailure, delivered, dropped,
        handlerFailure, purged, cursorGauge, lagGauge, subscriptionsGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
