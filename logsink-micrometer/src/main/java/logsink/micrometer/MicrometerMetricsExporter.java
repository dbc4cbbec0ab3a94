package logsink.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import logsink.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code logsink.messages.delivered}: messages handed to a sink</li>
 *   <li>{@code logsink.messages.dropped}: messages rejected (queue full or worker closed)</li>
 *   <li>{@code logsink.delivery.failure}: failed deliveries, tagged {@code kind}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code logsink.queue.depth}: current worker queue depth</li>
 *   <li>{@code logsink.sinks.live}: live sinks, tagged {@code kind}</li>
 * </ul>
 *
 * <p>Per-kind meters are registered the first time a kind reports.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter delivered;
  private final Counter dropped;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final Map<String, Counter> failuresByKind = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> liveByKind = new ConcurrentHashMap<>();
  private final List<Meter> kindMeters = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "logsink"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "logsink");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.logsink"})
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
    this.namePrefix = namePrefix;
    this.delivered = Counter.builder(namePrefix + ".messages.delivered")
        .description("Messages handed to a sink")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".messages.dropped")
        .description("Messages rejected (queue full or worker closed)")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
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
  public void incrementDeliveryFailure(String kind) {
    if (closed) return;
    failuresByKind.computeIfAbsent(kind, k -> track(Counter.builder(namePrefix + ".delivery.failure")
        .description("Failed deliveries (sink threw)")
        .tag("kind", k)
        .register(registry))).increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordLiveSinks(String kind, int count) {
    if (closed) return;
    liveByKind.computeIfAbsent(kind, k -> {
      AtomicInteger value = new AtomicInteger();
      track(Gauge.builder(namePrefix + ".sinks.live", value, AtomicInteger::get)
          .description("Live sinks")
          .tag("kind", k)
          .register(registry));
      return value;
    }).set(count);
  }

  private <M extends Meter> M track(M meter) {
    synchronized (kindMeters) {
      kindMeters.add(meter);
    }
    return meter;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. after the
   * {@link logsink.SinkManager} shut down) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(delivered, dropped, queueDepthGauge));
    synchronized (kindMeters) {
      meters.addAll(kindMeters);
    }
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
