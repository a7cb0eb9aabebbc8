package ca.gc.cra.metawriter.infrastructure.metrics;

import ca.gc.cra.metawriter.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Forwards writer counters and observations to OpenTelemetry instruments, created on first use per key.
 * Every data point carries the original key in the {@code meta.metric.key} attribute.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("meta.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter using the exporter configured through system properties or the environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending data points and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("Metadata writer counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setDescription("Metadata writer observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String instrumentName(String key) {
    String trimmed = key.trim();
    if (trimmed.isEmpty()) {
      return "meta.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
