package ca.gc.cra.xpii.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithServiceResource() {
    adapter.increment("staple.completed");
    adapter.increment("staple.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "staple.completed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("staple.completed", point.getAttributes().get(AttributeKey.stringKey("xpii.metric.key")));
    assertEquals("xpii-chain", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("staple.latencyNanos", 1_000L);
    adapter.observe("staple.latencyNanos", 3_000L);

    MetricData histogram = find(reader.collectAllMetrics(), "staple.latencyNanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void instrumentNameReplacesUnsupportedCharacters() {
    assertEquals("verify.status.no_provenance", OpenTelemetryMetricsAdapter.instrumentName("verify.status.no_provenance"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.instrumentName("1st"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.instrumentName("a b"));
    assertTrue(OpenTelemetryMetricsAdapter.instrumentName(" ").length() > 0);
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
