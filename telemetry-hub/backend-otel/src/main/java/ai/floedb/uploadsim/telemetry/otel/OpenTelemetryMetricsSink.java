/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.uploadsim.telemetry.otel;

import ai.floedb.uploadsim.telemetry.MetricDef;
import ai.floedb.uploadsim.telemetry.MetricId;
import ai.floedb.uploadsim.telemetry.MetricType;
import ai.floedb.uploadsim.telemetry.MetricValidator;
import ai.floedb.uploadsim.telemetry.MetricsSink;
import ai.floedb.uploadsim.telemetry.SinkUnavailableException;
import ai.floedb.uploadsim.telemetry.Tag;
import ai.floedb.uploadsim.telemetry.Telemetry;
import ai.floedb.uploadsim.telemetry.TelemetryPolicy;
import ai.floedb.uploadsim.telemetry.TelemetryRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.DoubleHistogramBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsSink} on top of the OpenTelemetry SDK. Aggregation happens in the SDK; whatever
 * {@link io.opentelemetry.sdk.metrics.export.MetricReader} is registered on the provider decides
 * when data leaves the process.
 */
public final class OpenTelemetryMetricsSink implements MetricsSink {
  static final String INSTRUMENTATION_SCOPE = "ai.floedb.uploadsim";
  private static final AttributeKey<String> REASON =
      AttributeKey.stringKey(Telemetry.TagKey.REASON);

  private static final Logger LOG = LoggerFactory.getLogger(OpenTelemetryMetricsSink.class);

  private final SdkMeterProvider meterProvider;
  private final Meter meter;
  private final MetricValidator validator;
  private final Duration shutdownTimeout;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DoubleHistogram> histograms = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  public OpenTelemetryMetricsSink(
      SdkMeterProvider meterProvider,
      TelemetryRegistry telemetryRegistry,
      TelemetryPolicy policy,
      Duration shutdownTimeout) {
    this.meterProvider = Objects.requireNonNull(meterProvider, "meterProvider");
    this.validator =
        new MetricValidator(
            Objects.requireNonNull(telemetryRegistry, "telemetryRegistry"),
            Objects.requireNonNull(policy, "policy"));
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    this.meter = meterProvider.get(INSTRUMENTATION_SCOPE);
  }

  @Override
  public void incrementCounter(MetricId metric, Tag... tags) {
    ensureOpen(metric);
    MetricValidator.ValidationResult result = validate(metric, MetricType.COUNTER, tags);
    if (result == null) {
      return;
    }
    counters
        .computeIfAbsent(metric.name(), name -> buildCounter(result.def()))
        .add(1, attributes(result.tags()));
  }

  @Override
  public void recordHistogram(MetricId metric, double value, Tag... tags) {
    ensureOpen(metric);
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(
          "Histogram value must be finite for " + metric.name() + ": " + value);
    }
    MetricValidator.ValidationResult result = validate(metric, MetricType.HISTOGRAM, tags);
    if (result == null) {
      return;
    }
    histograms
        .computeIfAbsent(metric.name(), name -> buildHistogram(result.def()))
        .record(value, attributes(result.tags()));
  }

  /** Flushes the final collection through the registered readers, waiting up to the timeout. */
  @Override
  public void shutdown() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    CompletableResultCode result =
        meterProvider.shutdown().join(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
    if (result.isSuccess()) {
      LOG.debug("OpenTelemetry meter provider shut down");
    } else {
      LOG.warn(
          "OpenTelemetry meter provider did not shut down cleanly within {}; final export may be"
              + " lost",
          shutdownTimeout);
    }
  }

  /** Maps catalog units to the units the OTLP backends expect. */
  static String otelUnit(MetricId metric) {
    return switch (metric.unit()) {
      case "" -> "1";
      case "seconds" -> "s";
      default -> metric.unit();
    };
  }

  private MetricValidator.ValidationResult validate(
      MetricId metric, MetricType expected, Tag... tags) {
    MetricValidator.ValidationResult result = validator.validate(metric, expected, tags);
    if (result.droppedTags() > 0) {
      selfCounter(Telemetry.Metrics.DROPPED_TAGS).add(result.droppedTags());
    }
    if (!result.emit()) {
      LOG.debug("Dropping measurement for {}: {}", metric.name(), result.detail());
      selfCounter(Telemetry.Metrics.DROPPED_METRICS)
          .add(1, Attributes.of(REASON, result.reason().label()));
      return null;
    }
    return result;
  }

  private LongCounter selfCounter(MetricId metric) {
    return counters.computeIfAbsent(
        metric.name(), name -> buildCounter(Telemetry.Metrics.definitions().get(metric)));
  }

  private LongCounter buildCounter(MetricDef def) {
    return meter
        .counterBuilder(def.id().name())
        .setDescription(def.description())
        .setUnit(otelUnit(def.id()))
        .build();
  }

  private DoubleHistogram buildHistogram(MetricDef def) {
    DoubleHistogramBuilder builder =
        meter
            .histogramBuilder(def.id().name())
            .setDescription(def.description())
            .setUnit(otelUnit(def.id()));
    List<Double> buckets = def.buckets();
    if (!buckets.isEmpty()) {
      builder.setExplicitBucketBoundariesAdvice(buckets);
    }
    return builder.build();
  }

  private void ensureOpen(MetricId metric) {
    Objects.requireNonNull(metric, "metric");
    if (closed.get()) {
      throw new SinkUnavailableException(
          "OpenTelemetry sink is shut down", metric, Map.of("metric", metric.name()));
    }
  }

  private static Attributes attributes(List<Tag> tags) {
    if (tags.isEmpty()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (Tag tag : tags) {
      builder.put(tag.key(), tag.value());
    }
    return builder.build();
  }
}
