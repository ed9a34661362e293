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

package ai.floedb.uploadsim.telemetry.micrometer;

import ai.floedb.uploadsim.telemetry.DropMetricReason;
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
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer-based {@link MetricsSink}.
 *
 * <p>Counters map to {@link Counter}. Histograms map to {@link DistributionSummary} with the
 * buckets declared on the {@link MetricDef} as service level objectives, which is what makes the
 * Prometheus registry expose them as {@code le} buckets. Meters are created lazily per tag
 * combination and cached.
 */
public final class MicrometerMetricsSink implements MetricsSink {
  private static final Logger LOG = LoggerFactory.getLogger(MicrometerMetricsSink.class);

  private final MeterRegistry registry;
  private final TelemetryRegistry telemetryRegistry;
  private final MetricValidator validator;
  private final AutoCloseable exposition;
  private final Counter droppedTagsCounter;
  private final ConcurrentMap<String, Counter> droppedMetricCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MeterKey, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MeterKey, DistributionSummary> summaries = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  public MicrometerMetricsSink(
      MeterRegistry registry, TelemetryRegistry telemetryRegistry, TelemetryPolicy policy) {
    this(registry, telemetryRegistry, policy, null);
  }

  /**
   * @param exposition resource that publishes the registry (for example a scrape endpoint); closed
   *     on {@link #shutdown()} before the registry itself. May be null.
   */
  public MicrometerMetricsSink(
      MeterRegistry registry,
      TelemetryRegistry telemetryRegistry,
      TelemetryPolicy policy,
      AutoCloseable exposition) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.telemetryRegistry = Objects.requireNonNull(telemetryRegistry, "telemetryRegistry");
    this.validator =
        new MetricValidator(telemetryRegistry, Objects.requireNonNull(policy, "policy"));
    this.exposition = exposition;
    this.droppedTagsCounter =
        Counter.builder(Telemetry.Metrics.DROPPED_TAGS.name())
            .description(descriptionFor(Telemetry.Metrics.DROPPED_TAGS))
            .register(registry);
  }

  @Override
  public void incrementCounter(MetricId metric, Tag... tags) {
    ensureOpen(metric);
    MeterKey key = validate(MetricType.COUNTER, metric, tags);
    if (key == null) {
      return;
    }
    counters.computeIfAbsent(key, this::registerCounter).increment();
  }

  @Override
  public void recordHistogram(MetricId metric, double value, Tag... tags) {
    ensureOpen(metric);
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(
          "Histogram value must be finite for " + metric.name() + ": " + value);
    }
    MeterKey key = validate(MetricType.HISTOGRAM, metric, tags);
    if (key == null) {
      return;
    }
    summaries.computeIfAbsent(key, this::registerSummary).record(value);
  }

  @Override
  public void shutdown() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (exposition != null) {
      try {
        exposition.close();
      } catch (Exception e) {
        LOG.warn("Failed to close metrics exposition {}", exposition, e);
      }
    }
    registry.close();
    LOG.debug(
        "Micrometer sink shut down ({} counters, {} histograms)",
        counters.size(),
        summaries.size());
  }

  public MeterRegistry meterRegistry() {
    return registry;
  }

  private void ensureOpen(MetricId metric) {
    Objects.requireNonNull(metric, "metric");
    if (closed.get()) {
      throw new SinkUnavailableException(
          "Micrometer sink is shut down", metric, Map.of("metric", metric.name()));
    }
  }

  private MeterKey validate(MetricType expected, MetricId id, Tag... tags) {
    MetricValidator.ValidationResult result = validator.validate(id, expected, tags);
    if (result.droppedTags() > 0) {
      droppedTagsCounter.increment(result.droppedTags());
    }
    if (!result.emit()) {
      LOG.debug("Dropping measurement for {}: {}", id.name(), result.detail());
      droppedMetricCounter(result.reason());
      return null;
    }
    return new MeterKey(result.def(), result.tags());
  }

  private Counter registerCounter(MeterKey key) {
    return Counter.builder(key.def().id().name())
        .description(key.def().description())
        .tags(micrometerTags(key.tags()))
        .register(registry);
  }

  private DistributionSummary registerSummary(MeterKey key) {
    MetricDef def = key.def();
    DistributionSummary.Builder builder =
        DistributionSummary.builder(def.id().name())
            .description(def.description())
            .tags(micrometerTags(key.tags()));
    if (def.id().hasUnit()) {
      builder.baseUnit(def.id().unit());
    }
    if (!def.buckets().isEmpty()) {
      builder.serviceLevelObjectives(
          def.buckets().stream().mapToDouble(Double::doubleValue).toArray());
    }
    return builder.register(registry);
  }

  private void droppedMetricCounter(DropMetricReason reason) {
    droppedMetricCounters
        .computeIfAbsent(
            reason.label(),
            label ->
                Counter.builder(Telemetry.Metrics.DROPPED_METRICS.name())
                    .description(descriptionFor(Telemetry.Metrics.DROPPED_METRICS))
                    .tags(Telemetry.TagKey.REASON, label)
                    .register(registry))
        .increment();
  }

  private String descriptionFor(MetricId metric) {
    MetricDef def = telemetryRegistry.metric(metric.name());
    return def != null ? def.description() : "";
  }

  private static List<io.micrometer.core.instrument.Tag> micrometerTags(List<Tag> tags) {
    List<io.micrometer.core.instrument.Tag> converted = new ArrayList<>(tags.size());
    for (Tag tag : tags) {
      converted.add(io.micrometer.core.instrument.Tag.of(tag.key(), tag.value()));
    }
    return converted;
  }

  /** Cache key; tags arrive sorted from the validator so equal combinations collide. */
  private record MeterKey(MetricDef def, List<Tag> tags) {}
}
