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

package ai.floedb.uploadsim.telemetry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory sink that keeps every measurement, for tests.
 *
 * <p>Bucket counts follow the exposition format: each bound counts the observations less than or
 * equal to it, and the {@link Double#POSITIVE_INFINITY} entry counts all observations.
 */
public final class RecordingMetricsSink implements MetricsSink {
  private final TelemetryRegistry registry;
  private final Map<MetricId, Long> counters = new LinkedHashMap<>();
  private final Map<MetricId, List<List<Tag>>> counterTags = new LinkedHashMap<>();
  private final Map<MetricId, List<Double>> histograms = new LinkedHashMap<>();
  private final Map<MetricId, List<List<Tag>>> histogramTags = new LinkedHashMap<>();
  private int shutdownCalls;

  public RecordingMetricsSink() {
    this(Telemetry.newRegistryWithCore());
  }

  public RecordingMetricsSink(TelemetryRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public synchronized void incrementCounter(MetricId metric, Tag... tags) {
    ensureOpen(metric);
    counters.merge(metric, 1L, Long::sum);
    counterTags.computeIfAbsent(metric, key -> new ArrayList<>()).add(copyTags(tags));
  }

  @Override
  public synchronized void recordHistogram(MetricId metric, double value, Tag... tags) {
    ensureOpen(metric);
    histograms.computeIfAbsent(metric, key -> new ArrayList<>()).add(value);
    histogramTags.computeIfAbsent(metric, key -> new ArrayList<>()).add(copyTags(tags));
  }

  @Override
  public synchronized void shutdown() {
    shutdownCalls++;
  }

  public synchronized boolean isShutdown() {
    return shutdownCalls > 0;
  }

  public synchronized int shutdownCalls() {
    return shutdownCalls;
  }

  public synchronized long counterValue(MetricId metric) {
    return counters.getOrDefault(metric, 0L);
  }

  public synchronized List<Double> histogramValues(MetricId metric) {
    return List.copyOf(histograms.getOrDefault(metric, List.of()));
  }

  public synchronized List<List<Tag>> counterTagHistory(MetricId metric) {
    return List.copyOf(counterTags.getOrDefault(metric, List.of()));
  }

  public synchronized List<List<Tag>> histogramTagHistory(MetricId metric) {
    return List.copyOf(histogramTags.getOrDefault(metric, List.of()));
  }

  /** Counts observations of the given tag combination only. */
  public synchronized long counterValue(MetricId metric, Tag... tags) {
    List<Tag> wanted = copyTags(tags);
    return counterTags.getOrDefault(metric, List.of()).stream()
        .filter(recorded -> recorded.equals(wanted))
        .count();
  }

  /**
   * Cumulative bucket counts keyed by upper bound, using the buckets declared on the metric
   * definition.
   *
   * @throws IllegalArgumentException if the metric is unknown or declares no buckets
   */
  public synchronized Map<Double, Long> bucketCounts(MetricId metric) {
    MetricDef def = Telemetry.requireMetricDef(registry, metric);
    if (def.buckets().isEmpty()) {
      throw new IllegalArgumentException("Metric declares no buckets: " + metric.name());
    }
    List<Double> values = histograms.getOrDefault(metric, List.of());
    Map<Double, Long> counts = new LinkedHashMap<>();
    for (double bound : def.buckets()) {
      counts.put(bound, values.stream().filter(v -> v <= bound).count());
    }
    counts.put(Double.POSITIVE_INFINITY, (long) values.size());
    return Collections.unmodifiableMap(counts);
  }

  private void ensureOpen(MetricId metric) {
    Objects.requireNonNull(metric, "metric");
    if (shutdownCalls > 0) {
      throw new SinkUnavailableException(
          "sink is shut down", metric, Map.of("metric", metric.name()));
    }
  }

  private static List<Tag> copyTags(Tag[] tags) {
    if (tags == null || tags.length == 0) {
      return List.of();
    }
    return List.copyOf(Arrays.asList(tags));
  }
}
