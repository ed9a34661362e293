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

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/** Static facade for the shared metric catalog. */
public final class Telemetry {
  private Telemetry() {}

  /**
   * Builds a registry holding the core self-metrics plus every {@link TelemetryContributor}
   * published through {@link ServiceLoader}, registered in class-name order.
   */
  public static TelemetryRegistry newRegistryWithCore() {
    TelemetryRegistry registry = new TelemetryRegistry();
    registry.register(new CoreTelemetryContributor());
    ServiceLoader.load(TelemetryContributor.class).stream()
        .map(ServiceLoader.Provider::get)
        .sorted(Comparator.comparing(c -> c.getClass().getName()))
        .forEach(registry::register);
    return registry;
  }

  public static Optional<MetricDef> metricDef(TelemetryRegistry registry, MetricId metric) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(metric, "metric");
    return Optional.ofNullable(registry.metric(metric.name()));
  }

  public static MetricDef requireMetricDef(TelemetryRegistry registry, MetricId metric) {
    return metricDef(registry, metric)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Metric not registered: "
                        + metric.name()
                        + " (is its contributor on the class path?)"));
  }

  /** Tag keys shared across multiple metrics. */
  public static final class TagKey {
    public static final String REASON = "reason";

    private TagKey() {}
  }

  /** Self-metrics reported by sinks about measurements they had to discard. */
  public static final class Metrics {
    public static final MetricId DROPPED_TAGS =
        MetricId.counter("uploadsim.telemetry.dropped.tags", "core");
    public static final MetricId DROPPED_METRICS =
        MetricId.counter("uploadsim.telemetry.dropped.metrics", "core");

    private static final Map<MetricId, MetricDef> DEFINITIONS = buildDefinitions();

    private Metrics() {}

    public static Map<MetricId, MetricDef> definitions() {
      return DEFINITIONS;
    }

    private static Map<MetricId, MetricDef> buildDefinitions() {
      Map<MetricId, MetricDef> definitions = new LinkedHashMap<>();
      definitions.put(
          DROPPED_TAGS,
          new MetricDef(
              DROPPED_TAGS,
              Set.of(),
              Set.of(),
              "Total number of tags dropped because they violated the metric contract."));
      definitions.put(
          DROPPED_METRICS,
          new MetricDef(
              DROPPED_METRICS,
              Set.of(TagKey.REASON),
              Set.of(TagKey.REASON),
              "Total number of measurements dropped, tagged by reason."));
      return Collections.unmodifiableMap(definitions);
    }
  }
}
