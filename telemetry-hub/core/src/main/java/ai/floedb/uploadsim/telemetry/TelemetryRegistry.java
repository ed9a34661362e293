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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Catalog of metric definitions, keyed by metric name. */
public final class TelemetryRegistry {
  private final Map<String, MetricDef> metrics = new LinkedHashMap<>();

  /** Registers all metrics of a contributor, or none of them if any name is already taken. */
  public synchronized void register(TelemetryContributor contributor) {
    Objects.requireNonNull(contributor, "contributor");
    TelemetryRegistry staged = new TelemetryRegistry();
    contributor.contribute(staged);
    Map<String, MetricDef> newDefs = staged.metrics();
    for (String name : newDefs.keySet()) {
      if (metrics.containsKey(name)) {
        throw new IllegalArgumentException(
            "Metric already registered: "
                + name
                + " (contributed by "
                + contributor.getClass().getName()
                + ")");
      }
    }
    metrics.putAll(newDefs);
  }

  public synchronized void register(MetricDef def) {
    Objects.requireNonNull(def, "def");
    String name = def.id().name();
    if (metrics.containsKey(name)) {
      throw new IllegalArgumentException("Metric already registered: " + name);
    }
    metrics.put(name, def);
  }

  /** Returns the definition for the given metric name, or null if unknown. */
  public synchronized MetricDef metric(String name) {
    return metrics.get(name);
  }

  /** Returns an ordered snapshot of all registered metrics. */
  public synchronized Map<String, MetricDef> metrics() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }
}
