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

import java.util.Objects;

/**
 * Unique identifier for a metric in the catalog.
 *
 * <p>The name is used verbatim by every backend, so it must already follow the exposition naming
 * rules (for example {@code file_uploads_total}). The unit is either empty (dimensionless counts)
 * or a plain word such as {@code bytes} or {@code seconds}; backends translate it to their own
 * conventions.
 */
public record MetricId(String name, MetricType type, String unit, String since, String origin) {

  public MetricId {
    name = requireNonBlank(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(unit, "unit");
    if (!unit.isEmpty() && unit.isBlank()) {
      throw new IllegalArgumentException("unit must not be blank");
    }
    since = requireNonBlank(since, "since");
    origin = requireNonBlank(origin, "origin");
  }

  public static MetricId counter(String name, String origin) {
    return new MetricId(name, MetricType.COUNTER, "", "v1", origin);
  }

  public static MetricId histogram(String name, String unit, String origin) {
    return new MetricId(name, MetricType.HISTOGRAM, unit, "v1", origin);
  }

  private static String requireNonBlank(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    return value;
  }

  public boolean hasUnit() {
    return !unit.isEmpty();
  }

  @Override
  public String toString() {
    return name + "(" + type + ")";
  }
}
