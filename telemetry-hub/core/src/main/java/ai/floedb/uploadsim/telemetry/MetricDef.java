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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Definition of a metric contract entry.
 *
 * <p>Histograms may declare explicit bucket upper bounds. Backends that aggregate locally (the
 * Prometheus scrape endpoint, {@link RecordingMetricsSink}) use them; push backends leave bucketing
 * to the collector.
 */
public final class MetricDef {
  private final MetricId id;
  private final Set<String> requiredTags;
  private final Set<String> allowedTags;
  private final String description;
  private final List<Double> buckets;

  public MetricDef(MetricId id, Set<String> requiredTags, Set<String> allowedTags) {
    this(id, requiredTags, allowedTags, "", List.of());
  }

  public MetricDef(
      MetricId id, Set<String> requiredTags, Set<String> allowedTags, String description) {
    this(id, requiredTags, allowedTags, description, List.of());
  }

  public MetricDef(
      MetricId id,
      Set<String> requiredTags,
      Set<String> allowedTags,
      String description,
      List<Double> buckets) {
    this.id = Objects.requireNonNull(id, "id");
    this.requiredTags = normalizeTags(requiredTags);
    this.allowedTags = normalizeTags(allowedTags);
    if (!this.allowedTags.containsAll(this.requiredTags)) {
      throw new IllegalArgumentException("allowedTags must include requiredTags");
    }
    this.description = description == null ? "" : description;
    this.buckets = normalizeBuckets(id, buckets);
  }

  private static Set<String> normalizeTags(Set<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Collections.emptySet();
    }
    Set<String> normalized = new HashSet<>();
    for (String tag : tags) {
      normalized.add(requireNonBlank(tag, "tag"));
    }
    return Collections.unmodifiableSet(normalized);
  }

  private static List<Double> normalizeBuckets(MetricId id, List<Double> buckets) {
    if (buckets == null || buckets.isEmpty()) {
      return List.of();
    }
    if (id.type() != MetricType.HISTOGRAM) {
      throw new IllegalArgumentException("buckets are only supported for histograms: " + id);
    }
    double previous = Double.NEGATIVE_INFINITY;
    for (Double bound : buckets) {
      if (bound == null || !Double.isFinite(bound)) {
        throw new IllegalArgumentException("bucket bounds must be finite numbers: " + buckets);
      }
      if (bound <= previous) {
        throw new IllegalArgumentException("bucket bounds must be strictly increasing: " + buckets);
      }
      previous = bound;
    }
    return List.copyOf(buckets);
  }

  private static String requireNonBlank(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " entries must not be blank");
    }
    return value;
  }

  public MetricId id() {
    return id;
  }

  public Set<String> requiredTags() {
    return requiredTags;
  }

  public Set<String> allowedTags() {
    return allowedTags;
  }

  public String description() {
    return description;
  }

  /** Ascending bucket upper bounds, empty when the backend should choose. */
  public List<Double> buckets() {
    return buckets;
  }

  @Override
  public String toString() {
    return id().name();
  }
}
