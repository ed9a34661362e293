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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Checks a measurement against the registered {@link MetricDef} before a backend records it. */
public final class MetricValidator {
  private final TelemetryRegistry registry;
  private final TelemetryPolicy policy;

  public MetricValidator(TelemetryRegistry registry, TelemetryPolicy policy) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public TelemetryPolicy policy() {
    return policy;
  }

  public ValidationResult validate(MetricId metric, MetricType expected, Tag... tags) {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(expected, "expected");
    MetricDef def = Telemetry.metricDef(registry, metric).orElse(null);
    if (def == null) {
      if (policy.isStrict()) {
        throw new IllegalArgumentException("Metric not registered: " + metric.name());
      }
      return ValidationResult.dropped(
          null, 0, DropMetricReason.UNKNOWN_METRIC, "metric not registered: " + metric.name());
    }
    if (def.id().type() != expected) {
      throw new IllegalArgumentException(
          "Metric type mismatch for "
              + metric.name()
              + ": expected "
              + expected
              + " but got "
              + def.id().type());
    }

    List<Tag> sanitized = new ArrayList<>();
    Set<String> providedKeys = new HashSet<>();
    int droppedTags = 0;
    Tag[] safeTags = tags == null ? new Tag[0] : tags;
    for (Tag tag : safeTags) {
      Optional<Tag> clean = TagSanitizer.sanitize(tag, policy);
      if (clean.isEmpty()) {
        droppedTags++;
        continue;
      }
      Tag sanitizedTag = clean.get();
      if (!def.allowedTags().contains(sanitizedTag.key())) {
        if (policy.isStrict()) {
          throw new IllegalArgumentException(
              "Tag not allowed: " + sanitizedTag.key() + " for metric " + metric.name());
        }
        droppedTags++;
        continue;
      }
      if (!providedKeys.add(sanitizedTag.key())) {
        if (policy.isStrict()) {
          throw new IllegalArgumentException(
              "Duplicate tag key: " + sanitizedTag.key() + " for metric " + metric.name());
        }
        droppedTags++;
        continue;
      }
      sanitized.add(sanitizedTag);
    }

    for (String required : def.requiredTags()) {
      if (!providedKeys.contains(required)) {
        if (policy.isStrict()) {
          throw new IllegalArgumentException(
              "Missing required tag: " + required + " for metric " + metric.name());
        }
        return ValidationResult.dropped(
            def,
            droppedTags,
            DropMetricReason.MISSING_REQUIRED_TAG,
            "missing required tag: " + required);
      }
    }

    sanitized.sort(Comparator.comparing(Tag::key));
    return new ValidationResult(
        def, Collections.unmodifiableList(sanitized), true, droppedTags, null, null);
  }

  /**
   * Outcome of a validation. When {@code emit} is true, {@code tags} holds the sanitized tags
   * sorted by key and {@code def} the matching definition.
   */
  public record ValidationResult(
      MetricDef def,
      List<Tag> tags,
      boolean emit,
      int droppedTags,
      DropMetricReason reason,
      String detail) {

    static ValidationResult dropped(
        MetricDef def, int droppedTags, DropMetricReason reason, String detail) {
      return new ValidationResult(def, List.of(), false, droppedTags, reason, detail);
    }
  }
}
