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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricValidatorTest {

  private TelemetryRegistry registry;

  @BeforeEach
  void setUp() {
    registry = TestMetrics.registry();
  }

  @Test
  void strictRejectsDisallowedTags() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.STRICT);
    assertThatThrownBy(
            () ->
                validator.validate(
                    TestMetrics.REQUESTS,
                    MetricType.COUNTER,
                    Tag.of("kind", "small"),
                    Tag.of("foo", "bar")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Tag not allowed: foo");
  }

  @Test
  void lenientDropsDisallowedTagAndSortsTheRest() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.LENIENT);
    MetricValidator.ValidationResult result =
        validator.validate(
            TestMetrics.REQUESTS,
            MetricType.COUNTER,
            Tag.of("region", "eu"),
            Tag.of("foo", "bar"),
            Tag.of("Kind", " small "));
    assertThat(result.emit()).isTrue();
    assertThat(result.tags()).containsExactly(Tag.of("kind", "small"), Tag.of("region", "eu"));
    assertThat(result.droppedTags()).isEqualTo(1);
  }

  @Test
  void lenientDropsDuplicateKeys() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.LENIENT);
    MetricValidator.ValidationResult result =
        validator.validate(
            TestMetrics.REQUESTS,
            MetricType.COUNTER,
            Tag.of("kind", "small"),
            Tag.of("kind", "large"));
    assertThat(result.emit()).isTrue();
    assertThat(result.tags()).containsExactly(Tag.of("kind", "small"));
    assertThat(result.droppedTags()).isEqualTo(1);
  }

  @Test
  void lenientDropsMetricWhenRequiredTagsMissing() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.LENIENT);
    MetricValidator.ValidationResult result =
        validator.validate(TestMetrics.PAYLOAD, MetricType.HISTOGRAM);
    assertThat(result.emit()).isFalse();
    assertThat(result.reason()).isEqualTo(DropMetricReason.MISSING_REQUIRED_TAG);
    assertThat(result.detail()).contains("missing required tag: kind");
  }

  @Test
  void strictFailsOnMissingRequiredTag() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.STRICT);
    assertThatThrownBy(
            () ->
                validator.validate(
                    TestMetrics.REQUESTS, MetricType.COUNTER, Tag.of("region", "eu")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required tag");
  }

  @Test
  void unknownMetricIsDroppedWhenLenient() {
    MetricValidator validator = new MetricValidator(registry, TelemetryPolicy.LENIENT);
    MetricValidator.ValidationResult result =
        validator.validate(MetricId.counter("not_registered_total", "test"), MetricType.COUNTER);
    assertThat(result.emit()).isFalse();
    assertThat(result.reason()).isEqualTo(DropMetricReason.UNKNOWN_METRIC);
  }

  @Test
  void typeMismatchFailsUnderBothPolicies() {
    for (TelemetryPolicy policy : TelemetryPolicy.values()) {
      MetricValidator validator = new MetricValidator(registry, policy);
      assertThatThrownBy(
              () ->
                  validator.validate(
                      TestMetrics.PAYLOAD, MetricType.COUNTER, Tag.of("kind", "small")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("type mismatch");
    }
  }
}
