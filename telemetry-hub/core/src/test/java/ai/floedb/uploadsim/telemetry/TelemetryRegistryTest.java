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

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryRegistryTest {

  private TelemetryRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new TelemetryRegistry();
  }

  @Test
  void coreRegistryHoldsDropCounters() {
    TelemetryRegistry core = Telemetry.newRegistryWithCore();
    assertThat(core.metrics())
        .containsKeys(
            Telemetry.Metrics.DROPPED_TAGS.name(), Telemetry.Metrics.DROPPED_METRICS.name());
    assertThat(Telemetry.requireMetricDef(core, Telemetry.Metrics.DROPPED_METRICS).requiredTags())
        .containsExactly(Telemetry.TagKey.REASON);
  }

  @Test
  void rejectsDuplicateMetrics() {
    MetricDef def = new MetricDef(MetricId.counter("dup_total", "test"), Set.of(), Set.of());
    registry.register(def);
    assertThatThrownBy(() -> registry.register(def))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("dup_total");
  }

  @Test
  void contributorRegistrationIsAtomic() {
    registry.register(new CoreTelemetryContributor());
    TelemetryContributor clashing =
        target -> {
          target.register(
              new MetricDef(MetricId.counter("fresh_total", "test"), Set.of(), Set.of()));
          target.register(new MetricDef(Telemetry.Metrics.DROPPED_TAGS, Set.of(), Set.of()));
        };

    assertThatThrownBy(() -> registry.register(clashing))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(registry.metrics()).doesNotContainKey("fresh_total");
  }

  @Test
  void metricsReturnsSnapshot() {
    registry.register(TestMetrics.CONTRIBUTOR);
    var snapshot = registry.metrics();
    registry.register(new MetricDef(MetricId.counter("later_total", "test"), Set.of(), Set.of()));
    assertThat(snapshot).containsKey(TestMetrics.REQUESTS.name()).doesNotContainKey("later_total");
  }

  @Test
  void requiredTagsMustBeAllowed() {
    assertThatThrownBy(
            () ->
                new MetricDef(
                    MetricId.counter("bad_total", "test"), Set.of("required"), Set.of("other")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("allowedTags");
  }

  @Test
  void bucketsAreValidated() {
    MetricId histogram = MetricId.histogram("h", "seconds", "test");
    assertThatThrownBy(
            () -> new MetricDef(histogram, Set.of(), Set.of(), "", List.of(1.0, 1.0)))
        .hasMessageContaining("strictly increasing");
    assertThatThrownBy(
            () ->
                new MetricDef(
                    histogram, Set.of(), Set.of(), "", List.of(1.0, Double.POSITIVE_INFINITY)))
        .hasMessageContaining("finite");
    assertThatThrownBy(
            () ->
                new MetricDef(
                    MetricId.counter("c_total", "test"), Set.of(), Set.of(), "", List.of(1.0)))
        .hasMessageContaining("only supported for histograms");
  }

  @Test
  void metricIdRejectsBlankName() {
    assertThatThrownBy(() -> MetricId.counter(" ", "test"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(MetricId.histogram("h", "bytes", "test").hasUnit()).isTrue();
    assertThat(MetricId.counter("c", "test").hasUnit()).isFalse();
  }

  @Test
  void nullContributorThrows() {
    assertThatThrownBy(() -> registry.register((TelemetryContributor) null))
        .isInstanceOf(NullPointerException.class);
  }
}
