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
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

class RecordingMetricsSinkTest {

  private final RecordingMetricsSink sink = new RecordingMetricsSink(TestMetrics.registry());

  @Test
  void countsIncrementsPerTagCombination() {
    sink.incrementCounter(TestMetrics.REQUESTS, Tag.of("kind", "small"));
    sink.incrementCounter(TestMetrics.REQUESTS, Tag.of("kind", "small"));
    sink.incrementCounter(TestMetrics.REQUESTS, Tag.of("kind", "large"));

    assertThat(sink.counterValue(TestMetrics.REQUESTS)).isEqualTo(3);
    assertThat(sink.counterValue(TestMetrics.REQUESTS, Tag.of("kind", "small"))).isEqualTo(2);
    assertThat(sink.counterTagHistory(TestMetrics.REQUESTS)).hasSize(3);
  }

  @Test
  void bucketCountsAreCumulative() {
    for (double value : new double[] {5, 10, 50, 500, 5000}) {
      sink.recordHistogram(TestMetrics.PAYLOAD, value, Tag.of("kind", "small"));
    }

    assertThat(sink.histogramValues(TestMetrics.PAYLOAD))
        .containsExactly(5.0, 10.0, 50.0, 500.0, 5000.0);
    assertThat(sink.bucketCounts(TestMetrics.PAYLOAD))
        .containsExactly(
            entry(10.0, 2L),
            entry(100.0, 3L),
            entry(1000.0, 4L),
            entry(Double.POSITIVE_INFINITY, 5L));
  }

  @Test
  void bucketCountsNeedDeclaredBuckets() {
    assertThatThrownBy(() -> sink.bucketCounts(TestMetrics.UNBUCKETED))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("no buckets");
  }

  @Test
  void recordingAfterShutdownFails() {
    sink.close();
    sink.shutdown();

    assertThat(sink.shutdownCalls()).isEqualTo(2);
    assertThatThrownBy(() -> sink.incrementCounter(TestMetrics.REQUESTS, Tag.of("kind", "small")))
        .isInstanceOf(SinkUnavailableException.class)
        .satisfies(
            e ->
                assertThat(((SinkUnavailableException) e).metric())
                    .isEqualTo(TestMetrics.REQUESTS));
  }

  @Test
  void noopSinkRejectsRecordingAfterShutdown() {
    NoopMetricsSink noop = new NoopMetricsSink();
    noop.recordHistogram(TestMetrics.PAYLOAD, 1.0);
    noop.shutdown();
    assertThatThrownBy(() -> noop.recordHistogram(TestMetrics.PAYLOAD, 1.0))
        .isInstanceOf(SinkUnavailableException.class);
  }
}
