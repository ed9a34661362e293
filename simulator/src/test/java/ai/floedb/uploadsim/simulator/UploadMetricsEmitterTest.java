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

package ai.floedb.uploadsim.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import ai.floedb.uploadsim.telemetry.MetricsSink;
import ai.floedb.uploadsim.telemetry.RecordingMetricsSink;
import ai.floedb.uploadsim.telemetry.SinkUnavailableException;
import ai.floedb.uploadsim.telemetry.Tag;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UploadMetricsEmitterTest {
  private static final Tag MEDIUM = Tag.of(UploadMetrics.FILE_TYPE, "medium");

  @Mock private MetricsSink sink;

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);

  @Test
  void mediumEventIncrementsCounterOnceAndRecordsBothHistograms() {
    UploadEvent event = new UploadEvent(UploadCategory.MEDIUM, 1_234_567L, 0.7234);

    new UploadMetricsEmitter(sink, out).emit(event);

    verify(sink).incrementCounter(UploadMetrics.UPLOADS, MEDIUM);
    verify(sink).recordHistogram(UploadMetrics.FILE_SIZE, 1_234_567d, MEDIUM);
    verify(sink).recordHistogram(UploadMetrics.REQUEST_DURATION, 0.7234, MEDIUM);
    verifyNoMoreInteractions(sink);
    assertThat(stdout.toString(StandardCharsets.UTF_8))
        .isEqualTo(
            "Uploaded medium file: 1,234,567 bytes, duration: 0.72s" + System.lineSeparator());
  }

  @Test
  void emittingTheSameEventTwiceCountsTwice() {
    RecordingMetricsSink recording = new RecordingMetricsSink();
    UploadMetricsEmitter emitter = new UploadMetricsEmitter(recording, out);
    UploadEvent event = new UploadEvent(UploadCategory.SMALL, 250_000L, 0.3);

    emitter.emit(event);
    emitter.emit(event);

    assertThat(recording.counterValue(UploadMetrics.UPLOADS)).isEqualTo(2);
    assertThat(recording.histogramValues(UploadMetrics.FILE_SIZE))
        .containsExactly(250_000d, 250_000d);
    assertThat(recording.histogramValues(UploadMetrics.REQUEST_DURATION))
        .containsExactly(0.3, 0.3);
    assertThat(recording.counterTagHistory(UploadMetrics.UPLOADS))
        .containsOnly(List.of(Tag.of(UploadMetrics.FILE_TYPE, "small")));
  }

  @Test
  void sinkFailureIsReportedWithMetricAndEvent() {
    UploadEvent event = new UploadEvent(UploadCategory.MEDIUM, 2_000_000L, 0.5);
    doThrow(new IllegalStateException("backend down"))
        .when(sink)
        .recordHistogram(UploadMetrics.FILE_SIZE, 2_000_000d, MEDIUM);

    assertThatThrownBy(() -> new UploadMetricsEmitter(sink, out).emit(event))
        .isInstanceOf(SinkUnavailableException.class)
        .hasMessageContaining("uploaded_file_bytes")
        .hasRootCauseMessage("backend down")
        .satisfies(
            e -> {
              SinkUnavailableException failure = (SinkUnavailableException) e;
              assertThat(failure.metric()).isEqualTo(UploadMetrics.FILE_SIZE);
              assertThat(failure.context())
                  .containsEntry("file_type", "medium")
                  .containsEntry("size_bytes", "2000000");
            });
    verify(sink, never()).recordHistogram(UploadMetrics.REQUEST_DURATION, 0.5, MEDIUM);
    assertThat(stdout.size()).isZero();
  }

  @Test
  void formatsLargeSizesWithGrouping() {
    UploadEvent event = new UploadEvent(UploadCategory.VERY_LARGE, 99_999_999L, 10.449);

    assertThat(UploadMetricsEmitter.describe(event))
        .isEqualTo("Uploaded very_large file: 99,999,999 bytes, duration: 10.45s");
  }
}
