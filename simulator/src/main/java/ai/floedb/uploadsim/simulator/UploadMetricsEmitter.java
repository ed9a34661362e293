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

import ai.floedb.uploadsim.telemetry.MetricId;
import ai.floedb.uploadsim.telemetry.MetricsSink;
import ai.floedb.uploadsim.telemetry.SinkUnavailableException;
import ai.floedb.uploadsim.telemetry.Tag;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Turns an {@link UploadEvent} into one counter increment and two histogram observations. */
public final class UploadMetricsEmitter {
  private final MetricsSink sink;
  private final PrintStream out;

  public UploadMetricsEmitter(MetricsSink sink, PrintStream out) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * Records the event and prints a summary line. Nothing is retried.
   *
   * @throws SinkUnavailableException if the sink rejects any of the measurements
   */
  public void emit(UploadEvent event) {
    Objects.requireNonNull(event, "event");
    Tag fileType = Tag.of(UploadMetrics.FILE_TYPE, event.category().label());
    record(
        UploadMetrics.UPLOADS, event, () -> sink.incrementCounter(UploadMetrics.UPLOADS, fileType));
    record(
        UploadMetrics.FILE_SIZE,
        event,
        () -> sink.recordHistogram(UploadMetrics.FILE_SIZE, event.sizeBytes(), fileType));
    record(
        UploadMetrics.REQUEST_DURATION,
        event,
        () ->
            sink.recordHistogram(
                UploadMetrics.REQUEST_DURATION, event.durationSeconds(), fileType));
    out.println(describe(event));
  }

  static String describe(UploadEvent event) {
    return String.format(
        Locale.US,
        "Uploaded %s file: %,d bytes, duration: %.2fs",
        event.category().label(),
        event.sizeBytes(),
        event.durationSeconds());
  }

  private static void record(MetricId metric, UploadEvent event, Runnable call) {
    try {
      call.run();
    } catch (RuntimeException e) {
      throw new SinkUnavailableException(
          "Failed to record " + metric.name() + ": " + e.getMessage(),
          metric,
          context(metric, event),
          e);
    }
  }

  private static Map<String, String> context(MetricId metric, UploadEvent event) {
    Map<String, String> context = new LinkedHashMap<>();
    context.put("metric", metric.name());
    context.put("file_type", event.category().label());
    context.put("size_bytes", Long.toString(event.sizeBytes()));
    context.put("duration_seconds", Double.toString(event.durationSeconds()));
    return context;
  }
}
