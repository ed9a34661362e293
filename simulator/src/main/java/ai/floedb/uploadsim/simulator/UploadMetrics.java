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

import ai.floedb.uploadsim.telemetry.MetricDef;
import ai.floedb.uploadsim.telemetry.MetricId;
import java.util.List;
import java.util.Set;

/** Metrics emitted for every simulated upload. */
public final class UploadMetrics {
  static final String ORIGIN = "simulator";

  /** Tag carried by every upload metric. */
  public static final String FILE_TYPE = "file_type";

  public static final MetricId UPLOADS = MetricId.counter("file_uploads_total", ORIGIN);
  public static final MetricId FILE_SIZE =
      MetricId.histogram("uploaded_file_bytes", "bytes", ORIGIN);
  public static final MetricId REQUEST_DURATION =
      MetricId.histogram("http_request_duration_seconds", "seconds", ORIGIN);

  public static final List<Double> FILE_SIZE_BUCKETS =
      List.of(100_000d, 500_000d, 1_000_000d, 5_000_000d, 10_000_000d, 50_000_000d, 100_000_000d);
  public static final List<Double> REQUEST_DURATION_BUCKETS =
      List.of(0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0);

  private UploadMetrics() {}

  static List<MetricDef> definitions() {
    Set<String> tags = Set.of(FILE_TYPE);
    return List.of(
        new MetricDef(UPLOADS, tags, tags, "Total number of file uploads"),
        new MetricDef(
            FILE_SIZE, tags, tags, "Size of uploaded files in bytes", FILE_SIZE_BUCKETS),
        new MetricDef(
            REQUEST_DURATION,
            tags,
            tags,
            "HTTP request latency in seconds",
            REQUEST_DURATION_BUCKETS));
  }
}
