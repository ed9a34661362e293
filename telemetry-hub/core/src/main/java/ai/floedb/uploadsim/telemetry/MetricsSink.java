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

/**
 * Destination for measurements. Implementations wrap a metrics library and decide whether values
 * are pulled (scrape endpoint) or pushed (exporter).
 *
 * <p>Once {@link #shutdown()} has run, every recording call throws {@link
 * SinkUnavailableException}.
 */
public interface MetricsSink extends AutoCloseable {

  /** Adds one to a monotonically increasing counter. */
  void incrementCounter(MetricId metric, Tag... tags);

  /** Records one observation into a histogram. */
  void recordHistogram(MetricId metric, double value, Tag... tags);

  /** Flushes pending data and releases backend resources. Safe to call more than once. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
