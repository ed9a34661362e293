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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a measurement could not be handed to a {@link MetricsSink}, either because the sink
 * has been shut down or because the backend failed. Carries the metric and a free-form context so
 * callers can log what was lost.
 */
public final class SinkUnavailableException extends RuntimeException {
  private final MetricId metric;
  private final Map<String, String> context;

  public SinkUnavailableException(String message, MetricId metric, Map<String, String> context) {
    this(message, metric, context, null);
  }

  public SinkUnavailableException(
      String message, MetricId metric, Map<String, String> context, Throwable cause) {
    super(message, cause);
    this.metric = metric;
    this.context =
        context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /** Metric that was being recorded, may be null when the failure is not tied to one. */
  public MetricId metric() {
    return metric;
  }

  public Map<String, String> context() {
    return context;
  }
}
