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

import java.util.concurrent.atomic.AtomicBoolean;

/** Sink that discards every measurement. */
public final class NoopMetricsSink implements MetricsSink {
  private final AtomicBoolean closed = new AtomicBoolean();

  @Override
  public void incrementCounter(MetricId metric, Tag... tags) {
    ensureOpen(metric);
  }

  @Override
  public void recordHistogram(MetricId metric, double value, Tag... tags) {
    ensureOpen(metric);
  }

  @Override
  public void shutdown() {
    closed.set(true);
  }

  private void ensureOpen(MetricId metric) {
    if (closed.get()) {
      throw new SinkUnavailableException("sink is shut down", metric, null);
    }
  }
}
