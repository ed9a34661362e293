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

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithConverter;
import io.smallrye.config.WithDefault;
import java.time.Duration;

@ConfigMapping(prefix = "uploadsim")
public interface SimulatorConfig {
  @WithDefault("prometheus")
  SinkMode mode();

  @WithDefault("42")
  long seed();

  TelemetryOptions telemetry();

  Prometheus prometheus();

  Otlp otlp();

  interface TelemetryOptions {
    /** Throw on metric contract violations instead of dropping and counting them. */
    @WithDefault("false")
    boolean strict();
  }

  interface Prometheus {
    @WithDefault("0.0.0.0")
    String host();

    @WithDefault("8001")
    int port();
  }

  interface Otlp {
    @WithDefault("http://localhost:4318")
    String endpoint();

    @WithDefault("5000")
    @WithConverter(DurationConverter.class)
    Duration exportInterval();

    @WithDefault("10S")
    @WithConverter(DurationConverter.class)
    Duration exportTimeout();

    @WithDefault("histogram-demo")
    String serviceName();

    @WithDefault("dev")
    String serviceVersion();
  }
}
