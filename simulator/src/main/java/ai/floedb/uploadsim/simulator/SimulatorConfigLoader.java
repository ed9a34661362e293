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

import io.smallrye.config.ConfigValidationException;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Loads {@link SimulatorConfig}. Sources by decreasing priority: command line overrides, system
 * properties, environment variables ({@code UPLOADSIM_PROMETHEUS_PORT} and so on), {@code
 * META-INF/microprofile-config.properties}.
 */
public final class SimulatorConfigLoader {
  static final int OVERRIDES_ORDINAL = 500;

  private SimulatorConfigLoader() {}

  public static SimulatorConfig load() {
    return load(Map.of());
  }

  /**
   * @param overrides full property names (for example {@code uploadsim.seed}) to values
   * @throws IllegalArgumentException if a value cannot be converted
   */
  public static SimulatorConfig load(Map<String, String> overrides) {
    try {
      SmallRyeConfig config =
          new SmallRyeConfigBuilder()
              .addDefaultSources()
              .withSources(
                  new PropertiesConfigSource(overrides, "uploadsim-overrides", OVERRIDES_ORDINAL))
              .withMapping(SimulatorConfig.class)
              .build();
      return config.getConfigMapping(SimulatorConfig.class);
    } catch (ConfigValidationException e) {
      throw new IllegalArgumentException(describe(e), e);
    } catch (IllegalArgumentException | NoSuchElementException e) {
      throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static String describe(ConfigValidationException e) {
    StringBuilder message = new StringBuilder("Invalid configuration");
    for (int i = 0; i < e.getProblemCount(); i++) {
      message.append(i == 0 ? ": " : "; ").append(e.getProblem(i).getMessage());
    }
    return message.toString();
  }
}
