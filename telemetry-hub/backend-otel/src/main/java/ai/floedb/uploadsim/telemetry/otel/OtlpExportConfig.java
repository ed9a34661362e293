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

package ai.floedb.uploadsim.telemetry.otel;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the OTLP/HTTP push pipeline.
 *
 * @param endpoint collector base URL; {@code /v1/metrics} is appended
 * @param exportInterval time between two pushes
 * @param exportTimeout limit for a single export, also used as the shutdown flush limit
 * @param serviceName value of the {@code service.name} resource attribute
 * @param serviceVersion value of the {@code service.version} resource attribute
 */
public record OtlpExportConfig(
    String endpoint,
    Duration exportInterval,
    Duration exportTimeout,
    String serviceName,
    String serviceVersion) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4318";
  public static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofMillis(5000);
  public static final Duration DEFAULT_EXPORT_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_SERVICE_NAME = "histogram-demo";

  public OtlpExportConfig {
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("endpoint must not be blank");
    }
    requirePositive(exportInterval, "exportInterval");
    requirePositive(exportTimeout, "exportTimeout");
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("serviceName must not be blank");
    }
    serviceVersion = serviceVersion == null || serviceVersion.isBlank() ? "dev" : serviceVersion;
  }

  public static OtlpExportConfig defaults() {
    return new OtlpExportConfig(
        DEFAULT_ENDPOINT,
        DEFAULT_EXPORT_INTERVAL,
        DEFAULT_EXPORT_TIMEOUT,
        DEFAULT_SERVICE_NAME,
        null);
  }

  /** Full URL of the OTLP/HTTP metrics resource. */
  public String metricsUrl() {
    String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    return base + "/v1/metrics";
  }

  private static void requirePositive(Duration value, String label) {
    Objects.requireNonNull(value, label);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(label + " must be positive: " + value);
    }
  }
}
