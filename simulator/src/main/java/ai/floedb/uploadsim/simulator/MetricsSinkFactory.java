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

import ai.floedb.uploadsim.telemetry.MetricsSink;
import ai.floedb.uploadsim.telemetry.SinkInitializationException;
import ai.floedb.uploadsim.telemetry.TelemetryPolicy;
import ai.floedb.uploadsim.telemetry.TelemetryRegistry;
import ai.floedb.uploadsim.telemetry.micrometer.MicrometerMetricsSink;
import ai.floedb.uploadsim.telemetry.micrometer.PrometheusEndpointConfig;
import ai.floedb.uploadsim.telemetry.micrometer.PrometheusScrapeEndpoint;
import ai.floedb.uploadsim.telemetry.otel.OpenTelemetryMetricsSink;
import ai.floedb.uploadsim.telemetry.otel.OtlpExportConfig;
import ai.floedb.uploadsim.telemetry.otel.OtlpPipeline;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import java.util.Objects;

/** Builds the single {@link MetricsSink} of the process from the loaded configuration. */
public final class MetricsSinkFactory {

  private MetricsSinkFactory() {}

  /**
   * @throws SinkInitializationException if the backend cannot be started
   */
  public static MetricsSink create(SimulatorConfig config, TelemetryRegistry telemetryRegistry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(telemetryRegistry, "telemetryRegistry");
    TelemetryPolicy policy = TelemetryPolicy.fromStrictFlag(config.telemetry().strict());
    return switch (config.mode()) {
      case PROMETHEUS -> prometheus(prometheusEndpoint(config), telemetryRegistry, policy);
      case OTLP -> otlp(otlpExport(config), telemetryRegistry, policy);
    };
  }

  public static MetricsSink prometheus(
      PrometheusEndpointConfig endpointConfig,
      TelemetryRegistry telemetryRegistry,
      TelemetryPolicy policy) {
    PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    PrometheusScrapeEndpoint endpoint;
    try {
      endpoint = PrometheusScrapeEndpoint.start(endpointConfig, registry);
    } catch (SinkInitializationException e) {
      registry.close();
      throw e;
    }
    return new MicrometerMetricsSink(registry, telemetryRegistry, policy, endpoint);
  }

  public static MetricsSink otlp(
      OtlpExportConfig exportConfig, TelemetryRegistry telemetryRegistry, TelemetryPolicy policy) {
    SdkMeterProvider provider = OtlpPipeline.meterProvider(exportConfig);
    return new OpenTelemetryMetricsSink(
        provider, telemetryRegistry, policy, exportConfig.exportTimeout());
  }

  static PrometheusEndpointConfig prometheusEndpoint(SimulatorConfig config) {
    return new PrometheusEndpointConfig(config.prometheus().host(), config.prometheus().port());
  }

  static OtlpExportConfig otlpExport(SimulatorConfig config) {
    SimulatorConfig.Otlp otlp = config.otlp();
    return new OtlpExportConfig(
        otlp.endpoint(),
        otlp.exportInterval(),
        otlp.exportTimeout(),
        otlp.serviceName(),
        otlp.serviceVersion());
  }
}
