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

import ai.floedb.uploadsim.telemetry.SinkInitializationException;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporter;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires resource, OTLP/HTTP exporter and periodic reader into an {@link SdkMeterProvider}. */
public final class OtlpPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(OtlpPipeline.class);

  private OtlpPipeline() {}

  /**
   * Builds a meter provider that pushes to the configured collector on a fixed interval.
   *
   * @throws SinkInitializationException if the exporter rejects the configuration
   */
  public static SdkMeterProvider meterProvider(OtlpExportConfig config) {
    Objects.requireNonNull(config, "config");
    MetricExporter exporter;
    try {
      exporter =
          OtlpHttpMetricExporter.builder()
              .setEndpoint(config.metricsUrl())
              .setTimeout(config.exportTimeout())
              .build();
    } catch (IllegalArgumentException e) {
      throw new SinkInitializationException(
          "Invalid OTLP endpoint " + config.endpoint() + ": " + e.getMessage(), e);
    }
    MetricReader reader =
        PeriodicMetricReader.builder(exporter).setInterval(config.exportInterval()).build();
    LOG.info(
        "Pushing metrics to {} every {} as service {}",
        config.metricsUrl(),
        config.exportInterval(),
        config.serviceName());
    return meterProvider(config, reader);
  }

  /** Builds a meter provider with the service resource and a caller-supplied reader. */
  public static SdkMeterProvider meterProvider(OtlpExportConfig config, MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    return SdkMeterProvider.builder()
        .setResource(resource(config))
        .registerMetricReader(reader)
        .build();
  }

  static Resource resource(OtlpExportConfig config) {
    return Resource.getDefault()
        .merge(
            Resource.create(
                Attributes.builder()
                    .put("service.name", config.serviceName())
                    .put("service.version", config.serviceVersion())
                    .build()));
  }
}
