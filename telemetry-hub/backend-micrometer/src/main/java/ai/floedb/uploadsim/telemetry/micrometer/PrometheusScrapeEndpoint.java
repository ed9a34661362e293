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

package ai.floedb.uploadsim.telemetry.micrometer;

import ai.floedb.uploadsim.telemetry.SinkInitializationException;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves a {@link PrometheusMeterRegistry} in the text exposition format at {@code /metrics}. The
 * endpoint is pull-only: nothing is sent until a scraper asks.
 */
public final class PrometheusScrapeEndpoint implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(PrometheusScrapeEndpoint.class);

  private final PrometheusEndpointConfig config;
  private final HTTPServer server;
  private final int boundPort;

  private PrometheusScrapeEndpoint(PrometheusEndpointConfig config, HTTPServer server) {
    this.config = config;
    this.server = server;
    this.boundPort = server.getPort();
  }

  /**
   * Binds the HTTP server and starts serving.
   *
   * @throws SinkInitializationException if the address cannot be bound
   */
  public static PrometheusScrapeEndpoint start(
      PrometheusEndpointConfig config, PrometheusMeterRegistry registry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(registry, "registry");
    try {
      HTTPServer server =
          HTTPServer.builder()
              .hostname(config.host())
              .port(config.port())
              .registry(registry.getPrometheusRegistry())
              .buildAndStart();
      LOG.info("Prometheus scrape endpoint listening on {}:{}", config.host(), server.getPort());
      return new PrometheusScrapeEndpoint(config, server);
    } catch (IOException e) {
      throw new SinkInitializationException(
          "Cannot start Prometheus scrape endpoint on " + config.host() + ":" + config.port(), e);
    }
  }

  /** Actual bound port, which differs from the configured one when port 0 was requested. */
  public int port() {
    return boundPort;
  }

  /** URL a scraper on the local host can use. */
  public String metricsUrl() {
    String host =
        PrometheusEndpointConfig.DEFAULT_HOST.equals(config.host()) ? "localhost" : config.host();
    return "http://" + host + ":" + port() + "/metrics";
  }

  @Override
  public void close() {
    server.close();
    LOG.info("Prometheus scrape endpoint on port {} stopped", port());
  }

  @Override
  public String toString() {
    return "PrometheusScrapeEndpoint[" + config.host() + ":" + boundPort + "]";
  }
}
