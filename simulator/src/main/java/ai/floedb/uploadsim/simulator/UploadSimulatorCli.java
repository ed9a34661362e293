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
import ai.floedb.uploadsim.telemetry.Telemetry;
import java.io.PrintStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Runs the simulator until the JVM is asked to terminate, then exits
 * with status 0 once the final metrics have been flushed.
 */
public final class UploadSimulatorCli {
  private static final Logger LOG = LoggerFactory.getLogger(UploadSimulatorCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(15);

  public static void main(String[] args) {
    ShutdownSignal signal = new ShutdownSignal();
    CountDownLatch finished = new CountDownLatch(1);
    AtomicInteger exitCode = new AtomicInteger(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  signal.trigger();
                  try {
                    if (finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                      Runtime.getRuntime().halt(exitCode.get());
                    }
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                },
                "uploadsim-shutdown"));

    int exit = 1;
    try {
      exit = new UploadSimulatorCli().run(args, System.out, System.err, signal);
    } finally {
      exitCode.set(exit);
      finished.countDown();
    }
    System.exit(exit);
  }

  /** Entry point that is easy to invoke from tests. Returns once {@code signal} fires. */
  int run(String[] args, PrintStream out, PrintStream err, ShutdownSignal signal) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (HelpRequested e) {
      printUsage(out);
      return 0;
    } catch (IllegalArgumentException e) {
      err.println("ERROR: " + e.getMessage());
      err.println();
      printUsage(err);
      return 1;
    }

    SimulatorConfig config;
    MetricsSink sink;
    try {
      config = SimulatorConfigLoader.load(options.overrides());
      sink = MetricsSinkFactory.create(config, Telemetry.newRegistryWithCore());
    } catch (IllegalArgumentException | SinkInitializationException e) {
      LOG.error("Cannot start upload simulator", e);
      err.println("ERROR: " + e.getMessage());
      return 1;
    }

    printBanner(out, config);
    UploadSimulator simulator =
        new UploadSimulator(
            new UploadEventGenerator(new Random(config.seed())),
            new UploadMetricsEmitter(sink, out),
            sink,
            signal);
    out.println();
    out.println("Simulating file uploads...");
    simulator.run();
    out.println();
    out.println("Shutting down...");
    return 0;
  }

  private static void printBanner(PrintStream out, SimulatorConfig config) {
    switch (config.mode()) {
      case PROMETHEUS -> {
        String host =
            "0.0.0.0".equals(config.prometheus().host()) ? "localhost" : config.prometheus().host();
        out.println("Starting Direct Prometheus Histogram Demo");
        out.printf("Metrics available at http://%s:%d/metrics%n", host, config.prometheus().port());
        out.println("Prometheus will scrape directly from this endpoint");
      }
      case OTLP -> {
        out.println("Starting OTLP Histogram Demo");
        out.printf(
            "Exporting metrics via OpenTelemetry to %s every %ds as %s%n",
            MetricsSinkFactory.otlpExport(config).metricsUrl(),
            config.otlp().exportInterval().toSeconds(),
            config.otlp().serviceName());
      }
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: java -jar uploadsim-simulator.jar [options]");
    out.println("  --mode prometheus|otlp      metrics delivery (default prometheus)");
    out.println("  --seed <long>               random seed (default 42)");
    out.println("  --host <address>            scrape endpoint bind address (default 0.0.0.0)");
    out.println("  --port <port>               scrape endpoint port (default 8001)");
    out.println("  --endpoint <url>            OTLP/HTTP collector base URL");
    out.println("                              (default http://localhost:4318)");
    out.println("  --export-interval <dur>     OTLP push interval, 5S or 5000 (default 5000 ms)");
    out.println("  --service-name <name>       OTLP service.name (default histogram-demo)");
    out.println("  --strict                    fail on metric contract violations");
    out.println("  -h, --help                  show this help");
  }

  private record CliOptions(Map<String, String> overrides) {
    private static final Map<String, String> VALUE_OPTIONS =
        Map.of(
            "--mode", "uploadsim.mode",
            "--seed", "uploadsim.seed",
            "--host", "uploadsim.prometheus.host",
            "--port", "uploadsim.prometheus.port",
            "--endpoint", "uploadsim.otlp.endpoint",
            "--export-interval", "uploadsim.otlp.export-interval",
            "--service-name", "uploadsim.otlp.service-name");

    static CliOptions parse(String[] args) {
      Map<String, String> overrides = new LinkedHashMap<>();
      if (args == null) {
        return new CliOptions(overrides);
      }
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if (arg == null || arg.isBlank()) {
          continue;
        }
        String value = arg.trim();
        String inline = null;
        int eq = value.indexOf('=');
        if (value.startsWith("--") && eq > 0) {
          inline = value.substring(eq + 1);
          value = value.substring(0, eq);
        }
        if (value.equals("--help") || value.equals("-h")) {
          throw new HelpRequested();
        } else if (value.equals("--strict")) {
          overrides.put("uploadsim.telemetry.strict", "true");
        } else if (VALUE_OPTIONS.containsKey(value)) {
          String optionValue = inline;
          if (optionValue == null) {
            if (i + 1 >= args.length) {
              throw new IllegalArgumentException("Missing value for " + value);
            }
            optionValue = args[++i];
          }
          if (optionValue == null || optionValue.isBlank()) {
            throw new IllegalArgumentException("Missing value for " + value);
          }
          overrides.put(VALUE_OPTIONS.get(value), optionValue.trim());
        } else if (value.startsWith("-")) {
          throw new IllegalArgumentException("Unknown option: " + value);
        } else {
          throw new IllegalArgumentException("Unexpected argument: " + value);
        }
      }
      return new CliOptions(Map.copyOf(overrides));
    }
  }

  /** Internal signal used to distinguish --help from regular argument errors. */
  private static final class HelpRequested extends RuntimeException {}
}
