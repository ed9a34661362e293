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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.floedb.uploadsim.telemetry.MetricId;
import ai.floedb.uploadsim.telemetry.MetricsSink;
import ai.floedb.uploadsim.telemetry.RecordingMetricsSink;
import ai.floedb.uploadsim.telemetry.Tag;
import java.io.OutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class UploadSimulatorTest {
  private final PrintStream out = new PrintStream(OutputStream.nullOutputStream());

  @Test
  void triggerDuringPauseStopsWithinOneSecond() throws Exception {
    RecordingMetricsSink sink = new RecordingMetricsSink();
    ShutdownSignal signal = new ShutdownSignal();
    UploadSimulator simulator = simulator(new UploadEventGenerator(new Random(42)), sink, signal);
    Thread loop = new Thread(simulator::run, "upload-loop");
    loop.start();

    waitUntil(() -> sink.counterValue(UploadMetrics.UPLOADS) >= 1);
    long start = System.nanoTime();
    signal.trigger();
    assertThat(simulator.awaitStopped(Duration.ofSeconds(1))).isTrue();
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    loop.join(1_000);

    assertThat(elapsedMillis).isLessThan(1_000);
    assertThat(simulator.state()).isEqualTo(UploadSimulator.State.STOPPED);
    assertThat(sink.shutdownCalls()).isEqualTo(1);
    assertThat(simulator.emittedEvents()).isEqualTo(sink.counterValue(UploadMetrics.UPLOADS));
  }

  @Test
  void alreadyTriggeredSignalEmitsNothing() {
    RecordingMetricsSink sink = new RecordingMetricsSink();
    ShutdownSignal signal = new ShutdownSignal();
    signal.trigger();
    UploadSimulator simulator = simulator(new UploadEventGenerator(42L), sink, signal);

    simulator.run();

    assertThat(simulator.emittedEvents()).isZero();
    assertThat(sink.counterValue(UploadMetrics.UPLOADS)).isZero();
    assertThat(sink.shutdownCalls()).isEqualTo(1);
  }

  @Test
  void stoppedSimulatorCannotRunAgain() {
    RecordingMetricsSink sink = new RecordingMetricsSink();
    ShutdownSignal signal = new ShutdownSignal();
    signal.trigger();
    UploadSimulator simulator = simulator(new UploadEventGenerator(42L), sink, signal);
    simulator.run();

    assertThatThrownBy(simulator::run)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("STOPPED");
    assertThat(sink.shutdownCalls()).isEqualTo(1);
  }

  @Test
  void failingSinkDoesNotStopTheLoop() throws Exception {
    UploadEvent event = new UploadEvent(UploadCategory.LARGE, 7_000_000L, 1.2);
    UploadEventGenerator generator = mock(UploadEventGenerator.class);
    when(generator.next()).thenReturn(event);
    when(generator.nextPause()).thenReturn(Duration.ofMillis(5));
    MetricsSink sink = mock(MetricsSink.class);
    doThrow(new IllegalStateException("collector unreachable"))
        .when(sink)
        .incrementCounter(any(MetricId.class), any(Tag[].class));
    ShutdownSignal signal = new ShutdownSignal();
    UploadSimulator simulator = simulator(generator, sink, signal);
    Thread loop = new Thread(simulator::run, "upload-loop");
    loop.start();

    waitUntil(() -> simulator.failedEmissions() >= 3);
    signal.trigger();
    assertThat(simulator.awaitStopped(Duration.ofSeconds(2))).isTrue();
    loop.join(1_000);

    assertThat(simulator.emittedEvents()).isZero();
    verify(sink, times(1)).shutdown();
  }

  @Test
  void interruptionStopsTheLoop() throws Exception {
    RecordingMetricsSink sink = new RecordingMetricsSink();
    UploadSimulator simulator =
        simulator(new UploadEventGenerator(new Random(1)), sink, new ShutdownSignal());
    Thread loop = new Thread(simulator::run, "upload-loop");
    loop.start();

    waitUntil(() -> sink.counterValue(UploadMetrics.UPLOADS) >= 1);
    loop.interrupt();

    assertThat(simulator.awaitStopped(Duration.ofSeconds(1))).isTrue();
    assertThat(sink.isShutdown()).isTrue();
  }

  private UploadSimulator simulator(
      UploadEventGenerator generator, MetricsSink sink, ShutdownSignal signal) {
    return new UploadSimulator(generator, new UploadMetricsEmitter(sink, out), sink, signal);
  }

  private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10s");
      }
      Thread.sleep(5);
    }
  }
}
