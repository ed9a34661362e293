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
import ai.floedb.uploadsim.telemetry.SinkUnavailableException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run loop: generate an event, emit it, pause, repeat until the {@link ShutdownSignal} fires. The
 * sink is shut down exactly once when the loop ends. A simulator runs once.
 */
public final class UploadSimulator {
  private static final Logger LOG = LoggerFactory.getLogger(UploadSimulator.class);

  public enum State {
    NEW,
    RUNNING,
    STOPPED
  }

  private final UploadEventGenerator generator;
  private final UploadMetricsEmitter emitter;
  private final MetricsSink sink;
  private final ShutdownSignal signal;
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
  private final CountDownLatch stopped = new CountDownLatch(1);
  private final AtomicLong emitted = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public UploadSimulator(
      UploadEventGenerator generator,
      UploadMetricsEmitter emitter,
      MetricsSink sink,
      ShutdownSignal signal) {
    this.generator = Objects.requireNonNull(generator, "generator");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  /**
   * Blocks the calling thread until the signal is triggered or the thread is interrupted.
   *
   * @throws IllegalStateException if the simulator has already been started
   */
  public void run() {
    if (!state.compareAndSet(State.NEW, State.RUNNING)) {
      throw new IllegalStateException("Simulator cannot run again, state is " + state.get());
    }
    LOG.debug("Upload simulator started");
    try {
      loop();
    } finally {
      state.set(State.STOPPED);
      try {
        sink.shutdown();
      } finally {
        stopped.countDown();
        LOG.info(
            "Upload simulator stopped after {} uploads ({} failed emissions)",
            emitted.get(),
            failed.get());
      }
    }
  }

  private void loop() {
    while (!signal.isTriggered() && !Thread.currentThread().isInterrupted()) {
      UploadEvent event = generator.next();
      try {
        emitter.emit(event);
        emitted.incrementAndGet();
      } catch (SinkUnavailableException e) {
        failed.incrementAndGet();
        LOG.error("Dropped metrics for {} with context {}", event, e.context(), e);
      }
      Duration pause = generator.nextPause();
      try {
        if (signal.await(pause)) {
          return;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.info("Upload simulator interrupted, stopping");
        return;
      }
    }
  }

  /**
   * Waits for a running loop to finish, including the sink shutdown.
   *
   * @return true if the loop stopped within the timeout
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public State state() {
    return state.get();
  }

  public long emittedEvents() {
    return emitted.get();
  }

  public long failedEmissions() {
    return failed.get();
  }
}
