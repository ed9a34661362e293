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

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** One-shot stop request shared between the loop thread and whoever asks it to stop. */
public final class ShutdownSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  public void trigger() {
    latch.countDown();
  }

  public boolean isTriggered() {
    return latch.getCount() == 0;
  }

  /**
   * Waits up to {@code timeout} for a trigger.
   *
   * @return true if the signal was triggered, false if the timeout elapsed first
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
