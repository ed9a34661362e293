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
import java.util.Objects;
import java.util.Random;

/**
 * Produces pseudo-random upload events. All draws come from one {@link Random}, so a fixed seed
 * reproduces the sequence of events and pauses.
 */
public final class UploadEventGenerator {
  static final double BASE_DURATION_SECONDS = 0.1;
  static final double BYTES_PER_SECOND = 10_000_000d;
  static final double MAX_JITTER_SECONDS = 0.5;
  static final double MIN_PAUSE_SECONDS = 0.5;
  static final double MAX_PAUSE_SECONDS = 2.0;

  private static final int TOTAL_WEIGHT = totalWeight();

  private final Random random;

  public UploadEventGenerator(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  public UploadEventGenerator(long seed) {
    this(new Random(seed));
  }

  /** Draws category, then size, then duration jitter. */
  public UploadEvent next() {
    UploadCategory category = nextCategory();
    long span = category.maxBytes() - category.minBytes() + 1;
    long size = category.minBytes() + random.nextInt(Math.toIntExact(span));
    double duration =
        BASE_DURATION_SECONDS + size / BYTES_PER_SECOND + random.nextDouble() * MAX_JITTER_SECONDS;
    return new UploadEvent(category, size, duration);
  }

  /** Pause before the next upload, uniform in [0.5s, 2.0s). */
  public Duration nextPause() {
    double seconds =
        MIN_PAUSE_SECONDS + random.nextDouble() * (MAX_PAUSE_SECONDS - MIN_PAUSE_SECONDS);
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  private UploadCategory nextCategory() {
    int roll = random.nextInt(TOTAL_WEIGHT);
    int cumulative = 0;
    for (UploadCategory category : UploadCategory.values()) {
      cumulative += category.weight();
      if (roll < cumulative) {
        return category;
      }
    }
    throw new IllegalStateException("category weights do not cover roll " + roll);
  }

  private static int totalWeight() {
    int total = 0;
    for (UploadCategory category : UploadCategory.values()) {
      total += category.weight();
    }
    return total;
  }
}
