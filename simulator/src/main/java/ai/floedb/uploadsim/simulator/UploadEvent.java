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

import java.util.Objects;

/** One simulated upload. Lives for a single loop iteration. */
public record UploadEvent(UploadCategory category, long sizeBytes, double durationSeconds) {

  public UploadEvent {
    Objects.requireNonNull(category, "category");
    if (!category.contains(sizeBytes)) {
      throw new IllegalArgumentException(
          "size "
              + sizeBytes
              + " outside ["
              + category.minBytes()
              + ", "
              + category.maxBytes()
              + "] for "
              + category.label());
    }
    if (!Double.isFinite(durationSeconds) || durationSeconds < 0) {
      throw new IllegalArgumentException(
          "duration must be a non-negative number: " + durationSeconds);
    }
  }
}
