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

/**
 * Size class of a simulated upload. Weights add up to 100 and size bounds are inclusive at both
 * ends.
 */
public enum UploadCategory {
  SMALL("small", 50, 10_000L, 500_000L),
  MEDIUM("medium", 30, 500_000L, 5_000_000L),
  LARGE("large", 15, 5_000_000L, 50_000_000L),
  VERY_LARGE("very_large", 5, 50_000_000L, 100_000_000L);

  private final String label;
  private final int weight;
  private final long minBytes;
  private final long maxBytes;

  UploadCategory(String label, int weight, long minBytes, long maxBytes) {
    this.label = label;
    this.weight = weight;
    this.minBytes = minBytes;
    this.maxBytes = maxBytes;
  }

  /** Value of the {@code file_type} tag and of the console output. */
  public String label() {
    return label;
  }

  public int weight() {
    return weight;
  }

  public long minBytes() {
    return minBytes;
  }

  public long maxBytes() {
    return maxBytes;
  }

  public boolean contains(long sizeBytes) {
    return sizeBytes >= minBytes && sizeBytes <= maxBytes;
  }
}
