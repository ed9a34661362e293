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

package ai.floedb.uploadsim.telemetry;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes tags before they reach a backend.
 *
 * <p>Keys must be valid Prometheus label names after lower-casing, so the same tag works for the
 * scrape endpoint and for OTLP attributes. Values are trimmed, internal whitespace is collapsed and
 * long values are truncated.
 */
public final class TagSanitizer {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");
  private static final int MAX_VALUE_LENGTH = 128;
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TagSanitizer() {}

  public static Optional<Tag> sanitize(Tag tag, TelemetryPolicy policy) {
    if (tag == null) {
      return reject(policy, "tag must not be null");
    }
    String key = tag.key().trim().toLowerCase(Locale.ROOT);
    if (!KEY_PATTERN.matcher(key).matches()) {
      return reject(policy, "invalid tag key: " + tag.key());
    }
    String value = sanitizeValue(tag.value());
    if (value.isEmpty()) {
      return reject(policy, "tag value must not be blank for key " + key);
    }
    return Optional.of(Tag.of(key, value));
  }

  private static Optional<Tag> reject(TelemetryPolicy policy, String message) {
    if (policy.isStrict()) {
      throw new IllegalArgumentException(message);
    }
    return Optional.empty();
  }

  private static String sanitizeValue(String value) {
    String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ");
    if (collapsed.length() > MAX_VALUE_LENGTH) {
      return collapsed.substring(0, MAX_VALUE_LENGTH);
    }
    return collapsed;
  }
}
