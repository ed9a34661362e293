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
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eclipse.microprofile.config.spi.Converter;

/**
 * Accepts ISO-8601 durations ({@code PT5S}), the short form {@code 5S} / {@code 250ms} / {@code
 * 2m}, and a bare number of milliseconds ({@code 5000}).
 */
public final class DurationConverter implements Converter<Duration> {
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern MILLIS = Pattern.compile("(\\d+)ms");
  private static final Pattern SHORT = Pattern.compile("\\d+(\\.\\d+)?[smh]");

  @Override
  public Duration convert(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (DIGITS.matcher(lower).matches()) {
      return Duration.ofMillis(Long.parseLong(lower));
    }
    Matcher millis = MILLIS.matcher(lower);
    if (millis.matches()) {
      return Duration.ofMillis(Long.parseLong(millis.group(1)));
    }
    String iso = SHORT.matcher(lower).matches() ? "PT" + trimmed : trimmed;
    try {
      return Duration.parse(iso.toUpperCase(Locale.ROOT));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid duration: " + value, e);
    }
  }
}
