package com.ospicorp.tagsync.series.service;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Period codes of the form {@code [int]<unit>}: {@code L} milliseconds, {@code S} seconds,
 * {@code T} minutes, {@code H} hours, {@code D} days. Case-insensitive; a missing count means 1.
 */
public final class ResamplePeriods {
  private static final Pattern PERIOD = Pattern.compile("^(\\d*)([LSTHD])$",
      Pattern.CASE_INSENSITIVE);

  private ResamplePeriods() {
  }

  public static Duration parse(String text) {
    if (!StringUtils.hasText(text)) {
      throw new IllegalArgumentException("Resample period must be provided");
    }
    Matcher matcher = PERIOD.matcher(text.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Unsupported resample period '" + text
          + "'. Expected [int]<unit> with unit L, S, T, H or D, e.g. 5S.");
    }
    long count;
    try {
      count = matcher.group(1).isEmpty() ? 1 : Long.parseLong(matcher.group(1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Resample period count is too large: " + text, ex);
    }
    if (count <= 0) {
      throw new IllegalArgumentException("Resample period must be positive: " + text);
    }
    try {
      return switch (matcher.group(2).toUpperCase(Locale.ROOT)) {
        case "L" -> Duration.ofMillis(count);
        case "S" -> Duration.ofSeconds(count);
        case "T" -> Duration.ofMinutes(count);
        case "H" -> Duration.ofHours(count);
        case "D" -> Duration.ofDays(count);
        default -> throw new IllegalStateException("Unhandled unit " + matcher.group(2));
      };
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("Resample period is too large: " + text, ex);
    }
  }

  /** Shortest code for {@code period}: 120 seconds is written as {@code 2T}. */
  public static String format(Duration period) {
    if (period == null) {
      return null;
    }
    long millis = period.toMillis();
    if (millis % Duration.ofDays(1).toMillis() == 0) {
      return period.toDays() + "D";
    }
    if (millis % Duration.ofHours(1).toMillis() == 0) {
      return period.toHours() + "H";
    }
    if (millis % Duration.ofMinutes(1).toMillis() == 0) {
      return period.toMinutes() + "T";
    }
    if (millis % 1000 == 0) {
      return period.toSeconds() + "S";
    }
    return millis + "L";
  }
}
