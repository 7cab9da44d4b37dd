package com.ospicorp.tagsync.series.service;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Translates strftime-style timestamp hints such as {@code %m/%d/%Y %I:%M:%S %p} into a parsing
 * {@link DateTimeFormatter}. Numeric fields accept one or two digits, text is matched without
 * regard to case, and missing time fields default to zero.
 */
public final class StrftimeFormat {
  private StrftimeFormat() {
  }

  public static DateTimeFormatter toFormatter(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new IllegalArgumentException("Timestamp format must be provided");
    }
    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().parseCaseInsensitive();
    boolean hasHour = false;
    boolean hasMinute = false;
    boolean hasSecond = false;
    boolean hasDate = false;

    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c != '%') {
        builder.appendLiteral(c);
        i++;
        continue;
      }
      if (i + 1 >= pattern.length()) {
        throw new IllegalArgumentException("Dangling '%' at the end of format " + pattern);
      }
      char directive = pattern.charAt(i + 1);
      // glibc's no-padding flag, e.g. %-m; parsing accepts one or two digits anyway
      if (directive == '-' && i + 2 < pattern.length()) {
        i++;
        directive = pattern.charAt(i + 1);
      }
      switch (directive) {
        case 'Y' -> {
          builder.appendValue(ChronoField.YEAR, 4);
          hasDate = true;
        }
        case 'y' -> {
          builder.appendValueReduced(ChronoField.YEAR, 2, 2, 2000);
          hasDate = true;
        }
        case 'm' -> {
          builder.appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE);
          hasDate = true;
        }
        case 'b' -> {
          builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
          hasDate = true;
        }
        case 'B' -> {
          builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
          hasDate = true;
        }
        case 'd' -> {
          builder.appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE);
          hasDate = true;
        }
        case 'j' -> {
          builder.appendValue(ChronoField.DAY_OF_YEAR, 1, 3, SignStyle.NOT_NEGATIVE);
          hasDate = true;
        }
        case 'H' -> {
          builder.appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE);
          hasHour = true;
        }
        case 'I' -> {
          builder.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 1, 2, SignStyle.NOT_NEGATIVE);
          hasHour = true;
        }
        case 'M' -> {
          builder.appendValue(ChronoField.MINUTE_OF_HOUR, 1, 2, SignStyle.NOT_NEGATIVE);
          hasMinute = true;
        }
        case 'S' -> {
          builder.appendValue(ChronoField.SECOND_OF_MINUTE, 1, 2, SignStyle.NOT_NEGATIVE);
          hasSecond = true;
        }
        case 'f' -> builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, false);
        case 'p' -> builder.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
        case '%' -> builder.appendLiteral('%');
        default -> throw new IllegalArgumentException(
            "Unsupported directive %" + directive + " in format " + pattern);
      }
      i += 2;
    }

    if (!hasDate) {
      throw new IllegalArgumentException("Format " + pattern + " has no date directive");
    }
    if (!hasHour) {
      builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
    }
    if (!hasMinute) {
      builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
    }
    if (!hasSecond) {
      builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
    }
    return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.SMART);
  }
}
