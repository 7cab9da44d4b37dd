package com.ospicorp.tagsync.series.service;

import java.time.Duration;
import java.time.LocalDateTime;

// Grid arithmetic shared by the resampler and the aligner. Grids are anchored at a midnight.
final class TimeGrid {
  private static final int NANOS_PER_MILLI = 1_000_000;

  private TimeGrid() {
  }

  static LocalDateTime midnightOf(LocalDateTime timestamp) {
    return timestamp.toLocalDate().atStartOfDay();
  }

  static LocalDateTime floor(LocalDateTime timestamp, LocalDateTime anchor, Duration period) {
    long step = period.toNanos();
    long offset = Duration.between(anchor, timestamp).toNanos();
    return anchor.plusNanos(Math.floorDiv(offset, step) * step);
  }

  static LocalDateTime ceil(LocalDateTime timestamp, LocalDateTime anchor, Duration period) {
    long step = period.toNanos();
    long offset = Duration.between(anchor, timestamp).toNanos();
    long steps = Math.floorDiv(offset, step);
    if (Math.floorMod(offset, step) != 0) {
      steps++;
    }
    return anchor.plusNanos(steps * step);
  }

  // Half-even, so a value exactly between two milliseconds goes to the even one.
  static LocalDateTime roundToMillis(LocalDateTime timestamp) {
    int nanos = timestamp.getNano();
    int subMillis = nanos % NANOS_PER_MILLI;
    if (subMillis == 0) {
      return timestamp;
    }
    LocalDateTime truncated = timestamp.minusNanos(subMillis);
    boolean oddMillis = (nanos / NANOS_PER_MILLI) % 2 == 1;
    if (subMillis > NANOS_PER_MILLI / 2 || (subMillis == NANOS_PER_MILLI / 2 && oddMillis)) {
      return truncated.plusNanos(NANOS_PER_MILLI);
    }
    return truncated;
  }
}
