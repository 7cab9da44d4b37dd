package com.ospicorp.tagsync.series.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.AbstractList;
import java.util.List;

/**
 * Regular timestamp axis from {@code start} to {@code end} inclusive, stepped by {@code period}.
 * Timestamps are computed on access rather than stored.
 */
public record MasterGrid(LocalDateTime start, LocalDateTime end, Duration period) {

  public MasterGrid {
    if (period == null || period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("Grid period must be positive, was " + period);
    }
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("Grid start " + start + " is after end " + end);
    }
  }

  public static long pointCount(LocalDateTime start, LocalDateTime end, Duration period) {
    return Duration.between(start, end).toNanos() / period.toNanos() + 1;
  }

  public int size() {
    return Math.toIntExact(pointCount(start, end, period));
  }

  public LocalDateTime get(int i) {
    return start.plusNanos(i * period.toNanos());
  }

  public List<LocalDateTime> timestamps() {
    int size = size();
    return new AbstractList<>() {
      @Override
      public LocalDateTime get(int index) {
        if (index < 0 || index >= size) {
          throw new IndexOutOfBoundsException(index);
        }
        return MasterGrid.this.get(index);
      }

      @Override
      public int size() {
        return size;
      }
    };
  }
}
