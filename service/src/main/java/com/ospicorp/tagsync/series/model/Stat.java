package com.ospicorp.tagsync.series.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Statistics a downsampled interval can be reduced to. Declaration order is the output column
 * order.
 */
public enum Stat {
  VALUE("value", 'v'),
  MIN("min", 'i'),
  MAX("max", 'x'),
  MEAN("mean", 'm', 'a'),
  STD_DEV("std", 's', 'd');

  public static final Set<Stat> DEFAULT = Collections.unmodifiableSet(EnumSet.of(MEAN));

  private final String prefix;
  private final String flags;

  Stat(String prefix, char... flags) {
    this.prefix = prefix;
    this.flags = new String(flags);
  }

  public String flags() {
    return flags;
  }

  /**
   * Column label for this statistic. The value column keeps the series' own value label, every
   * other statistic is {@code <prefix>_<seriesName>}.
   */
  public String columnLabel(String seriesName, String valueLabel) {
    return this == VALUE ? valueLabel : prefix + "_" + seriesName;
  }

  /**
   * Parses single character flags ({@code v i x m a s d}), case-insensitive. Unknown characters
   * are ignored; a blank or wholly unrecognized string yields {@link #DEFAULT}.
   */
  public static Set<Stat> parseFlags(String text) {
    EnumSet<Stat> selected = EnumSet.noneOf(Stat.class);
    if (text != null) {
      String lower = text.toLowerCase(Locale.ROOT);
      for (Stat stat : values()) {
        for (char flag : stat.flags.toCharArray()) {
          if (lower.indexOf(flag) >= 0) {
            selected.add(stat);
          }
        }
      }
    }
    if (selected.isEmpty()) {
      return DEFAULT;
    }
    return Collections.unmodifiableSet(selected);
  }
}
