package com.ospicorp.tagsync.series.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record ResampleSpec(Duration targetPeriod, Set<Stat> stats) {

  public ResampleSpec {
    stats = (stats == null || stats.isEmpty())
        ? Stat.DEFAULT
        : Collections.unmodifiableSet(EnumSet.copyOf(stats));
  }

  public static ResampleSpec of(Duration targetPeriod, String statFlags) {
    return new ResampleSpec(targetPeriod, Stat.parseFlags(statFlags));
  }

  public boolean hasDefaultStats() {
    return Stat.DEFAULT.equals(stats);
  }
}
