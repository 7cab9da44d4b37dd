package com.ospicorp.tagsync.series.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class StatTest {

  @Test
  void flagsSelectStatisticsInDeclarationOrder() {
    assertThat(Stat.parseFlags("mxi")).containsExactly(Stat.MIN, Stat.MAX, Stat.MEAN);
  }

  @Test
  void flagsAreCaseInsensitiveAndHaveAliases() {
    assertThat(Stat.parseFlags("A")).containsExactly(Stat.MEAN);
    assertThat(Stat.parseFlags("d")).containsExactly(Stat.STD_DEV);
    assertThat(Stat.parseFlags("VS")).containsExactly(Stat.VALUE, Stat.STD_DEV);
  }

  @Test
  void blankOrUnknownFlagsFallBackToMean() {
    assertThat(Stat.parseFlags(null)).isEqualTo(Stat.DEFAULT);
    assertThat(Stat.parseFlags("")).isEqualTo(Stat.DEFAULT);
    assertThat(Stat.parseFlags("zq")).containsExactly(Stat.MEAN);
  }

  @Test
  void valueColumnKeepsSeriesLabel() {
    assertThat(Stat.VALUE.columnLabel("T1", "value_T1")).isEqualTo("value_T1");
    assertThat(Stat.MIN.columnLabel("T1", "value_T1")).isEqualTo("min_T1");
    assertThat(Stat.STD_DEV.columnLabel("T1", "value_T1")).isEqualTo("std_T1");
  }

  @Test
  void resampleSpecDefaultsToMean() {
    ResampleSpec spec = new ResampleSpec(Duration.ofSeconds(5), null);
    assertThat(spec.stats()).containsExactly(Stat.MEAN);
    assertThat(spec.hasDefaultStats()).isTrue();
    assertThat(ResampleSpec.of(Duration.ofSeconds(5), "x").hasDefaultStats()).isFalse();
  }
}
