package com.ospicorp.tagsync.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ValueFilterTest {

  @Test
  void rangeFilterIsInclusive() {
    ValueFilter filter = ValueFilter.compile("val >= 0 and val <= 100");

    assertThat(filter.test(100.0)).isTrue();
    assertThat(filter.test(100.001)).isFalse();
    assertThat(filter.test(0.0)).isTrue();
    assertThat(filter.test(-0.5)).isFalse();
  }

  @Test
  void chainedComparisonRequiresEveryPair() {
    ValueFilter filter = ValueFilter.compile("0 <= val < 100");

    assertThat(filter.test(0)).isTrue();
    assertThat(filter.test(99.9)).isTrue();
    assertThat(filter.test(100)).isFalse();
  }

  @Test
  void orBindsLooserThanAnd() {
    ValueFilter filter = ValueFilter.compile("(val > 1 and val < 3) or val == 10");

    assertThat(filter.test(2)).isTrue();
    assertThat(filter.test(10)).isTrue();
    assertThat(filter.test(5)).isFalse();
  }

  @Test
  void keywordsAreCaseInsensitiveAndNumbersMayBeSigned() {
    ValueFilter filter = ValueFilter.compile("VAL != -1.5e0 AND val > -10");

    assertThat(filter.test(-1.5)).isFalse();
    assertThat(filter.test(2)).isTrue();
    assertThat(filter.test(-20)).isFalse();
  }

  @Test
  void rejectsAnythingOutsideTheGrammar() {
    assertThatThrownBy(() -> ValueFilter.compile("val > ")).isInstanceOf(FilterSyntaxException.class);
    assertThatThrownBy(() -> ValueFilter.compile("(val > 1")).isInstanceOf(FilterSyntaxException.class);
    assertThatThrownBy(() -> ValueFilter.compile("val > 1 val")).isInstanceOf(FilterSyntaxException.class);
    assertThatThrownBy(() -> ValueFilter.compile("val - 1 > 0")).isInstanceOf(FilterSyntaxException.class);
    assertThatThrownBy(() -> ValueFilter.compile("__import__('os')")).isInstanceOf(FilterSyntaxException.class);
    assertThatThrownBy(() -> ValueFilter.compile("  ")).isInstanceOf(FilterSyntaxException.class);
  }

  @Test
  void reportsWhereTheProblemIs() {
    assertThatThrownBy(() -> ValueFilter.compile("val = 1"))
        .isInstanceOfSatisfying(FilterSyntaxException.class,
            ex -> assertThat(ex.position()).isEqualTo(4));
  }
}
