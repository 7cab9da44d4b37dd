package com.ospicorp.tagsync.series.model;

/**
 * One value column of a {@link TimeSeries}. Cells that have no value (an empty downsample
 * interval, an upsampled point before the first sample) hold {@link Double#NaN}.
 */
public record SeriesColumn(Stat stat, String label, double[] values) {

  public boolean isPresent(int row) {
    return !Double.isNaN(values[row]);
  }
}
