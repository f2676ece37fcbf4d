package com.mk.fx.qa.dicom.load.metrics;

import java.util.Optional;

/** Nearest-rank percentiles over an ascending latency array. */
final class LatencyPercentiles {

  private LatencyPercentiles() {}

  /**
   * Returns the value at 0-based rank {@code ceil(p/100 * n) - 1}, clamped to the array bounds.
   *
   * @param sortedAscending latencies sorted ascending
   * @param p percentile between 0 and 100
   * @return the percentile, empty when there are no samples
   */
  static Optional<Long> percentile(long[] sortedAscending, int p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int n = sortedAscending.length;
    if (n == 0) {
      return Optional.empty();
    }
    int rank = (int) Math.ceil(((long) p * n) / 100.0) - 1;
    int idx = Math.min(n - 1, Math.max(0, rank));
    return Optional.of(sortedAscending[idx]);
  }
}
