package com.mk.fx.qa.dicom.load.driver;

/** Numeric bounds a run's final snapshot is judged against. */
public enum Threshold {
  ERROR_RATE("errorRate"),
  P95_LATENCY("p95LatencyMs");

  private final String metric;

  Threshold(String metric) {
    this.metric = metric;
  }

  /** Name of the snapshot metric the threshold applies to. */
  public String metric() {
    return metric;
  }
}
