package com.mk.fx.qa.dicom.load.metrics;

import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Point-in-time aggregate of a run's recorded outcomes. Always recomputed from the full outcome
 * set; the collector never patches a previous snapshot.
 *
 * <p>Latency statistics cover successful sends only. When there are none, {@code
 * percentilesDefined} is false and every latency field is {@code null}. {@code errorRate} is
 * {@code null} until something has been attempted.
 */
public record MetricsSnapshot(
    UUID runId,
    long attempted,
    long succeeded,
    long failed,
    Double errorRate,
    int latencySamples,
    boolean percentilesDefined,
    Long p50LatencyMs,
    Long p95LatencyMs,
    Long p99LatencyMs,
    Long minLatencyMs,
    Long maxLatencyMs,
    Double meanLatencyMs,
    double throughputPerSec,
    long elapsedMs,
    Map<OutcomeKind, Long> failuresByKind,
    List<ErrorSample> errorSamples,
    Instant firstActivityAt,
    Instant lastActivityAt) {

  public MetricsSnapshot {
    failuresByKind = Map.copyOf(failuresByKind);
    errorSamples = List.copyOf(errorSamples);
  }

  /**
   * One failed send kept for diagnostics.
   *
   * @param kind failure classification
   * @param payload file name of the payload
   * @param attempts attempts made before giving up
   * @param detail detail of the final attempt
   * @param status DIMSE status of the final attempt, if the server answered
   */
  public record ErrorSample(
      OutcomeKind kind, String payload, int attempts, String detail, Integer status) {}
}
