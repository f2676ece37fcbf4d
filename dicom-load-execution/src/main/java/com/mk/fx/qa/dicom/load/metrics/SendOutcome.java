package com.mk.fx.qa.dicom.load.metrics;

import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Terminal result of one logical send, after any retries. Created once by a dispatcher worker and
 * handed to exactly one {@link MetricsCollector}.
 *
 * @param runId run the send belongs to
 * @param payload file that was sent
 * @param kind classification of the final attempt
 * @param latencyMs wall time from the first attempt's start to the final result, retries included
 * @param attempts number of attempts made, at least one
 * @param startedAt when the first attempt started
 * @param completedAt when the final attempt finished
 * @param detail failure detail of the final attempt, {@code null} on success
 * @param status DIMSE status of the final attempt, {@code null} when no response was received
 */
public record SendOutcome(
    UUID runId,
    Path payload,
    OutcomeKind kind,
    long latencyMs,
    int attempts,
    Instant startedAt,
    Instant completedAt,
    String detail,
    Integer status) {

  public SendOutcome {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(completedAt, "completedAt");
    if (latencyMs < 0) {
      throw new IllegalArgumentException("latencyMs must be >= 0");
    }
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
  }

  public SendOutcome(
      UUID runId,
      Path payload,
      OutcomeKind kind,
      long latencyMs,
      int attempts,
      Instant startedAt,
      Instant completedAt,
      String detail) {
    this(runId, payload, kind, latencyMs, attempts, startedAt, completedAt, detail, null);
  }

  public boolean isSuccess() {
    return kind == OutcomeKind.SUCCESS;
  }
}
