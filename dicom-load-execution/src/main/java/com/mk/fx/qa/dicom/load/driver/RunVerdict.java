package com.mk.fx.qa.dicom.load.driver;

import com.mk.fx.qa.dicom.load.metrics.MetricsSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Externally visible result of a run. A run with violations is a failed test, not a failed
 * program: it still ends in {@link DriverState#COMPLETED}.
 *
 * @param runId run identifier
 * @param state terminal driver state
 * @param passed true iff {@code violations} is empty
 * @param snapshot final metrics
 * @param violations thresholds the run did not meet
 */
public record RunVerdict(
    UUID runId,
    DriverState state,
    boolean passed,
    MetricsSnapshot snapshot,
    List<ThresholdViolation> violations) {

  public RunVerdict {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(snapshot, "snapshot");
    violations = List.copyOf(violations);
    if (passed != violations.isEmpty()) {
      throw new IllegalArgumentException("passed must be true exactly when there are no violations");
    }
  }

  public static RunVerdict of(
      UUID runId, DriverState state, MetricsSnapshot snapshot, List<ThresholdViolation> violations) {
    return new RunVerdict(runId, state, violations.isEmpty(), snapshot, violations);
  }
}
