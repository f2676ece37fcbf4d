package com.mk.fx.qa.dicom.load.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable lifecycle record of one run. State transitions are synchronized; reads of single fields
 * are volatile.
 */
public class RunRecord {

  private final LoadRun run;
  private final Instant submittedAt;
  private volatile RunStatus status = RunStatus.QUEUED;
  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile String errorMessage;
  private volatile Boolean passed;

  public RunRecord(LoadRun run, Instant submittedAt) {
    this.run = run;
    this.submittedAt = submittedAt;
  }

  /** Moves a queued run to RUNNING; returns false if it left the queue some other way. */
  public synchronized boolean markRunning(Instant at) {
    if (status != RunStatus.QUEUED) {
      return false;
    }
    status = RunStatus.RUNNING;
    startedAt = at;
    return true;
  }

  public synchronized void markCompleted(Instant at, boolean verdictPassed) {
    finish(RunStatus.COMPLETED, at);
    passed = verdictPassed;
  }

  public synchronized void markCancelled(Instant at, Boolean verdictPassed) {
    finish(RunStatus.CANCELLED, at);
    passed = verdictPassed;
  }

  public synchronized void markFailed(Instant at, String message) {
    finish(RunStatus.FAILED, at);
    errorMessage = message;
  }

  private void finish(RunStatus terminal, Instant at) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Run " + getRunId() + " already " + status);
    }
    status = terminal;
    completedAt = at;
  }

  public UUID getRunId() {
    return run.getId();
  }

  public LoadRun getRun() {
    return run;
  }

  public RunStatus getStatus() {
    return status;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  /** Verdict of the run once thresholds were evaluated, empty before that or after setup failure. */
  public Optional<Boolean> getPassed() {
    return Optional.ofNullable(passed);
  }

  /** Milliseconds between start and completion, {@code null} until both are known. */
  public Long getProcessingDurationMillis() {
    var start = startedAt;
    var end = completedAt;
    if (start == null || end == null) {
      return null;
    }
    return Duration.between(start, end).toMillis();
  }
}
