package com.mk.fx.qa.dicom.load.driver;

import com.mk.fx.qa.dicom.load.catalog.PayloadSelection;
import com.mk.fx.qa.dicom.load.cstore.DicomTarget;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Builder;

/**
 * Parameters of one run. Exactly one of {@code durationSeconds} and {@code totalCount} must be set;
 * {@link LoadDriver#execute} enforces that, the constructor checks value ranges only.
 *
 * @param target node receiving the sends
 * @param targetRate admitted sends per second
 * @param concurrency worker count
 * @param durationSeconds run length, or {@code null} when bounded by count
 * @param totalCount number of sends, or {@code null} when bounded by time
 * @param timeout bound on each attempt
 * @param retryCount extra attempts allowed after a retryable failure
 * @param retryBackoff pause between attempts, included in the recorded latency
 * @param maxErrorRate highest acceptable failed/attempted fraction
 * @param maxP95LatencyMs highest acceptable p95 latency
 * @param datasetRoot directory the payloads are discovered under
 * @param selection category filter and sampling of the discovered payloads
 * @param echoBeforeRun probe the target with C-ECHO before sending
 */
@Builder(toBuilder = true)
public record LoadConfig(
    DicomTarget target,
    double targetRate,
    int concurrency,
    Integer durationSeconds,
    Long totalCount,
    Duration timeout,
    int retryCount,
    Duration retryBackoff,
    double maxErrorRate,
    long maxP95LatencyMs,
    Path datasetRoot,
    PayloadSelection selection,
    boolean echoBeforeRun) {

  public LoadConfig {
    if (target == null) {
      throw ConfigException.missing("targetHost");
    }
    if (!(targetRate > 0) || Double.isInfinite(targetRate)) {
      throw ConfigException.invalid("targetRate", targetRate, "must be a positive number");
    }
    if (concurrency < 1) {
      throw ConfigException.invalid("concurrency", concurrency, "must be >= 1");
    }
    if (timeout == null) {
      throw ConfigException.missing("timeoutMs");
    }
    if (timeout.toMillis() < 1) {
      throw ConfigException.invalid("timeoutMs", timeout.toMillis(), "must be >= 1");
    }
    if (retryCount < 0) {
      throw ConfigException.invalid("retryCount", retryCount, "must be >= 0");
    }
    if (retryBackoff == null) {
      retryBackoff = Duration.ZERO;
    } else if (retryBackoff.isNegative()) {
      throw ConfigException.invalid("retryBackoffMs", retryBackoff.toMillis(), "must be >= 0");
    }
    if (!(maxErrorRate >= 0 && maxErrorRate <= 1)) {
      throw ConfigException.invalid("maxErrorRate", maxErrorRate, "must be between 0 and 1");
    }
    if (maxP95LatencyMs < 0) {
      throw ConfigException.invalid("maxP95LatencyMs", maxP95LatencyMs, "must be >= 0");
    }
    if (selection == null) {
      selection = PayloadSelection.all();
    }
    if (selection.sampleSize() != null && selection.sampleSize() < 1) {
      throw ConfigException.invalid("sampleSize", selection.sampleSize(), "must be >= 1");
    }
  }

  public boolean isDurationBound() {
    return durationSeconds != null;
  }
}
