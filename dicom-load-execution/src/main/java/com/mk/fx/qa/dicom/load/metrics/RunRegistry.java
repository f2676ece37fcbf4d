package com.mk.fx.qa.dicom.load.metrics;

import com.mk.fx.qa.dicom.load.driver.RunVerdict;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe registry of run metrics.
 *
 * <p>Tracks collectors of runs in progress, keeps the final snapshot once a run ends and stores the
 * {@link RunVerdict} of runs that reached threshold evaluation.
 */
@Component
public class RunRegistry {

  private final Map<UUID, MetricsCollector> active = new ConcurrentHashMap<>();
  private final Map<UUID, MetricsSnapshot> completed = new ConcurrentHashMap<>();
  private final Map<UUID, RunVerdict> verdicts = new ConcurrentHashMap<>();

  public void register(UUID runId, MetricsCollector collector) {
    active.put(runId, collector);
  }

  /** Stores the final snapshot and drops the live collector. */
  public void complete(UUID runId, MetricsSnapshot finalSnapshot) {
    completed.put(runId, finalSnapshot);
    active.remove(runId);
  }

  /** Drops the final snapshot and verdict of a finished run; a live collector is kept. */
  public void evict(UUID runId) {
    completed.remove(runId);
    verdicts.remove(runId);
  }

  /** Live snapshot for a running run, or the final one for a finished run. */
  public Optional<MetricsSnapshot> getSnapshot(UUID runId) {
    MetricsCollector collector = active.get(runId);
    if (collector != null) {
      return Optional.of(collector.snapshot());
    }
    return Optional.ofNullable(completed.get(runId));
  }

  public void saveVerdict(UUID runId, RunVerdict verdict) {
    verdicts.put(runId, verdict);
  }

  public Optional<RunVerdict> getVerdict(UUID runId) {
    return Optional.ofNullable(verdicts.get(runId));
  }
}
