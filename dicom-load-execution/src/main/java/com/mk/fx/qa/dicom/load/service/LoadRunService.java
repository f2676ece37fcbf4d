package com.mk.fx.qa.dicom.load.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.dicom.load.LoadSetupException;
import com.mk.fx.qa.dicom.load.cfg.RunProcessingCfg;
import com.mk.fx.qa.dicom.load.driver.DriverState;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunSubmissionOutcome;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunSummaryResponse;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.ServiceMetricsResponse;
import com.mk.fx.qa.dicom.load.model.LoadRun;
import com.mk.fx.qa.dicom.load.model.RunRecord;
import com.mk.fx.qa.dicom.load.model.RunStatus;
import com.mk.fx.qa.dicom.load.processors.LoadRunProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts run submissions, executes them on a bounded pool and tracks their lifecycle.
 *
 * <p>Lifecycle: QUEUED → RUNNING → COMPLETED / CANCELLED / FAILED. A run whose thresholds are
 * violated still COMPLETES; its verdict says whether it passed. FAILED is reserved for runs that
 * could not start: bad options, no payloads, unreachable target.
 *
 * <p>Options are validated on submission, so malformed runs are refused before they are queued.
 * Cancellation of a running run is cooperative: in-flight sends finish and are recorded.
 */
@Slf4j
@Service
public class LoadRunService {

  private final RunProcessingCfg properties;
  private final LoadRunProcessor processor;
  private final ThreadPoolExecutor executor;
  private final Map<UUID, RunRecord> runRecords = new ConcurrentHashMap<>();
  private final Map<UUID, Future<?>> activeRuns = new ConcurrentHashMap<>();
  private final Deque<RunRecord> runHistory = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);
  private final AtomicInteger activeRunCount = new AtomicInteger();
  private final AtomicLong totalCompleted = new AtomicLong();
  private final AtomicLong totalPassed = new AtomicLong();
  private final AtomicLong totalFailed = new AtomicLong();
  private final AtomicLong totalCancelled = new AtomicLong();
  private final AtomicLong cumulativeProcessingTime = new AtomicLong();

  public LoadRunService(RunProcessingCfg properties, LoadRunProcessor processor) {
    this.properties = properties;
    this.processor = processor;
    this.executor = createExecutor(properties.getConcurrency());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "LoadRunService initialised with concurrency={} historySize={}",
        properties.getConcurrency(),
        properties.getHistorySize());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    var counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-run-worker-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run queue is full");
        });
    return pool;
  }

  /**
   * Validates the run's options and queues it.
   *
   * @return empty if the service no longer accepts runs, otherwise the submission outcome
   * @throws LoadSetupException if the options are unusable; nothing is queued
   */
  public Optional<RunSubmissionOutcome> submitRun(LoadRun run) {
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }
    processor.validate(run);

    var record = new RunRecord(run, Instant.now());
    if (runRecords.putIfAbsent(run.getId(), record) != null) {
      return Optional.of(
          new RunSubmissionOutcome(run.getId(), RunStatus.FAILED, "Run ID already exists"));
    }

    try {
      Future<?> future = executor.submit(() -> executeRun(record));
      activeRuns.put(run.getId(), future);
      log.info("Run {} submitted", run.getId());
      return Optional.of(new RunSubmissionOutcome(run.getId(), record.getStatus(), "Run queued"));
    } catch (RejectedExecutionException ex) {
      log.warn("Run {} rejected: {}", run.getId(), ex.getMessage());
      runRecords.remove(run.getId());
      return Optional.of(
          new RunSubmissionOutcome(run.getId(), RunStatus.FAILED, "Run queue is full"));
    }
  }

  private void executeRun(RunRecord record) {
    var runId = record.getRunId();
    var started = false;
    try {
      if (!record.markRunning(Instant.now())) {
        return;
      }
      started = true;
      activeRunCount.incrementAndGet();
      log.info("Run {} started", runId);

      var verdict = processor.execute(record.getRun());

      if (verdict.state() == DriverState.CANCELLED) {
        record.markCancelled(Instant.now(), verdict.passed());
        totalCancelled.incrementAndGet();
        log.info("Run {} cancelled", runId);
      } else {
        record.markCompleted(Instant.now(), verdict.passed());
        totalCompleted.incrementAndGet();
        if (verdict.passed()) {
          totalPassed.incrementAndGet();
        }
        cumulativeProcessingTime.addAndGet(record.getProcessingDurationMillis());
        log.info("Run {} completed, passed={}", runId, verdict.passed());
      }
    } catch (LoadSetupException ex) {
      record.markFailed(Instant.now(), ex.getMessage());
      totalFailed.incrementAndGet();
      log.error("Run {} failed during setup: {}", runId, ex.getMessage());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      record.markCancelled(Instant.now(), null);
      totalCancelled.incrementAndGet();
      log.info("Run {} interrupted", runId);
    } catch (Exception ex) {
      record.markFailed(Instant.now(), ex.getMessage());
      totalFailed.incrementAndGet();
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      if (started) {
        activeRunCount.decrementAndGet();
        addToHistory(record);
      }
      activeRuns.remove(runId);
    }
  }

  private void addToHistory(RunRecord record) {
    runHistory.addFirst(record);
    while (runHistory.size() > properties.getHistorySize()) {
      var dropped = runHistory.pollLast();
      if (dropped != null) {
        processor.forget(dropped.getRunId());
      }
    }
  }

  public Optional<RunStatusResponse> getRunStatus(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(LoadRunService::toStatusResponse);
  }

  /** All known runs, oldest submission first. */
  public Collection<RunStatusResponse> getAllRuns() {
    return runRecords.values().stream()
        .sorted(Comparator.comparing(RunRecord::getSubmittedAt))
        .map(LoadRunService::toStatusResponse)
        .toList();
  }

  public List<RunSummaryResponse> getRunsByStatus(RunStatus status) {
    List<RunSummaryResponse> results = new ArrayList<>();
    for (RunRecord record : runRecords.values()) {
      if (record.getStatus() == status) {
        results.add(
            new RunSummaryResponse(record.getRunId(), record.getStatus(), record.getSubmittedAt()));
      }
    }
    results.sort(Comparator.comparing(RunSummaryResponse::submittedAt));
    return results;
  }

  /** Most recent finished runs, newest first, up to the configured history size. */
  public List<RunHistoryEntry> getRunHistory() {
    List<RunHistoryEntry> snapshot = new ArrayList<>();
    for (RunRecord record : runHistory) {
      snapshot.add(
          new RunHistoryEntry(
              record.getRunId(),
              record.getStatus(),
              record.getStartedAt().orElse(null),
              record.getCompletedAt().orElse(null),
              record.getProcessingDurationMillis(),
              record.getPassed().orElse(null),
              record.getErrorMessage().orElse(null)));
    }
    return snapshot;
  }

  public QueueStatusResponse getQueueStatus() {
    return new QueueStatusResponse(
        executor.getQueue().size(), activeRunCount.get(), acceptingRuns.get());
  }

  public ServiceMetricsResponse getMetrics() {
    var completed = totalCompleted.get();
    var passed = totalPassed.get();
    var avgProcessing =
        completed == 0 ? 0.0 : (double) cumulativeProcessingTime.get() / completed;
    var passRate = completed == 0 ? 0.0 : (double) passed / completed;
    return new ServiceMetricsResponse(
        completed, passed, totalFailed.get(), totalCancelled.get(), avgProcessing, passRate);
  }

  /**
   * Cancels a queued run immediately, or asks a running run to stop.
   *
   * @param runId run to cancel
   * @return what happened and the run's status afterwards
   */
  public CancellationResult cancelRun(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return CancellationResult.notFound();
    }
    var status = record.getStatus();
    if (status.isTerminal()) {
      return CancellationResult.notCancellable(status);
    }

    if (status == RunStatus.QUEUED) {
      Future<?> future = activeRuns.get(runId);
      if (future == null || future.cancel(false)) {
        synchronized (record) {
          if (record.getStatus() == RunStatus.QUEUED) {
            record.markCancelled(Instant.now(), null);
            totalCancelled.incrementAndGet();
            activeRuns.remove(runId);
            addToHistory(record);
            log.info("Run {} cancelled while queued", runId);
            return CancellationResult.cancelled(record.getStatus());
          }
        }
      }
    }

    processor.cancel(runId);
    log.info("Run {} cancellation requested", runId);
    return CancellationResult.cancellationRequested(record.getStatus());
  }

  /** Stops accepting runs; running runs are left to finish. */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  private static RunStatusResponse toStatusResponse(RunRecord record) {
    return new RunStatusResponse(
        record.getRunId(),
        record.getStatus(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getPassed().orElse(null),
        record.getErrorMessage().orElse(null));
  }

  /** Outcome of a cancellation attempt. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunStatus runStatus;

    private CancellationResult(CancellationState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static CancellationResult cancelled(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    public static CancellationResult cancellationRequested(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
