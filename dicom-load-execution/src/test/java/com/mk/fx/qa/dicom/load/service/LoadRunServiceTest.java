package com.mk.fx.qa.dicom.load.service;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dicom.load.cfg.RunProcessingCfg;
import com.mk.fx.qa.dicom.load.driver.ConfigException;
import com.mk.fx.qa.dicom.load.driver.DriverState;
import com.mk.fx.qa.dicom.load.driver.RunVerdict;
import com.mk.fx.qa.dicom.load.driver.TargetUnreachableException;
import com.mk.fx.qa.dicom.load.driver.Threshold;
import com.mk.fx.qa.dicom.load.driver.ThresholdViolation;
import com.mk.fx.qa.dicom.load.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.dicom.load.metrics.MetricsCollector;
import com.mk.fx.qa.dicom.load.model.LoadRun;
import com.mk.fx.qa.dicom.load.model.RunStatus;
import com.mk.fx.qa.dicom.load.processors.LoadRunProcessor;
import com.mk.fx.qa.dicom.load.service.LoadRunService.CancellationResult.CancellationState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LoadRunServiceTest {

  private static LoadRun newRun() {
    return new LoadRun(UUID.randomUUID(), Instant.now(), Map.of("targetHost", "pacs.local"));
  }

  private static RunProcessingCfg cfg(int concurrency, int history) {
    RunProcessingCfg cfg = new RunProcessingCfg();
    cfg.setConcurrency(concurrency);
    cfg.setHistorySize(history);
    return cfg;
  }

  private static void awaitStatus(LoadRunService service, UUID id, RunStatus expected, long seconds)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
    while (System.nanoTime() < deadline) {
      var status = service.getRunStatus(id).map(RunStatusResponse::status).orElse(null);
      if (status == expected) {
        return;
      }
      Thread.sleep(10);
    }
    fail("Run " + id + " did not reach " + expected + ", was " + service.getRunStatus(id));
  }

  @Test
  void submitRun_passingRun_completesAndCountsPass() throws Exception {
    var processor = new FakeProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    var outcome = service.submitRun(run).orElseThrow();
    assertEquals(run.getId(), outcome.runId());
    assertEquals("Run queued", outcome.message());

    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);
    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertEquals(Boolean.TRUE, status.passed());
    assertNotNull(status.startedAt());
    assertNotNull(status.completedAt());

    var metrics = service.getMetrics();
    assertEquals(1, metrics.completed());
    assertEquals(1, metrics.passed());
    assertEquals(0, metrics.failed());
    assertEquals(1.0, metrics.passRate(), 1e-9);
    assertEquals(1, processor.executions.get());
  }

  @Test
  void submitRun_violatedThresholds_completesButNotPassed() throws Exception {
    var processor = new FakeProcessor();
    processor.pass = false;
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    assertEquals(Boolean.FALSE, service.getRunStatus(run.getId()).orElseThrow().passed());
    var metrics = service.getMetrics();
    assertEquals(1, metrics.completed());
    assertEquals(0, metrics.passed());
    assertEquals(0.0, metrics.passRate(), 1e-9);
  }

  @Test
  void submitRun_invalidOptions_throwsAndQueuesNothing() {
    var processor = new FakeProcessor();
    processor.rejectOnValidate = ConfigException.missing("targetPort");
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    var ex = assertThrows(ConfigException.class, () -> service.submitRun(run));
    assertEquals("targetPort", ex.getKey());
    assertTrue(service.getRunStatus(run.getId()).isEmpty());
    assertEquals(0, processor.executions.get());
  }

  @Test
  void submitRun_setupFailure_marksFailedWithMessage() throws Exception {
    var processor = new FakeProcessor();
    processor.failWith = new TargetUnreachableException("C-ECHO to ARCHIVE@pacs.local:104 failed");
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.FAILED, 5);

    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertTrue(status.errorMessage().contains("C-ECHO"));
    assertNull(status.passed());
    assertEquals(1, service.getMetrics().failed());
    assertEquals(RunStatus.FAILED, service.getRunHistory().get(0).status());
  }

  @Test
  void submitRun_unexpectedException_marksFailed() throws Exception {
    var processor = new FakeProcessor();
    processor.failWith = new IllegalStateException("boom");
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.FAILED, 5);

    assertEquals("boom", service.getRunStatus(run.getId()).orElseThrow().errorMessage());
  }

  @Test
  void submitRun_duplicateId_returnsFailedOutcome() throws Exception {
    var service = new LoadRunService(cfg(1, 10), new FakeProcessor());
    var run = newRun();

    service.submitRun(run).orElseThrow();
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    var outcome = service.submitRun(run).orElseThrow();
    assertEquals(RunStatus.FAILED, outcome.status());
    assertTrue(outcome.message().contains("already exists"));
  }

  @Test
  void cancelRun_whenQueued_cancelsImmediately() throws Exception {
    var processor = new FakeProcessor();
    processor.block = true;
    var service = new LoadRunService(cfg(1, 10), processor);
    var first = newRun();
    var second = newRun();

    service.submitRun(first);
    assertTrue(processor.started.await(2, TimeUnit.SECONDS));
    service.submitRun(second);

    var result = service.cancelRun(second.getId());
    assertEquals(CancellationState.CANCELLED, result.getState());
    assertEquals(RunStatus.CANCELLED, result.getRunStatus());
    assertEquals(RunStatus.CANCELLED, service.getRunStatus(second.getId()).orElseThrow().status());

    processor.release.countDown();
    awaitStatus(service, first.getId(), RunStatus.COMPLETED, 5);
    assertEquals(1, processor.executions.get());
    assertEquals(1, service.getMetrics().cancelled());
  }

  @Test
  void cancelRun_whenRunning_requestsCancellationFromProcessor() throws Exception {
    var processor = new FakeProcessor();
    processor.block = true;
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    service.submitRun(run);
    assertTrue(processor.started.await(2, TimeUnit.SECONDS));
    awaitStatus(service, run.getId(), RunStatus.RUNNING, 2);

    var result = service.cancelRun(run.getId());
    assertEquals(CancellationState.CANCELLATION_REQUESTED, result.getState());
    assertTrue(processor.cancelled.contains(run.getId()));

    awaitStatus(service, run.getId(), RunStatus.CANCELLED, 5);
    assertEquals(1, service.getMetrics().cancelled());
    assertEquals(0, service.getMetrics().completed());
  }

  @Test
  void cancelRun_unknownRun_returnsNotFound() {
    var service = new LoadRunService(cfg(1, 10), new FakeProcessor());

    assertEquals(CancellationState.NOT_FOUND, service.cancelRun(UUID.randomUUID()).getState());
  }

  @Test
  void cancelRun_finishedRun_returnsNotCancellable() throws Exception {
    var service = new LoadRunService(cfg(1, 10), new FakeProcessor());
    var run = newRun();
    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    var result = service.cancelRun(run.getId());

    assertEquals(CancellationState.NOT_CANCELLABLE, result.getState());
    assertEquals(RunStatus.COMPLETED, result.getRunStatus());
  }

  @Test
  void getQueueStatus_reportsPendingAndActive() throws Exception {
    var processor = new FakeProcessor();
    processor.block = true;
    var service = new LoadRunService(cfg(1, 10), processor);
    var first = newRun();
    var second = newRun();

    service.submitRun(first);
    assertTrue(processor.started.await(2, TimeUnit.SECONDS));
    service.submitRun(second);

    var queue = service.getQueueStatus();
    assertEquals(1, queue.queueSize());
    assertEquals(1, queue.activeRuns());
    assertTrue(queue.acceptingRuns());

    processor.release.countDown();
    awaitStatus(service, second.getId(), RunStatus.COMPLETED, 5);
  }

  @Test
  void getRunsByStatus_filtersByStatus() throws Exception {
    var processor = new FakeProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();
    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);

    assertEquals(1, service.getRunsByStatus(RunStatus.COMPLETED).size());
    assertTrue(service.getRunsByStatus(RunStatus.FAILED).isEmpty());
    assertEquals(1, service.getAllRuns().size());
  }

  @Test
  void history_isCappedAndMostRecentFirst() throws Exception {
    var service = new LoadRunService(cfg(1, 2), new FakeProcessor());
    var a = newRun();
    var b = newRun();
    var c = newRun();

    for (LoadRun run : List.of(a, b, c)) {
      service.submitRun(run);
      awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);
    }

    var history = service.getRunHistory();
    assertEquals(2, history.size());
    assertEquals(c.getId(), history.get(0).runId());
    assertEquals(b.getId(), history.get(1).runId());
  }

  @Test
  void history_droppedRun_isForgottenByProcessor() throws Exception {
    var processor = new FakeProcessor();
    var service = new LoadRunService(cfg(1, 1), processor);
    var a = newRun();
    var b = newRun();

    for (LoadRun run : List.of(a, b)) {
      service.submitRun(run);
      awaitStatus(service, run.getId(), RunStatus.COMPLETED, 5);
    }

    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (processor.forgotten.isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(Set.of(a.getId()), processor.forgotten);
  }

  @Test
  void shutdown_refusesFurtherSubmissions() {
    var service = new LoadRunService(cfg(1, 10), new FakeProcessor());

    assertTrue(service.isHealthy());
    service.shutdown();

    assertFalse(service.isHealthy());
    assertTrue(service.submitRun(newRun()).isEmpty());
  }

  @Test
  void metrics_areZeroWhenNothingRan() {
    var metrics = new LoadRunService(cfg(1, 10), new FakeProcessor()).getMetrics();

    assertEquals(0, metrics.completed());
    assertEquals(0.0, metrics.averageProcessingTimeMs(), 1e-9);
    assertEquals(0.0, metrics.passRate(), 1e-9);
  }

  private static final class FakeProcessor implements LoadRunProcessor {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger executions = new AtomicInteger();
    final Set<UUID> cancelled = ConcurrentHashMap.newKeySet();
    final Set<UUID> forgotten = ConcurrentHashMap.newKeySet();
    volatile boolean block;
    volatile boolean pass = true;
    volatile RuntimeException failWith;
    volatile RuntimeException rejectOnValidate;

    @Override
    public void validate(LoadRun run) {
      if (rejectOnValidate != null) {
        throw rejectOnValidate;
      }
    }

    @Override
    public RunVerdict execute(LoadRun run) throws Exception {
      executions.incrementAndGet();
      started.countDown();
      if (failWith != null) {
        throw failWith;
      }
      while (block && !cancelled.contains(run.getId())) {
        if (release.await(10, TimeUnit.MILLISECONDS)) {
          break;
        }
      }
      var state = cancelled.contains(run.getId()) ? DriverState.CANCELLED : DriverState.COMPLETED;
      List<ThresholdViolation> violations =
          pass
              ? List.of()
              : List.of(new ThresholdViolation(Threshold.ERROR_RATE, 0.02, 0.5, "error rate 0.5"));
      return RunVerdict.of(
          run.getId(), state, new MetricsCollector(run.getId()).snapshot(), violations);
    }

    @Override
    public void cancel(UUID runId) {
      cancelled.add(runId);
    }

    @Override
    public void forget(UUID runId) {
      forgotten.add(runId);
    }
  }
}
