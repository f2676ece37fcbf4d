package com.mk.fx.qa.dicom.load.dispatch;

import com.mk.fx.qa.dicom.load.catalog.PayloadDescriptor;
import com.mk.fx.qa.dicom.load.cstore.DicomTarget;
import com.mk.fx.qa.dicom.load.cstore.ProtocolClient;
import com.mk.fx.qa.dicom.load.cstore.SendResult;
import com.mk.fx.qa.dicom.load.driver.LoadConfig;
import com.mk.fx.qa.dicom.load.metrics.ErrorClassifier;
import com.mk.fx.qa.dicom.load.metrics.MetricsCollector;
import com.mk.fx.qa.dicom.load.metrics.SendOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Fans sends out over a fixed pool of workers and records one outcome per logical send.
 *
 * <p>Each worker claims a ticket from the {@link RunControl}, waits at the {@link AdmissionGate}
 * in bounded slices, sends {@code payloads[ticket % size]} and records the terminal outcome of the
 * attempt sequence. Attempts run on a separate call pool so the per-attempt timeout can be
 * enforced without trusting the client to honour it. Workers share nothing but the control, the
 * gate and the collector.
 *
 * <p>Client calls hold one of {@code concurrency} call slots until the client actually returns,
 * not until the attempt times out. A client that ignores interruption therefore cannot push the
 * number of in-flight sends past the configured concurrency; an attempt that cannot get a slot
 * within its timeout is recorded as a timeout without reaching the client.
 *
 * <p>Cancellation is cooperative: workers stop claiming tickets and stop retrying, but an attempt
 * already in flight is allowed to finish and its outcome is recorded.
 */
@Slf4j
public class Dispatcher {

  static final Duration ADMISSION_SLICE = Duration.ofMillis(100);

  private final ProtocolClient client;
  private final AdmissionGate gate;

  public Dispatcher(ProtocolClient client, AdmissionGate gate) {
    this.client = Objects.requireNonNull(client, "client");
    this.gate = Objects.requireNonNull(gate, "gate");
  }

  /**
   * Runs until the control reports budget exhausted, deadline passed or cancellation, then waits
   * for in-flight sends.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting for workers;
   *     the run is cancelled and workers are interrupted
   */
  public DispatchResult run(
      List<PayloadDescriptor> payloads,
      LoadConfig config,
      MetricsCollector collector,
      RunControl control)
      throws InterruptedException {
    Objects.requireNonNull(payloads, "payloads");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(collector, "collector");
    Objects.requireNonNull(control, "control");
    if (payloads.isEmpty()) {
      throw new IllegalArgumentException("payloads must not be empty");
    }

    var runId = collector.getRunId();
    var workers = Math.max(1, config.concurrency());
    var launched = new AtomicLong();
    var recorded = new AtomicLong();

    var workerPool = Executors.newFixedThreadPool(workers, namedDaemon("cstore-worker-" + runId));
    var callPool = Executors.newCachedThreadPool(namedDaemon("cstore-call-" + runId));
    var context =
        new RunContext(
            runId,
            List.copyOf(payloads),
            config,
            collector,
            control,
            callPool,
            new Semaphore(workers));

    List<Future<?>> futures = new ArrayList<>(workers);
    log.info(
        "Run {} dispatching to {} with {} workers, budget {}, {} payloads",
        runId,
        config.target(),
        workers,
        control.budget(),
        payloads.size());
    try {
      for (int i = 0; i < workers; i++) {
        final int workerIndex = i;
        futures.add(
            workerPool.submit(() -> runWorker(workerIndex, context, launched, recorded)));
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException ex) {
          log.error("Run {} worker failed: {}", runId, ex.getCause().getMessage(), ex.getCause());
        }
      }
    } catch (InterruptedException interrupted) {
      control.cancel();
      Thread.currentThread().interrupt();
      throw interrupted;
    } finally {
      workerPool.shutdownNow();
      callPool.shutdownNow();
      awaitQuietly(workerPool, runId);
      awaitQuietly(callPool, runId);
    }

    var result =
        new DispatchResult(workers, launched.get(), recorded.get(), control.isCancelled());
    log.info(
        "Run {} dispatch finished: launched={}, recorded={}, cancelled={}",
        runId,
        result.launched(),
        result.recorded(),
        result.cancelled());
    return result;
  }

  private void runWorker(
      int workerIndex, RunContext context, AtomicLong launched, AtomicLong recorded) {
    log.debug("Run {} worker {} started", context.runId(), workerIndex + 1);
    int sent = 0;
    try {
      while (true) {
        var ticket = context.control().claim();
        if (ticket.isEmpty() || !awaitAdmission(context.control())) {
          break;
        }
        launched.incrementAndGet();
        var payloads = context.payloads();
        var payload = payloads.get((int) (ticket.getAsLong() % payloads.size()));
        var outcome = send(context, payload);
        context.collector().record(outcome);
        recorded.incrementAndGet();
        sent++;
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.info(
          "Run {} worker {} interrupted after {} sends", context.runId(), workerIndex + 1, sent);
      return;
    }
    log.debug("Run {} worker {} finished after {} sends", context.runId(), workerIndex + 1, sent);
  }

  /** Polls the gate in bounded slices so cancellation and the deadline stay responsive. */
  private boolean awaitAdmission(RunControl control) throws InterruptedException {
    while (!control.shouldStop()) {
      if (gate.tryAdmit(ADMISSION_SLICE)) {
        return true;
      }
    }
    return false;
  }

  /** Runs the attempt sequence for one payload and builds its terminal outcome. */
  private SendOutcome send(RunContext context, PayloadDescriptor payload)
      throws InterruptedException {
    var config = context.config();
    var maxAttempts = 1 + Math.max(0, config.retryCount());
    var startedAt = Instant.now();
    var startNanos = System.nanoTime();

    SendResult result;
    int attempts = 0;
    while (true) {
      attempts++;
      result = attempt(context, config.target(), payload, config.timeout());
      if (!result.kind().isRetryable()
          || attempts >= maxAttempts
          || context.control().isCancelled()) {
        break;
      }
      log.debug(
          "Run {} retrying {} after {} (attempt {}/{})",
          context.runId(),
          payload.path().getFileName(),
          result.kind(),
          attempts,
          maxAttempts);
      if (!config.retryBackoff().isZero()) {
        TimeUnit.MILLISECONDS.sleep(config.retryBackoff().toMillis());
      }
    }

    var latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    return new SendOutcome(
        context.runId(),
        payload.path(),
        result.kind(),
        latencyMs,
        attempts,
        startedAt,
        startedAt.plusMillis(latencyMs),
        result.isSuccess() ? null : result.detail(),
        result.status());
  }

  private SendResult attempt(
      RunContext context, DicomTarget target, PayloadDescriptor payload, Duration timeout)
      throws InterruptedException {
    var deadline = System.nanoTime() + timeout.toNanos();
    var slots = context.callSlots();
    if (!slots.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      return SendResult.timeout("No free call slot within " + timeout.toMillis() + " ms");
    }
    // whoever flips this first owns the slot release: the call once it runs, else this thread
    var started = new AtomicBoolean();
    Future<SendResult> call;
    try {
      call =
          context
              .callPool()
              .submit(
                  () -> {
                    if (!started.compareAndSet(false, true)) {
                      return null;
                    }
                    try {
                      return client.send(target, payload.path());
                    } finally {
                      slots.release();
                    }
                  });
    } catch (RejectedExecutionException ex) {
      slots.release();
      return SendResult.networkError("Call pool rejected the attempt: " + ex.getMessage());
    }
    try {
      var result = call.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
      return result != null ? result : SendResult.networkError("Client returned no result");
    } catch (TimeoutException ex) {
      abandon(call, started, slots);
      return SendResult.timeout("No response within " + timeout.toMillis() + " ms");
    } catch (ExecutionException ex) {
      return SendResult.networkError(ErrorClassifier.describe(ex.getCause()));
    } catch (InterruptedException interrupted) {
      abandon(call, started, slots);
      throw interrupted;
    }
  }

  /** Interrupts the call; the slot stays held until a call that already started returns. */
  private static void abandon(Future<SendResult> call, AtomicBoolean started, Semaphore slots) {
    call.cancel(true);
    if (started.compareAndSet(false, true)) {
      slots.release();
    }
  }

  private static ThreadFactory namedDaemon(String prefix) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static void awaitQuietly(ExecutorService executor, UUID runId) {
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Run {} executor did not terminate within 30s", runId);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private record RunContext(
      UUID runId,
      List<PayloadDescriptor> payloads,
      LoadConfig config,
      MetricsCollector collector,
      RunControl control,
      ExecutorService callPool,
      Semaphore callSlots) {}
}
