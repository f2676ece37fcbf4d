package com.mk.fx.qa.dicom.load.driver;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.dicom.load.LoadSetupException;
import com.mk.fx.qa.dicom.load.catalog.DatasetCatalog;
import com.mk.fx.qa.dicom.load.catalog.PayloadDescriptor;
import com.mk.fx.qa.dicom.load.cstore.ProtocolClient;
import com.mk.fx.qa.dicom.load.dispatch.AdmissionGate;
import com.mk.fx.qa.dicom.load.dispatch.DispatchResult;
import com.mk.fx.qa.dicom.load.dispatch.Dispatcher;
import com.mk.fx.qa.dicom.load.dispatch.RateLimitedAdmissionGate;
import com.mk.fx.qa.dicom.load.dispatch.RunControl;
import com.mk.fx.qa.dicom.load.metrics.MetricsCollector;
import com.mk.fx.qa.dicom.load.metrics.MetricsSnapshot;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one load scenario end to end: checks the stop condition, selects payloads, probes the
 * target, paces sends through a rate-limited gate and judges the final snapshot against the
 * configured thresholds.
 *
 * <p>A driver is single use. {@link #cancel()} may be called from any thread, before or during
 * {@link #execute}.
 */
@Slf4j
public class LoadDriver {

  public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofSeconds(5);

  private final UUID runId;
  private final ProtocolClient client;
  private final Duration progressInterval;
  private final DoubleFunction<AdmissionGate> gateFactory;
  private final MetricsCollector collector;
  private final AtomicReference<DriverState> state = new AtomicReference<>(DriverState.IDLE);

  private volatile boolean cancelRequested;
  private volatile RunControl control;

  public LoadDriver(ProtocolClient client) {
    this(UUID.randomUUID(), client, DEFAULT_PROGRESS_INTERVAL);
  }

  public LoadDriver(UUID runId, ProtocolClient client, Duration progressInterval) {
    this(runId, client, progressInterval, RateLimitedAdmissionGate::new);
  }

  @VisibleForTesting
  LoadDriver(
      UUID runId,
      ProtocolClient client,
      Duration progressInterval,
      DoubleFunction<AdmissionGate> gateFactory) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.client = Objects.requireNonNull(client, "client");
    this.progressInterval = Objects.requireNonNull(progressInterval, "progressInterval");
    this.gateFactory = Objects.requireNonNull(gateFactory, "gateFactory");
    this.collector = new MetricsCollector(runId);
  }

  public UUID getRunId() {
    return runId;
  }

  public DriverState getState() {
    return state.get();
  }

  /** Collector of this run, for live snapshots while it executes. */
  public MetricsCollector getCollector() {
    return collector;
  }

  /**
   * Executes the run and blocks until it ends.
   *
   * @return the verdict; threshold violations are reported here, not thrown
   * @throws LoadSetupException if options, payloads or the target are unusable; nothing is sent
   * @throws IllegalStateException if this driver has already been used
   */
  public RunVerdict execute(LoadConfig config, DatasetCatalog catalog) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(catalog, "catalog");
    if (!state.compareAndSet(DriverState.IDLE, DriverState.RUNNING)) {
      throw new IllegalStateException("Driver for run " + runId + " has already been used");
    }

    List<PayloadDescriptor> payloads;
    RunControl runControl;
    try {
      long budget = sendBudget(config);
      payloads = selectPayloads(config, catalog);
      if (config.echoBeforeRun()) {
        probe(config);
      }
      runControl =
          config.isDurationBound()
              ? RunControl.forDuration(budget, Duration.ofSeconds(config.durationSeconds()))
              : RunControl.forCount(budget);
    } catch (LoadSetupException ex) {
      state.set(DriverState.FAILED);
      log.error("Run {} failed during setup: {}", runId, ex.getMessage());
      throw ex;
    } catch (RuntimeException ex) {
      state.set(DriverState.FAILED);
      log.error("Run {} failed during setup: {}", runId, ex.getMessage(), ex);
      throw ex;
    }

    control = runControl;
    if (cancelRequested) {
      runControl.cancel();
    }

    log.info(
        "Run {} started: target={}, rate={}/s, concurrency={}, {}, budget={}, payloads={}",
        runId,
        config.target(),
        config.targetRate(),
        config.concurrency(),
        config.isDurationBound()
            ? "duration=" + config.durationSeconds() + "s"
            : "totalCount=" + config.totalCount(),
        runControl.budget(),
        payloads.size());

    collector.startProgressLogging(progressInterval);
    try {
      var dispatcher = new Dispatcher(client, gateFactory.apply(config.targetRate()));
      DispatchResult result = dispatcher.run(payloads, config, collector, runControl);
      log.debug("Run {} dispatch result {}", runId, result);
    } catch (InterruptedException interrupted) {
      runControl.cancel();
      Thread.currentThread().interrupt();
      log.warn("Run {} interrupted, treating as cancelled", runId);
    } catch (RuntimeException ex) {
      state.set(DriverState.FAILED);
      log.error("Run {} failed during dispatch: {}", runId, ex.getMessage(), ex);
      throw ex;
    } finally {
      collector.close();
    }

    MetricsSnapshot snapshot = collector.snapshot();
    List<ThresholdViolation> violations = evaluate(config, snapshot);
    var finalState = runControl.isCancelled() ? DriverState.CANCELLED : DriverState.COMPLETED;
    state.set(finalState);

    var verdict = RunVerdict.of(runId, finalState, snapshot, violations);
    if (verdict.passed()) {
      log.info("Run {} {}: PASSED", runId, finalState);
    } else {
      log.warn("Run {} {}: FAILED thresholds {}", runId, finalState, violations);
    }
    return verdict;
  }

  /** Requests cooperative cancellation; in-flight sends finish and are recorded. */
  public void cancel() {
    cancelRequested = true;
    var current = control;
    if (current != null) {
      current.cancel();
    }
  }

  /**
   * Number of send tickets the run may claim.
   *
   * @throws ConfigException unless exactly one of durationSeconds and totalCount is set and
   *     positive
   */
  public static long sendBudget(LoadConfig config) {
    var duration = config.durationSeconds();
    var count = config.totalCount();
    if (duration == null && count == null) {
      throw new ConfigException("Either durationSeconds or totalCount must be set");
    }
    if (duration != null && count != null) {
      throw new ConfigException("durationSeconds and totalCount are mutually exclusive");
    }
    if (duration != null) {
      if (duration < 1) {
        throw ConfigException.invalid("durationSeconds", duration, "must be >= 1");
      }
      return Math.max(1L, (long) Math.floor(config.targetRate() * duration));
    }
    if (count < 1) {
      throw ConfigException.invalid("totalCount", count, "must be >= 1");
    }
    return count;
  }

  /** Compares the final snapshot with the limits; undefined metrics count as violations. */
  static List<ThresholdViolation> evaluate(LoadConfig config, MetricsSnapshot snapshot) {
    List<ThresholdViolation> violations = new ArrayList<>();

    var errorRate = snapshot.errorRate();
    if (errorRate == null) {
      violations.add(
          new ThresholdViolation(
              Threshold.ERROR_RATE, config.maxErrorRate(), null, "No sends were attempted"));
    } else if (errorRate > config.maxErrorRate()) {
      violations.add(
          new ThresholdViolation(
              Threshold.ERROR_RATE,
              config.maxErrorRate(),
              errorRate,
              String.format(
                  Locale.ROOT,
                  "Error rate %.4f exceeds limit %.4f (%d of %d sends failed)",
                  errorRate,
                  config.maxErrorRate(),
                  snapshot.failed(),
                  snapshot.attempted())));
    }

    var p95 = snapshot.p95LatencyMs();
    if (p95 == null) {
      violations.add(
          new ThresholdViolation(
              Threshold.P95_LATENCY,
              config.maxP95LatencyMs(),
              null,
              "p95 latency undefined: no successful sends"));
    } else if (p95 > config.maxP95LatencyMs()) {
      violations.add(
          new ThresholdViolation(
              Threshold.P95_LATENCY,
              config.maxP95LatencyMs(),
              p95.doubleValue(),
              "p95 latency " + p95 + " ms exceeds limit " + config.maxP95LatencyMs() + " ms"));
    }
    return violations;
  }

  private List<PayloadDescriptor> selectPayloads(LoadConfig config, DatasetCatalog catalog) {
    if (config.datasetRoot() == null) {
      throw ConfigException.missing("datasetRoot");
    }
    return catalog.select(config.datasetRoot(), config.selection());
  }

  private void probe(LoadConfig config) {
    boolean reachable;
    try {
      reachable = client.echo(config.target());
    } catch (RuntimeException ex) {
      throw new TargetUnreachableException(
          "C-ECHO to " + config.target() + " failed: " + ex.getMessage(), ex);
    }
    if (!reachable) {
      throw new TargetUnreachableException("C-ECHO to " + config.target() + " was not answered");
    }
    log.info("Run {} C-ECHO to {} succeeded", runId, config.target());
  }
}
