package com.mk.fx.qa.dicom.load.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.dicom.load.cstore.OutcomeKind;
import com.mk.fx.qa.dicom.load.metrics.MetricsSnapshot.ErrorSample;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe sink for the outcomes of one run.
 *
 * <p>Recording appends to a lock-guarded list; the critical section is a single {@code add}.
 * {@link #snapshot()} copies the list under the same lock and aggregates outside it, so readers
 * never hold recorders up for longer than an array copy. Outcomes are treated as unordered.
 */
@Slf4j
public class MetricsCollector implements AutoCloseable {

  static final int MAX_ERROR_SAMPLES = 5;

  @Getter private final UUID runId;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<SendOutcome> outcomes = new ArrayList<>();

  private ScheduledExecutorService progress;
  private volatile Duration progressWindow;

  public MetricsCollector(UUID runId) {
    this.runId = Objects.requireNonNull(runId, "runId");
  }

  /**
   * Appends one terminal outcome.
   *
   * @throws IllegalArgumentException if the outcome belongs to another run
   */
  public void record(SendOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    if (!runId.equals(outcome.runId())) {
      throw new IllegalArgumentException(
          "Outcome of run " + outcome.runId() + " offered to collector of run " + runId);
    }
    lock.lock();
    try {
      outcomes.add(outcome);
    } finally {
      lock.unlock();
    }
  }

  public int recorded() {
    lock.lock();
    try {
      return outcomes.size();
    } finally {
      lock.unlock();
    }
  }

  /** Copy of the recorded outcomes, in arrival order. */
  public List<SendOutcome> outcomes() {
    lock.lock();
    try {
      return List.copyOf(outcomes);
    } finally {
      lock.unlock();
    }
  }

  /** Aggregates everything recorded so far into a fresh snapshot. */
  public MetricsSnapshot snapshot() {
    SendOutcome[] copy;
    lock.lock();
    try {
      copy = outcomes.toArray(new SendOutcome[0]);
    } finally {
      lock.unlock();
    }
    return aggregate(copy);
  }

  /**
   * Successful sends per second over the trailing {@code window}: sends that started within
   * {@code window} of the latest completion, divided by the window length. Zero before anything
   * completes.
   */
  public double throughputPerSec(Duration window) {
    Objects.requireNonNull(window, "window");
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
    SendOutcome[] copy;
    lock.lock();
    try {
      copy = outcomes.toArray(new SendOutcome[0]);
    } finally {
      lock.unlock();
    }
    Instant last = null;
    for (SendOutcome outcome : copy) {
      if (last == null || outcome.completedAt().isAfter(last)) {
        last = outcome.completedAt();
      }
    }
    if (last == null) {
      return 0.0;
    }
    var from = last.minus(window);
    long succeeded = 0;
    for (SendOutcome outcome : copy) {
      if (outcome.isSuccess() && !outcome.startedAt().isBefore(from)) {
        succeeded++;
      }
    }
    return succeeded * 1000.0 / Math.max(1L, window.toMillis());
  }

  /** Starts a daemon thread logging a one-line snapshot every {@code interval}. */
  public synchronized void startProgressLogging(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (progress != null) {
      return;
    }
    progress =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-progress-" + runId);
              t.setDaemon(true);
              return t;
            });
    progressWindow = interval;
    long millis = interval.toMillis();
    progress.scheduleAtFixedRate(
        () -> logSnapshot("progress"), millis, millis, TimeUnit.MILLISECONDS);
  }

  /** Stops progress logging, if running, and logs the final summary line. */
  @Override
  public synchronized void close() {
    if (progress != null) {
      progress.shutdownNow();
      try {
        progress.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
      progress = null;
    }
    logSnapshot("summary");
  }

  @VisibleForTesting
  void logSnapshot(String phase) {
    var snapshot = snapshot();
    var sb = new StringBuilder();
    sb.append("Run ")
        .append(runId)
        .append(' ')
        .append(phase)
        .append(": attempted=")
        .append(snapshot.attempted())
        .append(", succeeded=")
        .append(snapshot.succeeded())
        .append(", failed=")
        .append(snapshot.failed())
        .append(", throughput=")
        .append(String.format(Locale.ROOT, "%.2f", snapshot.throughputPerSec()))
        .append("/s");
    var window = progressWindow;
    if (window != null) {
      sb.append(", recent=")
          .append(String.format(Locale.ROOT, "%.2f", throughputPerSec(window)))
          .append("/s");
    }
    if (snapshot.errorRate() != null) {
      sb.append(", errorRate=").append(String.format(Locale.ROOT, "%.4f", snapshot.errorRate()));
    }
    if (snapshot.percentilesDefined()) {
      sb.append(", lat(ms) min=")
          .append(snapshot.minLatencyMs())
          .append(", p50=")
          .append(snapshot.p50LatencyMs())
          .append(", p95=")
          .append(snapshot.p95LatencyMs())
          .append(", p99=")
          .append(snapshot.p99LatencyMs())
          .append(", max=")
          .append(snapshot.maxLatencyMs());
    }
    if (!snapshot.failuresByKind().isEmpty()) {
      sb.append(", failures=").append(new EnumMap<>(snapshot.failuresByKind()));
    }
    log.info(sb.toString());
  }

  private MetricsSnapshot aggregate(SendOutcome[] copy) {
    long succeeded = 0;
    long failed = 0;
    long[] latencies = new long[copy.length];
    Map<OutcomeKind, Long> failuresByKind = new EnumMap<>(OutcomeKind.class);
    List<ErrorSample> samples = new ArrayList<>();
    Instant first = null;
    Instant last = null;

    for (SendOutcome outcome : copy) {
      switch (outcome.kind()) {
        case SUCCESS -> latencies[(int) succeeded++] = outcome.latencyMs();
        case NETWORK_ERROR, TIMEOUT, PROTOCOL_REJECTED -> {
          failed++;
          failuresByKind.merge(outcome.kind(), 1L, Long::sum);
          if (samples.size() < MAX_ERROR_SAMPLES) {
            samples.add(
                new ErrorSample(
                    outcome.kind(),
                    String.valueOf(outcome.payload().getFileName()),
                    outcome.attempts(),
                    outcome.detail(),
                    outcome.status()));
          }
        }
      }
      if (first == null || outcome.startedAt().isBefore(first)) {
        first = outcome.startedAt();
      }
      if (last == null || outcome.completedAt().isAfter(last)) {
        last = outcome.completedAt();
      }
    }

    long attempted = succeeded + failed;
    long[] sorted = Arrays.copyOf(latencies, (int) succeeded);
    Arrays.sort(sorted);
    boolean defined = sorted.length > 0;

    Double mean = null;
    if (defined) {
      long sum = 0;
      for (long value : sorted) {
        sum += value;
      }
      mean = sum / (double) sorted.length;
    }

    long elapsedMs = 0;
    double throughput = 0.0;
    if (attempted > 0) {
      elapsedMs = Math.max(1L, Duration.between(first, last).toMillis());
      throughput = succeeded * 1000.0 / elapsedMs;
    }

    return new MetricsSnapshot(
        runId,
        attempted,
        succeeded,
        failed,
        attempted == 0 ? null : failed / (double) attempted,
        sorted.length,
        defined,
        LatencyPercentiles.percentile(sorted, 50).orElse(null),
        LatencyPercentiles.percentile(sorted, 95).orElse(null),
        LatencyPercentiles.percentile(sorted, 99).orElse(null),
        defined ? sorted[0] : null,
        defined ? sorted[sorted.length - 1] : null,
        mean,
        throughput,
        elapsedMs,
        failuresByKind,
        samples,
        first,
        last);
  }
}
