package com.mk.fx.qa.dicom.load.cstore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process stand-in for a storage SCP. Every call sleeps for the configured latency and then
 * answers according to a deterministic failure schedule, so dry runs and tests can exercise the
 * runner without a listener on the network.
 */
@Slf4j
public final class SimulatedProtocolClient implements ProtocolClient {

  private final Duration latency;
  private final Duration jitter;
  private final int failEvery;
  private final OutcomeKind failureKind;
  private final boolean reachable;
  private final AtomicLong sendAttempts = new AtomicLong();
  private final AtomicLong echoes = new AtomicLong();

  private SimulatedProtocolClient(Builder builder) {
    this.latency = builder.latency;
    this.jitter = builder.jitter;
    this.failEvery = builder.failEvery;
    this.failureKind = builder.failureKind;
    this.reachable = builder.reachable;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean echo(DicomTarget target) {
    echoes.incrementAndGet();
    log.debug("Simulated C-ECHO to {} -> {}", target, reachable ? "success" : "unreachable");
    return reachable;
  }

  @Override
  public SendResult send(DicomTarget target, Path payload) {
    long attempt = sendAttempts.incrementAndGet();
    if (!reachable) {
      return SendResult.networkError("Connection refused: " + target.host() + ":" + target.port());
    }
    try {
      pause();
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return SendResult.networkError("Association aborted: interrupted");
    }
    if (failEvery > 0 && attempt % failEvery == 0) {
      return failure(attempt);
    }
    return SendResult.success();
  }

  /** Number of {@link #send} calls observed so far. */
  public long sendAttempts() {
    return sendAttempts.get();
  }

  /** Number of {@link #echo} calls observed so far. */
  public long echoes() {
    return echoes.get();
  }

  private SendResult failure(long attempt) {
    return switch (failureKind) {
      case PROTOCOL_REJECTED -> SendResult.rejected(
          0xA700, "Refused: out of resources (simulated attempt " + attempt + ")");
      case NETWORK_ERROR -> SendResult.networkError(
          "Connection reset (simulated attempt " + attempt + ")");
      case TIMEOUT -> SendResult.timeout("No response (simulated attempt " + attempt + ")");
      case SUCCESS -> SendResult.success();
    };
  }

  private void pause() throws InterruptedException {
    long millis = latency.toMillis();
    long spread = jitter.toMillis();
    if (spread > 0) {
      millis += ThreadLocalRandom.current().nextLong(-spread, spread + 1);
    }
    if (millis > 0) {
      TimeUnit.MILLISECONDS.sleep(millis);
    }
  }

  /** Fluent configuration for {@link SimulatedProtocolClient}. */
  public static final class Builder {
    private Duration latency = Duration.ZERO;
    private Duration jitter = Duration.ZERO;
    private int failEvery;
    private OutcomeKind failureKind = OutcomeKind.PROTOCOL_REJECTED;
    private boolean reachable = true;

    private Builder() {}

    public Builder latency(Duration latency) {
      this.latency = Objects.requireNonNull(latency, "latency");
      return this;
    }

    /** Spreads each call's latency uniformly by up to this amount in either direction. */
    public Builder jitter(Duration jitter) {
      this.jitter = Objects.requireNonNull(jitter, "jitter");
      return this;
    }

    /**
     * Makes every {@code n}-th send attempt (counted across all threads) fail with {@code kind}.
     * Zero disables failures.
     */
    public Builder failEvery(int n, OutcomeKind kind) {
      if (n < 0) {
        throw new IllegalArgumentException("failEvery must be >= 0");
      }
      this.failEvery = n;
      this.failureKind = Objects.requireNonNull(kind, "kind");
      return this;
    }

    public Builder reachable(boolean reachable) {
      this.reachable = reachable;
      return this;
    }

    public SimulatedProtocolClient build() {
      if (jitter.compareTo(latency) > 0) {
        throw new IllegalArgumentException("jitter must not exceed latency");
      }
      return new SimulatedProtocolClient(this);
    }
  }
}
