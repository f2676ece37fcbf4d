package com.mk.fx.qa.dicom.load.dispatch;

import com.google.common.util.concurrent.RateLimiter;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Token-bucket gate admitting sends at a fixed rate, backed by a Guava {@link RateLimiter}.
 *
 * <p>{@link RateLimiter#tryAcquire(Duration)} gives up immediately when the next permit lies
 * beyond the timeout, so a refused caller sleeps out its slice before returning. That keeps
 * callers polling in bounded slices without spinning.
 */
public final class RateLimitedAdmissionGate implements AdmissionGate {

  private final RateLimiter limiter;

  public RateLimitedAdmissionGate(double permitsPerSecond) {
    if (!(permitsPerSecond > 0) || Double.isInfinite(permitsPerSecond)) {
      throw new IllegalArgumentException("permitsPerSecond must be positive and finite");
    }
    this.limiter = RateLimiter.create(permitsPerSecond);
  }

  @Override
  public boolean tryAdmit(Duration maxWait) throws InterruptedException {
    if (limiter.tryAcquire(maxWait)) {
      return true;
    }
    TimeUnit.NANOSECONDS.sleep(maxWait.toNanos());
    return false;
  }
}
