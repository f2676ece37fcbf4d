package com.mk.fx.qa.dicom.load.dispatch;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-scoped stop conditions shared by all workers: a send budget, an optional deadline and a
 * cancellation flag. Tickets are issued atomically, so no two workers ever hold the same one.
 */
public final class RunControl {

  private final long budget;
  private final long deadlineNanos;
  private final AtomicLong nextTicket = new AtomicLong();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private RunControl(long budget, long deadlineNanos) {
    if (budget < 0) {
      throw new IllegalArgumentException("budget must be >= 0");
    }
    this.budget = budget;
    this.deadlineNanos = deadlineNanos;
  }

  /** Stops after {@code budget} tickets. */
  public static RunControl forCount(long budget) {
    return new RunControl(budget, Long.MAX_VALUE);
  }

  /** Stops after {@code budget} tickets or once {@code duration} has elapsed from now. */
  public static RunControl forDuration(long budget, Duration duration) {
    return new RunControl(budget, System.nanoTime() + duration.toNanos());
  }

  /**
   * Issues the next ticket.
   *
   * @return the 0-based ticket, or empty when the run is cancelled, past its deadline or out of
   *     budget
   */
  public OptionalLong claim() {
    if (shouldStop()) {
      return OptionalLong.empty();
    }
    long ticket = nextTicket.getAndIncrement();
    if (ticket >= budget) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(ticket);
  }

  /** True once cancelled or past the deadline. */
  public boolean shouldStop() {
    return cancelled.get() || deadlinePassed();
  }

  public boolean deadlinePassed() {
    return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public long budget() {
    return budget;
  }
}
