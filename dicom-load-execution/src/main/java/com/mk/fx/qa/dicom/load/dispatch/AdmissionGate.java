package com.mk.fx.qa.dicom.load.dispatch;

import java.time.Duration;

/**
 * Admission control for new sends. Shared by all workers of a run, so implementations must be
 * safe under concurrent calls.
 */
public interface AdmissionGate {

  /**
   * Waits at most {@code maxWait} for permission to start one send.
   *
   * @return true if admitted, false if the wait elapsed first
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean tryAdmit(Duration maxWait) throws InterruptedException;

  /** A gate that admits immediately. */
  static AdmissionGate open() {
    return maxWait -> true;
  }
}
