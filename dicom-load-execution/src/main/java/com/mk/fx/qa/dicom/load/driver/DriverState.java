package com.mk.fx.qa.dicom.load.driver;

/** Lifecycle of a {@link LoadDriver}. */
public enum DriverState {
  IDLE,
  RUNNING,
  COMPLETED,
  CANCELLED,
  /** Setup failed before the first send. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
