package com.mk.fx.qa.dicom.load.model;

/** Lifecycle of a submitted run as tracked by the run service. */
public enum RunStatus {
  QUEUED,
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}
