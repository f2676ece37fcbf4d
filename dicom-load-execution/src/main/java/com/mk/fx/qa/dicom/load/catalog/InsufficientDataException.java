package com.mk.fx.qa.dicom.load.catalog;

import com.mk.fx.qa.dicom.load.LoadSetupException;

/** Raised when a selection asks for more payloads than the catalog can supply. */
public class InsufficientDataException extends LoadSetupException {

  private final int requested;
  private final int available;

  public InsufficientDataException(String message, int requested, int available) {
    super(message);
    this.requested = requested;
    this.available = available;
  }

  public int getRequested() {
    return requested;
  }

  public int getAvailable() {
    return available;
  }
}
