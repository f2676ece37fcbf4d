package com.mk.fx.qa.dicom.load.driver;

import com.mk.fx.qa.dicom.load.LoadSetupException;

/** The pre-run C-ECHO probe failed. */
public class TargetUnreachableException extends LoadSetupException {

  public TargetUnreachableException(String message) {
    super(message);
  }

  public TargetUnreachableException(String message, Throwable cause) {
    super(message, cause);
  }
}
