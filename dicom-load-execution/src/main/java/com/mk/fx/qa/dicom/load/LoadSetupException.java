package com.mk.fx.qa.dicom.load;

/**
 * Base type for problems found while preparing a run: bad options, no usable payloads, or an
 * unreachable target. These abort a run before the first send; failures of individual sends are
 * never reported this way.
 */
public class LoadSetupException extends RuntimeException {

  public LoadSetupException(String message) {
    super(message);
  }

  public LoadSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
