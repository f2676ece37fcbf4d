package com.mk.fx.qa.dicom.load.catalog;

import com.mk.fx.qa.dicom.load.LoadSetupException;

/** Raised when a dataset root is missing, unreadable or holds no DICOM files. */
public class CatalogException extends LoadSetupException {

  public CatalogException(String message) {
    super(message);
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
