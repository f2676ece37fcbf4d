package com.mk.fx.qa.dicom.load.catalog;

/** Coarse payload size classes used to build size-specific scenarios. */
public enum SizeBucket {
  SMALL,
  MEDIUM,
  LARGE
}
