package com.mk.fx.qa.dicom.load.catalog;

/**
 * Which discovered payloads a run uses.
 *
 * @param category optional size bucket or modality filter, {@code null} for all payloads
 * @param sampleSize optional number of payloads to draw, {@code null} to use every match
 * @param seed seed for the sampling shuffle
 */
public record PayloadSelection(String category, Integer sampleSize, long seed) {

  public static final long DEFAULT_SEED = 42L;

  public static PayloadSelection all() {
    return new PayloadSelection(null, null, DEFAULT_SEED);
  }
}
