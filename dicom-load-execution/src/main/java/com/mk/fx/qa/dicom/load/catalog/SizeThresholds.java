package com.mk.fx.qa.dicom.load.catalog;

/**
 * Byte limits separating the {@link SizeBucket}s. A file is SMALL below {@code mediumFromBytes},
 * LARGE at or above {@code largeFromBytes}, MEDIUM otherwise.
 */
public record SizeThresholds(long mediumFromBytes, long largeFromBytes) {

  private static final long MIB = 1024L * 1024L;

  public static final long DEFAULT_MEDIUM_FROM_BYTES = MIB;
  public static final long DEFAULT_LARGE_FROM_BYTES = 10 * MIB;

  public SizeThresholds {
    if (mediumFromBytes <= 0 || largeFromBytes <= mediumFromBytes) {
      throw new IllegalArgumentException(
          "Thresholds must satisfy 0 < mediumFromBytes < largeFromBytes");
    }
  }

  public static SizeThresholds defaults() {
    return new SizeThresholds(DEFAULT_MEDIUM_FROM_BYTES, DEFAULT_LARGE_FROM_BYTES);
  }

  public SizeBucket bucketOf(long sizeBytes) {
    if (sizeBytes < mediumFromBytes) {
      return SizeBucket.SMALL;
    }
    return sizeBytes < largeFromBytes ? SizeBucket.MEDIUM : SizeBucket.LARGE;
  }
}
