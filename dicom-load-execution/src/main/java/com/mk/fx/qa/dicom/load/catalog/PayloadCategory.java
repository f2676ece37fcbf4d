package com.mk.fx.qa.dicom.load.catalog;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Grouping key produced by {@link DatasetCatalog#classify}: either a size bucket or a modality
 * code.
 */
public record PayloadCategory(Kind kind, String name) implements Comparable<PayloadCategory> {

  public enum Kind {
    SIZE,
    MODALITY
  }

  private static final Comparator<PayloadCategory> ORDER =
      Comparator.comparing(PayloadCategory::kind).thenComparing(PayloadCategory::name);

  public PayloadCategory {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
  }

  public static PayloadCategory size(SizeBucket bucket) {
    return new PayloadCategory(Kind.SIZE, bucket.name());
  }

  public static PayloadCategory modality(String modality) {
    return new PayloadCategory(Kind.MODALITY, modality.toUpperCase(Locale.ROOT));
  }

  /** Parses {@code SMALL}, {@code MEDIUM}, {@code LARGE} as size buckets, anything else as a modality. */
  public static PayloadCategory parse(String value) {
    Objects.requireNonNull(value, "value");
    var normalised = value.trim().toUpperCase(Locale.ROOT);
    if (normalised.isEmpty()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    for (SizeBucket bucket : SizeBucket.values()) {
      if (bucket.name().equals(normalised)) {
        return size(bucket);
      }
    }
    return modality(normalised);
  }

  @Override
  public int compareTo(PayloadCategory other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + ":" + name;
  }
}
