package com.mk.fx.qa.dicom.load.catalog;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * Lightweight description of one payload file. Built from the file size and a header scan; the
 * pixel data is never loaded.
 *
 * @param path location of the Part 10 file
 * @param sizeBytes file size on disk
 * @param modality modality code (0008,0060), {@code null} when absent
 * @param sopClassUid SOP Class UID (0008,0016), {@code null} when absent
 * @param sopInstanceUid SOP Instance UID (0008,0018), {@code null} when absent
 * @param patientId Patient ID (0010,0020), classification only
 * @param studyInstanceUid Study Instance UID (0020,000D), classification only
 */
public record PayloadDescriptor(
    Path path,
    long sizeBytes,
    String modality,
    String sopClassUid,
    String sopInstanceUid,
    String patientId,
    String studyInstanceUid) {

  public static final String UNKNOWN_MODALITY = "UNKNOWN";

  /** Orders descriptors by their path, the catalog's canonical order. */
  public static final Comparator<PayloadDescriptor> BY_PATH =
      Comparator.comparing(PayloadDescriptor::path);

  public PayloadDescriptor {
    Objects.requireNonNull(path, "path");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be >= 0");
    }
  }

  public String modalityOrUnknown() {
    return modality == null || modality.isBlank() ? UNKNOWN_MODALITY : modality;
  }
}
