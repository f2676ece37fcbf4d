package com.mk.fx.qa.dicom.load.cstore;

import java.util.Objects;

/**
 * Remote storage node a run sends to.
 *
 * @param host host name or address of the receiving node
 * @param port DICOM listener port
 * @param calledAeTitle AE title of the receiving node
 * @param callingAeTitle AE title this sender presents during association
 */
public record DicomTarget(String host, int port, String calledAeTitle, String callingAeTitle) {

  private static final int MAX_AE_TITLE_LENGTH = 16;

  public DicomTarget {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(calledAeTitle, "calledAeTitle");
    Objects.requireNonNull(callingAeTitle, "callingAeTitle");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 1 and 65535, was " + port);
    }
    requireAeTitle(calledAeTitle, "calledAeTitle");
    requireAeTitle(callingAeTitle, "callingAeTitle");
  }

  private static void requireAeTitle(String value, String name) {
    if (value.isBlank() || value.length() > MAX_AE_TITLE_LENGTH) {
      throw new IllegalArgumentException(
          name + " must be 1-" + MAX_AE_TITLE_LENGTH + " characters, was '" + value + "'");
    }
  }

  @Override
  public String toString() {
    return callingAeTitle + "->" + calledAeTitle + "@" + host + ":" + port;
  }
}
