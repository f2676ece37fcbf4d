package com.mk.fx.qa.dicom.load.cstore;

import java.util.Objects;

/**
 * Result of one storage attempt as reported by a {@link ProtocolClient}.
 *
 * @param kind classification of the attempt
 * @param status DIMSE status returned by the server, {@code null} when no response was received
 * @param detail human readable detail for failures, {@code null} on success
 */
public record SendResult(OutcomeKind kind, Integer status, String detail) {

  public static final int STATUS_SUCCESS = 0x0000;

  public SendResult {
    Objects.requireNonNull(kind, "kind");
  }

  public static SendResult success() {
    return new SendResult(OutcomeKind.SUCCESS, STATUS_SUCCESS, null);
  }

  public static SendResult rejected(Integer status, String detail) {
    return new SendResult(OutcomeKind.PROTOCOL_REJECTED, status, detail);
  }

  public static SendResult networkError(String detail) {
    return new SendResult(OutcomeKind.NETWORK_ERROR, null, detail);
  }

  public static SendResult timeout(String detail) {
    return new SendResult(OutcomeKind.TIMEOUT, null, detail);
  }

  public boolean isSuccess() {
    return kind == OutcomeKind.SUCCESS;
  }
}
