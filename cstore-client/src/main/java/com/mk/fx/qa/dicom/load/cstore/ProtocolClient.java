package com.mk.fx.qa.dicom.load.cstore;

import java.nio.file.Path;

/**
 * Boundary to the DICOM transport. Implementations own association negotiation, presentation
 * contexts and PDU framing; callers only see typed results.
 *
 * <p>Implementations must be safe to call from many threads at once. Each {@link #send} call is
 * expected to open its own association, perform a single C-STORE and release it.
 */
public interface ProtocolClient {

  /**
   * Performs a C-ECHO against the target.
   *
   * @param target node to probe
   * @return {@code true} if an association was established and the echo returned success
   */
  boolean echo(DicomTarget target);

  /**
   * Stores one Part 10 file on the target.
   *
   * <p>Transport failures should be reported as {@link OutcomeKind#NETWORK_ERROR} results rather
   * than thrown; callers still treat any thrown exception as a network error.
   *
   * @param target receiving node
   * @param payload file to transfer
   * @return typed result of the attempt, never {@code null}
   */
  SendResult send(DicomTarget target, Path payload);
}
