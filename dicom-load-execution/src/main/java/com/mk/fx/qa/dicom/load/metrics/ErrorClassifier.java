package com.mk.fx.qa.dicom.load.metrics;

/**
 * Turns exceptions escaping a protocol client into short failure details of the form {@code
 * CATEGORY: message}, keyed on the root cause.
 */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  public static String describe(Throwable t) {
    if (t == null) {
      return "UNKNOWN";
    }
    Throwable rootCause = rootCause(t);
    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getClass().getSimpleName() + " occurred";
    }
    return category(rootCause) + ": " + msg;
  }

  static String category(Throwable rootCause) {
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketException" -> "CONNECTION_RESET";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "NoRouteToHostException" -> "NO_ROUTE_TO_HOST";
      case "SSLException", "SSLHandshakeException" -> "TLS_ERROR";
      case "EOFException" -> "ASSOCIATION_ABORTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }
}
