package io.b2mash.lms.multitenancy;

import jakarta.servlet.http.HttpServletRequest;

/** Reads the caller-supplied correlation id. Never generates one. */
public final class RequestCorrelation {

  public static final String REQUEST_ID_HEADER = "x-request-id";
  public static final String CORRELATION_ID_HEADER = "x-correlation-id";
  public static final String MDC_CORRELATION_ID = "correlationId";

  private RequestCorrelation() {}

  public static String correlationId(HttpServletRequest request) {
    String requestId = firstValue(request.getHeader(REQUEST_ID_HEADER));
    if (requestId != null) {
      return requestId;
    }
    return firstValue(request.getHeader(CORRELATION_ID_HEADER));
  }

  private static String firstValue(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    // Repeated headers may arrive folded into one comma-separated value
    int comma = header.indexOf(',');
    String first = comma >= 0 ? header.substring(0, comma) : header;
    first = first.trim();
    return first.isEmpty() ? null : first;
  }
}
