package io.b2mash.lms.multitenancy;

public class RequestContextNotBoundException extends RuntimeException {

  public RequestContextNotBoundException(String what) {
    super("Request context not available: " + what + " not bound by filter chain");
  }
}
