package io.b2mash.lms.security;

/** Strict {@code Authorization: Bearer <token>} parsing. Any other shape yields no token. */
public final class BearerTokenExtractor {

  private static final String BEARER_SCHEME = "Bearer";

  private BearerTokenExtractor() {}

  public static String extract(String authorizationHeader) {
    if (authorizationHeader == null) {
      return null;
    }
    String[] parts = authorizationHeader.split(" ");
    if (parts.length != 2 || !BEARER_SCHEME.equals(parts[0]) || parts[1].isEmpty()) {
      return null;
    }
    return parts[1];
  }
}
