package io.b2mash.lms.security;

/** Access and refresh tokens issued together. Expiries are in seconds. */
public record TokenPair(
    String accessToken, String refreshToken, long expiresIn, long refreshExpiresIn) {}
