package io.b2mash.lms.security;

import java.time.Instant;
import java.util.List;

/** Claims read from a verified token. Tenant and roles are as signed, not yet sanitized. */
public record TokenClaims(
    String subject,
    String email,
    String tenantId,
    List<String> roles,
    String name,
    List<String> permissions,
    TokenType tokenType,
    Instant issuedAt,
    Instant expiresAt) {}
