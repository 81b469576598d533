package io.b2mash.lms.security;

import java.util.List;
import java.util.UUID;

/**
 * Caller identity established from a verified access token. {@code tenantId} is always sanitized.
 */
public record AuthenticatedUser(
    UUID userId,
    String email,
    String tenantId,
    List<Role> roles,
    String name,
    List<String> permissions) {

  public AuthenticatedUser {
    roles = roles == null || roles.isEmpty() ? List.of(Role.STUDENT) : List.copyOf(roles);
    permissions = permissions == null ? List.of() : List.copyOf(permissions);
    if (name == null || name.isBlank()) {
      name = email;
    }
  }

  public boolean hasRole(Role role) {
    return roles.contains(role);
  }

  public boolean isSuperAdmin() {
    return hasRole(Role.SUPER_ADMIN);
  }
}
