package io.b2mash.lms.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Platform roles, declared from least to most privileged. A caller holding several roles acts with
 * the highest of them.
 */
public enum Role {
  STUDENT("student", 1),
  INSTRUCTOR("instructor", 2),
  TENANT_ADMIN("tenantAdmin", 3),
  SUPER_ADMIN("superAdmin", 4);

  private final String wireName;
  private final int rank;

  Role(String wireName, int rank) {
    this.wireName = wireName;
    this.rank = rank;
  }

  /** Name used in token claims and API payloads. */
  public String wireName() {
    return wireName;
  }

  public int rank() {
    return rank;
  }

  public boolean atLeast(Role other) {
    return rank >= other.rank;
  }

  public static Optional<Role> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Role role : values()) {
      if (role.wireName.equals(value) || role.name().equals(value)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /** Parses role names, dropping any that are not recognised. */
  public static List<Role> parseAll(Collection<String> values) {
    List<Role> roles = new ArrayList<>();
    if (values == null) {
      return roles;
    }
    for (String value : values) {
      fromWireName(value).filter(r -> !roles.contains(r)).ifPresent(roles::add);
    }
    return roles;
  }

  public static List<String> wireNames(Collection<Role> roles) {
    return roles.stream().map(Role::wireName).toList();
  }

  /** Highest rank held, or 0 for no roles. */
  public static int maxRank(Collection<Role> roles) {
    return roles.stream().mapToInt(Role::rank).max().orElse(0);
  }
}
