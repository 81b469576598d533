package io.b2mash.lms.user;

import io.b2mash.lms.security.AuthenticatedUser;
import io.b2mash.lms.security.Role;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** A row of the directory {@code users} table. {@code tenantId} is stored sanitized. */
public record UserAccount(
    UUID id,
    String email,
    String passwordHash,
    String firstName,
    String lastName,
    String avatarUrl,
    String phoneNumber,
    String jobTitle,
    String bio,
    String timezone,
    String locale,
    Map<String, String> socialLinks,
    NotificationPreferences notificationPreferences,
    boolean marketingOptIn,
    Instant lastLoginAt,
    Instant lastPasswordChangedAt,
    List<Role> roles,
    UserStatus status,
    String tenantId,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isActive() {
    return status == UserStatus.ACTIVE;
  }

  public String displayName() {
    String name =
        ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "")).trim();
    return name.isEmpty() ? email : name;
  }

  public AuthenticatedUser toIdentity() {
    return new AuthenticatedUser(id, email, tenantId, roles, displayName(), List.of());
  }
}
