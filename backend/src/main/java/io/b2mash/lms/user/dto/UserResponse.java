package io.b2mash.lms.user.dto;

import io.b2mash.lms.security.Role;
import io.b2mash.lms.user.NotificationPreferences;
import io.b2mash.lms.user.UserAccount;
import io.b2mash.lms.user.UserStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record UserResponse(
    UUID id,
    String email,
    String firstName,
    String lastName,
    List<String> roles,
    String tenantId,
    UserStatus status,
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
    Instant createdAt,
    Instant updatedAt) {

  public static UserResponse from(UserAccount user) {
    return new UserResponse(
        user.id(),
        user.email(),
        user.firstName(),
        user.lastName(),
        Role.wireNames(user.roles()),
        user.tenantId(),
        user.status(),
        user.avatarUrl(),
        user.phoneNumber(),
        user.jobTitle(),
        user.bio(),
        user.timezone(),
        user.locale(),
        user.socialLinks(),
        user.notificationPreferences(),
        user.marketingOptIn(),
        user.lastLoginAt(),
        user.lastPasswordChangedAt(),
        user.createdAt(),
        user.updatedAt());
  }
}
