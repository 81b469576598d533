package io.b2mash.lms.user;

import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.exception.UnauthorizedException;
import io.b2mash.lms.multitenancy.TenantResolver;
import io.b2mash.lms.security.AuthenticatedUser;
import io.b2mash.lms.security.PasswordHasher;
import io.b2mash.lms.user.dto.ChangePasswordRequest;
import io.b2mash.lms.user.dto.UpdatePreferencesRequest;
import io.b2mash.lms.user.dto.UpdateProfileRequest;
import io.b2mash.lms.user.dto.UserResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Self-service profile, notification preferences and password changes for the caller. */
@Service
public class UserSettingsService {

  private static final Logger log = LoggerFactory.getLogger(UserSettingsService.class);

  static final int MIN_PASSWORD_LENGTH = 8;

  private final UserAccountRepository userRepository;
  private final PasswordHasher passwordHasher;

  public UserSettingsService(UserAccountRepository userRepository, PasswordHasher passwordHasher) {
    this.userRepository = userRepository;
    this.passwordHasher = passwordHasher;
  }

  public UserResponse getProfile(AuthenticatedUser caller) {
    return UserResponse.from(loadOwnedUser(caller));
  }

  public UserResponse updateProfile(AuthenticatedUser caller, UpdateProfileRequest request) {
    var user = loadOwnedUser(caller);
    var updated =
        new UserAccount(
            user.id(),
            user.email(),
            user.passwordHash(),
            coalesce(trimToNull(request.firstName()), user.firstName()),
            coalesce(trimToNull(request.lastName()), user.lastName()),
            request.avatarUrl() != null ? trimToNull(request.avatarUrl()) : user.avatarUrl(),
            request.phoneNumber() != null ? trimToNull(request.phoneNumber()) : user.phoneNumber(),
            request.jobTitle() != null ? trimToNull(request.jobTitle()) : user.jobTitle(),
            request.bio() != null ? trimToNull(request.bio()) : user.bio(),
            request.timezone() != null ? trimToNull(request.timezone()) : user.timezone(),
            request.locale() != null ? trimToNull(request.locale()) : user.locale(),
            request.socialLinks() != null
                ? cleanSocialLinks(request.socialLinks())
                : user.socialLinks(),
            user.notificationPreferences(),
            user.marketingOptIn(),
            user.lastLoginAt(),
            user.lastPasswordChangedAt(),
            user.roles(),
            user.status(),
            user.tenantId(),
            user.createdAt(),
            user.updatedAt());
    userRepository.updateProfile(updated);
    log.info("Updated profile: user_id={}", user.id());
    return UserResponse.from(userRepository.findById(user.id()).orElse(updated));
  }

  public UserResponse updatePreferences(
      AuthenticatedUser caller, UpdatePreferencesRequest request) {
    var user = loadOwnedUser(caller);
    var current = user.notificationPreferences();
    var preferences =
        new NotificationPreferences(
            request.email() != null ? request.email() : current.email(),
            request.sms() != null ? request.sms() : current.sms(),
            request.push() != null ? request.push() : current.push());
    boolean marketingOptIn =
        request.marketingOptIn() != null ? request.marketingOptIn() : user.marketingOptIn();

    userRepository.updatePreferences(user.id(), preferences, marketingOptIn);
    log.info("Updated notification preferences: user_id={}", user.id());
    return UserResponse.from(userRepository.findById(user.id()).orElseThrow());
  }

  public void changePassword(AuthenticatedUser caller, ChangePasswordRequest request) {
    if (request.newPassword().length() < MIN_PASSWORD_LENGTH) {
      throw new InvalidStateException(
          "Invalid password", "New password must be at least 8 characters long");
    }
    var user = loadOwnedUser(caller);
    if (!passwordHasher.verify(request.currentPassword(), user.passwordHash())) {
      throw new UnauthorizedException("Password change failed", "Current password is incorrect");
    }
    userRepository.updatePassword(
        user.id(), passwordHasher.hash(request.newPassword()), Instant.now());
    log.info("Changed password: user_id={}", user.id());
  }

  private UserAccount loadOwnedUser(AuthenticatedUser caller) {
    return userRepository
        .findById(caller.userId())
        .filter(u -> TenantResolver.sameTenant(u.tenantId(), caller.tenantId()))
        .orElseThrow(() -> new ForbiddenException("Access denied", "User not found in tenant"));
  }

  static Map<String, String> cleanSocialLinks(Map<String, String> links) {
    var cleaned = new LinkedHashMap<String, String>();
    links.forEach(
        (key, value) -> {
          String k = trimToNull(key);
          String v = trimToNull(value);
          if (k != null && v != null) {
            cleaned.put(k, v);
          }
        });
    return cleaned;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String coalesce(String value, String fallback) {
    return value != null ? value : fallback;
  }
}
