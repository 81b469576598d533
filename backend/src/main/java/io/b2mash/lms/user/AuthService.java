package io.b2mash.lms.user;

import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.exception.ResourceConflictException;
import io.b2mash.lms.exception.UnauthorizedException;
import io.b2mash.lms.multitenancy.TenantResolver;
import io.b2mash.lms.security.JwtTokenService;
import io.b2mash.lms.security.PasswordHasher;
import io.b2mash.lms.security.Role;
import io.b2mash.lms.security.TokenClaims;
import io.b2mash.lms.security.TokenType;
import io.b2mash.lms.user.dto.AuthResponse;
import io.b2mash.lms.user.dto.LoginRequest;
import io.b2mash.lms.user.dto.RegisterRequest;
import io.b2mash.lms.user.dto.UserResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private static final Set<Role> SELF_ASSIGNABLE_ROLES =
      EnumSet.of(Role.STUDENT, Role.INSTRUCTOR, Role.TENANT_ADMIN);

  private final UserAccountRepository userRepository;
  private final PasswordHasher passwordHasher;
  private final JwtTokenService tokenService;

  public AuthService(
      UserAccountRepository userRepository,
      PasswordHasher passwordHasher,
      JwtTokenService tokenService) {
    this.userRepository = userRepository;
    this.passwordHasher = passwordHasher;
    this.tokenService = tokenService;
  }

  public AuthResponse register(RegisterRequest request, String tenantId) {
    String email = normalizeEmail(request.email());
    List<Role> roles = parseRequestedRoles(request.roles());

    if (userRepository.existsByEmail(email)) {
      throw new ResourceConflictException("Email already registered", "Email is already in use");
    }

    UserAccount user;
    try {
      user =
          userRepository.insert(
              email,
              passwordHasher.hash(request.password()),
              request.firstName().trim(),
              request.lastName().trim(),
              roles,
              TenantResolver.sanitize(tenantId));
    } catch (DuplicateKeyException e) {
      throw new ResourceConflictException("Email already registered", "Email is already in use");
    }

    log.info("Registered user: id={}, tenant={}, roles={}", user.id(), user.tenantId(), roles);
    return new AuthResponse(UserResponse.from(user), tokenService.issuePair(user.toIdentity()));
  }

  public AuthResponse login(LoginRequest request, String tenantId) {
    String email = normalizeEmail(request.email());
    var user =
        userRepository
            .findByEmail(email)
            .orElseThrow(
                () -> new UnauthorizedException("Login failed", "Invalid email or password"));

    if (!passwordHasher.verify(request.password(), user.passwordHash())) {
      log.warn("security.login_failed: user_id={}, reason=bad_credentials", user.id());
      throw new UnauthorizedException("Login failed", "Invalid email or password");
    }
    if (!TenantResolver.sameTenant(user.tenantId(), tenantId)) {
      log.warn(
          "security.tenant_mismatch: user_id={}, user_tenant={}, tenant={}",
          user.id(),
          user.tenantId(),
          TenantResolver.sanitize(tenantId));
      throw new ForbiddenException("Login failed", "User does not belong to this tenant");
    }
    if (!user.isActive()) {
      throw new ForbiddenException("Login failed", "User account is not active");
    }

    Instant now = Instant.now();
    userRepository.recordLogin(user.id(), now);
    log.info("User logged in: id={}, tenant={}", user.id(), user.tenantId());

    var refreshed = userRepository.findById(user.id()).orElse(user);
    return new AuthResponse(
        UserResponse.from(refreshed), tokenService.issuePair(refreshed.toIdentity()));
  }

  public AuthResponse refresh(String refreshToken, String tenantId) {
    TokenClaims claims = tokenService.verify(refreshToken, TokenType.REFRESH);

    if (claims.tenantId() != null && !TenantResolver.sameTenant(claims.tenantId(), tenantId)) {
      log.warn(
          "security.tenant_mismatch: user_id={}, token_tenant={}, tenant={}",
          claims.subject(),
          claims.tenantId(),
          TenantResolver.sanitize(tenantId));
      throw new ForbiddenException("Refresh failed", "Token tenant mismatch");
    }

    UUID userId;
    try {
      userId = UUID.fromString(claims.subject());
    } catch (IllegalArgumentException e) {
      throw new ForbiddenException("Refresh failed", "User not allowed to refresh token");
    }

    var user =
        userRepository
            .findById(userId)
            .filter(UserAccount::isActive)
            .filter(u -> TenantResolver.sameTenant(u.tenantId(), tenantId))
            .orElseThrow(
                () -> new ForbiddenException("Refresh failed", "User not allowed to refresh token"));

    log.info("Refreshed tokens: user_id={}, tenant={}", user.id(), user.tenantId());
    return new AuthResponse(UserResponse.from(user), tokenService.issuePair(user.toIdentity()));
  }

  static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  static List<Role> parseRequestedRoles(List<String> requested) {
    if (requested == null || requested.isEmpty()) {
      return List.of(Role.STUDENT);
    }
    List<Role> roles = new ArrayList<>();
    for (String value : requested) {
      Role role =
          Role.fromWireName(value)
              .filter(SELF_ASSIGNABLE_ROLES::contains)
              .orElseThrow(
                  () -> new InvalidStateException("Invalid role", "Invalid role: " + value));
      if (!roles.contains(role)) {
        roles.add(role);
      }
    }
    return roles;
  }
}
