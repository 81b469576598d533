package io.b2mash.lms.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.lms.multitenancy.TenantContext;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

class RoleBasedAuthorizerTest {

  private final RoleBasedAuthorizer authorizer = new RoleBasedAuthorizer();

  @AfterEach
  void tearDown() {
    TenantContext.clear();
  }

  @Test
  void noIdentity_denies() {
    assertThat(authorizer.decide(null, "acme", Set.of())).isEqualTo(AccessDecision.DENY);
  }

  @Test
  void superAdmin_allowedDespiteTenantMismatchAndRoles() {
    var admin = user("platform", Role.SUPER_ADMIN);

    assertThat(authorizer.decide(admin, "acme", Set.of(Role.TENANT_ADMIN)))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @Test
  void tenantMismatch_deniesBeforeRoleCheck() {
    var admin = user("acme", Role.TENANT_ADMIN);

    assertThat(authorizer.decide(admin, "globex", Set.of())).isEqualTo(AccessDecision.DENY);
    assertThat(authorizer.decide(admin, "globex", Set.of(Role.STUDENT)))
        .isEqualTo(AccessDecision.DENY);
  }

  @Test
  void tenantComparisonUsesSanitizedForm() {
    var instructor = user("acme_corp", Role.INSTRUCTOR);

    assertThat(authorizer.decide(instructor, "Acme-Corp", Set.of(Role.INSTRUCTOR)))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @Test
  void noRequiredRoles_allowsAnyAuthenticatedRole() {
    assertThat(authorizer.decide(user("acme", Role.STUDENT), "acme", Set.of()))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @ParameterizedTest
  @EnumSource(
      value = Role.class,
      names = {"STUDENT", "INSTRUCTOR"})
  void tenantAdmin_allowedOnLowerRequirements(Role required) {
    assertThat(authorizer.decide(user("acme", Role.TENANT_ADMIN), "acme", Set.of(required)))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @Test
  void student_deniedOnInstructorEndpoint() {
    assertThat(authorizer.decide(user("acme", Role.STUDENT), "acme", Set.of(Role.INSTRUCTOR)))
        .isEqualTo(AccessDecision.DENY);
  }

  @Test
  void minimumOfAllowedRolesApplies() {
    var student = user("acme", Role.STUDENT);

    assertThat(
            authorizer.decide(student, "acme", Set.of(Role.STUDENT, Role.TENANT_ADMIN)))
        .isEqualTo(AccessDecision.ALLOW);
  }

  @Test
  void allows_instructorRequirement_forInstructorAndDeniedForTenantAdminRequirement() {
    TenantContext.setTenantId("acme");
    var auth = authentication(user("acme", Role.INSTRUCTOR));

    assertThat(authorizer.allows(auth, "INSTRUCTOR")).isTrue();
    assertThat(authorizer.allows(auth, "TENANT_ADMIN")).isFalse();
  }

  @Test
  void isMember_deniesAnonymous() {
    TenantContext.setTenantId("acme");

    assertThat(authorizer.isMember(null)).isFalse();
    assertThat(authorizer.isMember(authentication(user("acme", Role.STUDENT)))).isTrue();
  }

  private static AuthenticatedUser user(String tenantId, Role role) {
    return new AuthenticatedUser(
        UUID.randomUUID(), "user@x.com", tenantId, List.of(role), null, List.of());
  }

  private static UsernamePasswordAuthenticationToken authentication(AuthenticatedUser user) {
    return UsernamePasswordAuthenticationToken.authenticated(user, null, List.of());
  }
}
