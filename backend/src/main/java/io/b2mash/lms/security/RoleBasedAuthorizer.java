package io.b2mash.lms.security;

import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.multitenancy.TenantResolver;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Role policy for tenant endpoints. Controllers reference it from {@code @PreAuthorize}, e.g.
 * {@code @PreAuthorize("@rbac.allows(authentication, 'INSTRUCTOR')")}; the named role is the least
 * privileged role admitted, and every role above it is admitted too.
 */
@Component("rbac")
public class RoleBasedAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(RoleBasedAuthorizer.class);

  /**
   * Evaluates, in order: no identity denies; super admin allows; a known invocation tenant that
   * differs from the identity's tenant denies; no required roles allows; otherwise allows when the
   * identity's highest rank reaches the lowest required rank.
   */
  public AccessDecision decide(
      AuthenticatedUser user, String invocationTenant, Collection<Role> allowedRoles) {
    if (user == null) {
      return AccessDecision.DENY;
    }
    if (user.isSuperAdmin()) {
      return AccessDecision.ALLOW;
    }
    if (invocationTenant != null && !TenantResolver.sameTenant(invocationTenant, user.tenantId())) {
      return AccessDecision.DENY;
    }
    if (allowedRoles == null || allowedRoles.isEmpty()) {
      return AccessDecision.ALLOW;
    }
    int required = allowedRoles.stream().mapToInt(Role::rank).min().orElse(0);
    return Role.maxRank(user.roles()) >= required ? AccessDecision.ALLOW : AccessDecision.DENY;
  }

  public boolean allows(Authentication authentication, String minimumRole) {
    return evaluate(authentication, List.of(Role.valueOf(minimumRole)));
  }

  /** Any authenticated role within the request tenant. */
  public boolean isMember(Authentication authentication) {
    return evaluate(authentication, List.of());
  }

  private boolean evaluate(Authentication authentication, List<Role> allowedRoles) {
    AuthenticatedUser user =
        authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser u
            ? u
            : null;
    String tenant = TenantContext.getTenantId();
    AccessDecision decision = decide(user, tenant, allowedRoles);
    if (decision == AccessDecision.DENY) {
      log.warn(
          "security.access_denied: tenant={}, user_id={}, roles={}, required={}",
          tenant,
          user != null ? user.userId() : null,
          user != null ? user.roles() : List.of(),
          allowedRoles);
    }
    return decision == AccessDecision.ALLOW;
  }
}
