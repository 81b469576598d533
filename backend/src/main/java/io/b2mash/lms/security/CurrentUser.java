package io.b2mash.lms.security;

import io.b2mash.lms.multitenancy.RequestContextNotBoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class CurrentUser {

  private CurrentUser() {}

  /** Identity bound by {@link JwtAuthenticationFilter}. Missing here is a wiring fault. */
  public static AuthenticatedUser require() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
      return user;
    }
    throw new RequestContextNotBoundException("authenticated user");
  }
}
