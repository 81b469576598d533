package io.b2mash.lms.security;

import io.b2mash.lms.multitenancy.RequestCorrelation;
import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.multitenancy.TenantResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates tenant API requests from a bearer access token. Runs after {@link
 * io.b2mash.lms.multitenancy.TenantFilter}, so the request tenant is already bound.
 *
 * <p>Missing or invalid tokens are rejected with 401. A valid token whose tenant differs from the
 * request tenant is rejected with 403. The token is always verified before tenants are compared.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
  private static final String MDC_USER_ID = "userId";

  private final JwtTokenService tokenService;
  private final TenantResolver tenantResolver;

  public JwtAuthenticationFilter(JwtTokenService tokenService, TenantResolver tenantResolver) {
    this.tokenService = tokenService;
    this.tenantResolver = tenantResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String requestTenant = requestTenant(request);

    String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authorization == null) {
      logFailure(request, requestTenant, "missing_authorization");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Authorization header");
      return;
    }
    String token = BearerTokenExtractor.extract(authorization);
    if (token == null) {
      logFailure(request, requestTenant, "malformed_authorization");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid Authorization header");
      return;
    }

    TokenClaims claims;
    try {
      claims = tokenService.verify(token, TokenType.ACCESS);
    } catch (InvalidTokenException e) {
      logFailure(request, requestTenant, "invalid_token");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, InvalidTokenException.MESSAGE);
      return;
    }

    String tokenTenant =
        claims.tenantId() != null ? TenantResolver.sanitize(claims.tenantId()) : null;
    if (tokenTenant != null && !tokenTenant.equals(requestTenant)) {
      log.warn(
          "security.tenant_mismatch: path={}, method={}, correlation_id={}, tenant={},"
              + " token_tenant={}, user_id={}",
          request.getRequestURI(),
          request.getMethod(),
          RequestCorrelation.correlationId(request),
          requestTenant,
          tokenTenant,
          claims.subject());
      response.sendError(HttpServletResponse.SC_FORBIDDEN, "Token tenant mismatch");
      return;
    }

    AuthenticatedUser user;
    try {
      user = toUser(claims, tokenTenant != null ? tokenTenant : requestTenant);
    } catch (IllegalArgumentException e) {
      logFailure(request, requestTenant, "invalid_subject");
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, InvalidTokenException.MESSAGE);
      return;
    }

    var authorities =
        user.roles().stream().map(r -> new SimpleGrantedAuthority("ROLE_" + r.name())).toList();
    var authentication = UsernamePasswordAuthenticationToken.authenticated(user, null, authorities);
    var context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(authentication);
    SecurityContextHolder.setContext(context);

    log.info(
        "security.authenticated: path={}, method={}, correlation_id={}, tenant={}, user_id={}",
        request.getRequestURI(),
        request.getMethod(),
        RequestCorrelation.correlationId(request),
        user.tenantId(),
        user.userId());

    try {
      MDC.put(MDC_USER_ID, user.userId().toString());
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_USER_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/tenant/");
  }

  private String requestTenant(HttpServletRequest request) {
    String bound = TenantContext.getTenantId();
    return bound != null ? bound : TenantResolver.sanitize(tenantResolver.resolve(request));
  }

  private static AuthenticatedUser toUser(TokenClaims claims, String tenantId) {
    List<Role> roles = Role.parseAll(claims.roles());
    return new AuthenticatedUser(
        UUID.fromString(claims.subject()),
        claims.email(),
        tenantId,
        roles,
        claims.name(),
        claims.permissions());
  }

  private void logFailure(HttpServletRequest request, String tenant, String reason) {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, correlation_id={}, tenant={},"
            + " user_agent={}",
        request.getRequestURI(),
        request.getMethod(),
        reason,
        RequestCorrelation.correlationId(request),
        tenant,
        request.getHeader(HttpHeaders.USER_AGENT));
  }
}
