package io.b2mash.lms.multitenancy;

import io.b2mash.lms.exception.InvalidStateException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the tenant for every tenant-scoped request and binds its sanitized form to {@link
 * TenantContext}. Tenant API and auth routes read the {@code x-tenant-id} header; public CMS routes
 * read the tenant from the path.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);

  static final String PUBLIC_TENANT_PREFIX = "/api/public/tenants/";
  static final String MDC_TENANT_ID = "tenantId";

  private final TenantResolver tenantResolver;

  public TenantFilter(TenantResolver tenantResolver) {
    this.tenantResolver = tenantResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String rawTenantId;
    try {
      rawTenantId = resolveRawTenant(request);
    } catch (InvalidStateException e) {
      log.warn(
          "tenant.rejected: path={}, method={}, reason={}",
          request.getRequestURI(),
          request.getMethod(),
          e.getBody().getDetail());
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, e.getBody().getDetail());
      return;
    }

    String tenantId = TenantResolver.sanitize(rawTenantId);
    try {
      TenantContext.setTenantId(tenantId);
      MDC.put(MDC_TENANT_ID, tenantId);
      filterChain.doFilter(request, response);
    } finally {
      TenantContext.clear();
      MDC.remove(MDC_TENANT_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return !(path.startsWith("/api/tenant/")
        || path.startsWith("/api/auth/")
        || path.startsWith(PUBLIC_TENANT_PREFIX));
  }

  private String resolveRawTenant(HttpServletRequest request) {
    String path = request.getRequestURI();
    if (path.startsWith(PUBLIC_TENANT_PREFIX)) {
      String rest = path.substring(PUBLIC_TENANT_PREFIX.length());
      int slash = rest.indexOf('/');
      return tenantResolver.resolve(slash >= 0 ? rest.substring(0, slash) : rest);
    }
    return tenantResolver.resolve(request);
  }
}
