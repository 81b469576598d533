package io.b2mash.lms.multitenancy;

import io.b2mash.lms.exception.InvalidStateException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates tenant identifiers supplied by callers and derives their sanitized form. The sanitized
 * form (lower-case, hyphens replaced by underscores) is the only form used for cache keys, database
 * names and tenant comparisons.
 */
@Component
public class TenantResolver {

  public static final String TENANT_HEADER = "x-tenant-id";

  private static final Pattern TENANT_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

  /** Returns the raw tenant id from the {@code x-tenant-id} header, first value if repeated. */
  public String resolve(HttpServletRequest request) {
    return validate(request.getHeader(TENANT_HEADER), "Missing x-tenant-id header");
  }

  /** Validates a tenant id taken from somewhere other than the header, e.g. a path segment. */
  public String resolve(String rawTenantId) {
    return validate(rawTenantId, "Missing tenant identifier");
  }

  public static boolean isValid(String rawTenantId) {
    return rawTenantId != null && TENANT_PATTERN.matcher(rawTenantId).matches();
  }

  public static String sanitize(String tenantId) {
    return tenantId.replace('-', '_').toLowerCase(Locale.ROOT);
  }

  /** Compares two tenant ids after sanitizing both; null never matches. */
  public static boolean sameTenant(String left, String right) {
    if (left == null || right == null) {
      return false;
    }
    return sanitize(left).equals(sanitize(right));
  }

  private String validate(String rawTenantId, String missingMessage) {
    if (rawTenantId == null || rawTenantId.isBlank()) {
      throw new InvalidStateException("Missing tenant", missingMessage);
    }
    if (!TENANT_PATTERN.matcher(rawTenantId).matches()) {
      throw new InvalidStateException("Invalid tenant", "Invalid tenant identifier");
    }
    return rawTenantId;
  }
}
