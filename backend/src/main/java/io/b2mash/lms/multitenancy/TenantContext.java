package io.b2mash.lms.multitenancy;

/** Holds the sanitized tenant id bound to the current request thread by {@link TenantFilter}. */
public final class TenantContext {

  /**
   * Hibernate identifier used when no tenant is bound. The {@code #} keeps it outside the set of
   * valid tenant ids, so no request can be routed to it.
   */
  public static final String NO_TENANT = "#none";

  private static final ThreadLocal<String> CURRENT_TENANT = new ThreadLocal<>();

  private TenantContext() {}

  public static void setTenantId(String tenantId) {
    CURRENT_TENANT.set(tenantId);
  }

  public static String getTenantId() {
    return CURRENT_TENANT.get();
  }

  public static String requireTenantId() {
    String tenantId = CURRENT_TENANT.get();
    if (tenantId == null) {
      throw new RequestContextNotBoundException("tenant");
    }
    return tenantId;
  }

  public static void clear() {
    CURRENT_TENANT.remove();
  }
}
