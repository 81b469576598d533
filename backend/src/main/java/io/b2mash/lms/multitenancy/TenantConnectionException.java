package io.b2mash.lms.multitenancy;

public class TenantConnectionException extends RuntimeException {

  public TenantConnectionException(String tenantId, Throwable cause) {
    super("Unable to open data source for tenant " + tenantId, cause);
  }
}
