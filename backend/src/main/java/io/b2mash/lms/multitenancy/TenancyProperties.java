package io.b2mash.lms.multitenancy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings shared by every tenant database. Each tenant gets its own database on the
 * server named by {@code baseUrl}, called {@code <databasePrefix>_<sanitizedTenantId>}.
 */
@ConfigurationProperties("lms.tenancy")
public record TenancyProperties(
    String baseUrl,
    String username,
    String password,
    String databasePrefix,
    Integer maximumPoolSize,
    Boolean autoProvision) {

  public static final String DEFAULT_DATABASE_PREFIX = "tenant";

  public TenancyProperties {
    if (databasePrefix == null || databasePrefix.isBlank()) {
      databasePrefix = DEFAULT_DATABASE_PREFIX;
    }
    if (maximumPoolSize == null) {
      maximumPoolSize = 5;
    }
    if (autoProvision == null) {
      autoProvision = true;
    }
  }
}
