package io.b2mash.lms.multitenancy;

import com.zaxxer.hikari.HikariDataSource;

/** Live connection pool for one tenant database. Owned by {@link TenantDataSourceRegistry}. */
public record TenantDataSource(String tenantId, String databaseName, HikariDataSource dataSource)
    implements AutoCloseable {

  @Override
  public void close() {
    dataSource.close();
  }
}
