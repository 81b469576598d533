package io.b2mash.lms.multitenancy;

/** Opens the pool for a tenant database. Called at most once per registry cache miss. */
public interface TenantDataSourceFactory {

  TenantDataSource open(String tenantId, String databaseName);
}
