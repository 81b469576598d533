package io.b2mash.lms.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.hibernate.engine.jdbc.connections.spi.MultiTenantConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Hands Hibernate a connection from the tenant's own database. The directory database only serves
 * tenant-less metadata requests made while Hibernate boots.
 */
@Component
public class TenantConnectionProvider implements MultiTenantConnectionProvider<String> {

  private static final Logger log = LoggerFactory.getLogger(TenantConnectionProvider.class);

  private final DataSource directoryDataSource;
  private final TenantDataSourceRegistry registry;

  public TenantConnectionProvider(
      @Qualifier("directoryDataSource") DataSource directoryDataSource,
      TenantDataSourceRegistry registry) {
    this.directoryDataSource = directoryDataSource;
    this.registry = registry;
  }

  @Override
  public Connection getAnyConnection() throws SQLException {
    return directoryDataSource.getConnection();
  }

  @Override
  public void releaseAnyConnection(Connection connection) throws SQLException {
    connection.close();
  }

  @Override
  public Connection getConnection(String tenantIdentifier) throws SQLException {
    if (TenantContext.NO_TENANT.equals(tenantIdentifier)) {
      return getAnyConnection();
    }
    TenantDataSource tenantDataSource = registry.get(tenantIdentifier);
    try {
      return tenantDataSource.dataSource().getConnection();
    } catch (SQLException e) {
      log.warn("Connection error for tenant {}: {}", tenantIdentifier, e.getMessage());
      registry.reportFailure(tenantIdentifier, tenantDataSource);
      throw e;
    }
  }

  @Override
  public void releaseConnection(String tenantIdentifier, Connection connection)
      throws SQLException {
    connection.close();
  }

  @Override
  public boolean supportsAggressiveRelease() {
    return false;
  }

  @Override
  public boolean isUnwrappableAs(Class<?> unwrapType) {
    return MultiTenantConnectionProvider.class.isAssignableFrom(unwrapType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T unwrap(Class<T> unwrapType) {
    if (isUnwrappableAs(unwrapType)) {
      return (T) this;
    }
    throw new IllegalArgumentException("Cannot unwrap to " + unwrapType);
  }
}
