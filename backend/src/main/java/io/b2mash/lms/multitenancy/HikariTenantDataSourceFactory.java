package io.b2mash.lms.multitenancy;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HikariTenantDataSourceFactory implements TenantDataSourceFactory {

  private static final Logger log = LoggerFactory.getLogger(HikariTenantDataSourceFactory.class);

  private final TenancyProperties properties;
  private final TenantDatabaseProvisioner provisioner;

  public HikariTenantDataSourceFactory(
      TenancyProperties properties, TenantDatabaseProvisioner provisioner) {
    this.properties = properties;
    this.provisioner = provisioner;
  }

  @Override
  public TenantDataSource open(String tenantId, String databaseName) {
    if (properties.autoProvision()) {
      provisioner.ensureDatabase(databaseName);
    }

    var config = new HikariConfig();
    config.setJdbcUrl(TenantDatabaseNames.jdbcUrl(properties.baseUrl(), databaseName));
    config.setUsername(properties.username());
    config.setPassword(properties.password());
    config.setMaximumPoolSize(properties.maximumPoolSize());
    config.setPoolName("tenant-" + tenantId);

    // Fails fast if the database is unreachable
    var dataSource = new HikariDataSource(config);
    try {
      if (properties.autoProvision()) {
        provisioner.migrate(dataSource, databaseName);
      }
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }

    log.info("Opened tenant pool: tenant={}, database={}", tenantId, databaseName);
    return new TenantDataSource(tenantId, databaseName, dataSource);
  }
}
