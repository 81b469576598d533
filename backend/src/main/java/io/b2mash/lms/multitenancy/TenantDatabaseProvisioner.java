package io.b2mash.lms.multitenancy;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Creates tenant databases on first use and brings their schema up to date. */
@Component
public class TenantDatabaseProvisioner {

  private static final Logger log = LoggerFactory.getLogger(TenantDatabaseProvisioner.class);

  // Postgres SQLSTATE for duplicate_database
  private static final String DUPLICATE_DATABASE = "42P04";

  private final TenancyProperties properties;

  public TenantDatabaseProvisioner(TenancyProperties properties) {
    this.properties = properties;
  }

  public void ensureDatabase(String databaseName) {
    if (!TenantDatabaseNames.isSafe(databaseName)) {
      throw new IllegalArgumentException("Invalid tenant database name: " + databaseName);
    }
    try (Connection conn =
        DriverManager.getConnection(
            properties.baseUrl(), properties.username(), properties.password())) {
      if (databaseExists(conn, databaseName)) {
        return;
      }
      try (var stmt = conn.createStatement()) {
        stmt.execute("CREATE DATABASE \"" + databaseName + "\"");
        log.info("Created tenant database {}", databaseName);
      } catch (SQLException e) {
        if (!DUPLICATE_DATABASE.equals(e.getSQLState())) {
          throw e;
        }
        log.debug("Tenant database {} was created concurrently", databaseName);
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to provision tenant database " + databaseName, e);
    }
  }

  public void migrate(DataSource tenantDataSource, String databaseName) {
    var result =
        Flyway.configure()
            .dataSource(tenantDataSource)
            .locations("classpath:db/migration/tenant")
            .load()
            .migrate();
    log.info(
        "Migrated tenant database {}: {} migrations executed",
        databaseName,
        result.migrationsExecuted);
  }

  private boolean databaseExists(Connection conn, String databaseName) throws SQLException {
    try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
      stmt.setString(1, databaseName);
      try (var rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }
}
