package io.b2mash.lms.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TenantDatabaseNamesTest {

  @Test
  void databaseName_usesPrefixAndSanitizedTenant() {
    assertThat(TenantDatabaseNames.databaseName("tenant", "Acme-Corp")).isEqualTo("tenant_acme_corp");
  }

  @Test
  void databaseName_sameForEquivalentTenantIds() {
    assertThat(TenantDatabaseNames.databaseName("tenant", "acme"))
        .isEqualTo(TenantDatabaseNames.databaseName("tenant", "ACME"));
  }

  @Test
  void isSafe_acceptsOnlyLowercaseIdentifiers() {
    assertThat(TenantDatabaseNames.isSafe("tenant_acme")).isTrue();
    assertThat(TenantDatabaseNames.isSafe("tenant\"; DROP")).isFalse();
    assertThat(TenantDatabaseNames.isSafe("x".repeat(64))).isFalse();
  }

  @Test
  void jdbcUrl_replacesDatabaseAndKeepsQuery() {
    String url =
        TenantDatabaseNames.jdbcUrl(
            "jdbc:postgresql://db.internal:5433/postgres?sslmode=require", "tenant_acme");

    assertThat(url).isEqualTo("jdbc:postgresql://db.internal:5433/tenant_acme?sslmode=require");
  }

  @Test
  void jdbcUrl_withoutPath() {
    assertThat(TenantDatabaseNames.jdbcUrl("jdbc:postgresql://localhost:5432", "tenant_a"))
        .isEqualTo("jdbc:postgresql://localhost:5432/tenant_a");
  }

  @Test
  void jdbcUrl_rejectsNonJdbcUrl() {
    assertThatThrownBy(() -> TenantDatabaseNames.jdbcUrl("postgres://localhost/x", "tenant_a"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
