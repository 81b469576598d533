package io.b2mash.lms.multitenancy;

import java.net.URI;
import java.util.regex.Pattern;

/** Naming rules for tenant databases. Ops scripts rely on the {@code <prefix>_<tenant>} format. */
public final class TenantDatabaseNames {

  private static final Pattern DATABASE_NAME = Pattern.compile("^[a-z0-9_]{1,63}$");
  private static final String JDBC_PREFIX = "jdbc:";

  private TenantDatabaseNames() {}

  public static String databaseName(String prefix, String tenantId) {
    return prefix + "_" + TenantResolver.sanitize(tenantId);
  }

  public static boolean isSafe(String databaseName) {
    return DATABASE_NAME.matcher(databaseName).matches();
  }

  /** Replaces the database path of a JDBC URL, keeping host, port and query parameters. */
  public static String jdbcUrl(String baseUrl, String databaseName) {
    if (baseUrl == null || !baseUrl.startsWith(JDBC_PREFIX)) {
      throw new IllegalArgumentException("Not a JDBC URL: " + baseUrl);
    }
    URI uri = URI.create(baseUrl.substring(JDBC_PREFIX.length()));
    var url = new StringBuilder(JDBC_PREFIX);
    url.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
    url.append('/').append(databaseName);
    if (uri.getRawQuery() != null) {
      url.append('?').append(uri.getRawQuery());
    }
    return url.toString();
  }
}
