package io.b2mash.lms.security;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("lms.jwt")
public record JwtProperties(
    String accessSecret,
    String refreshSecret,
    Duration accessTtl,
    Duration refreshTtl,
    String issuer) {

  public JwtProperties {
    if (accessTtl == null) {
      accessTtl = Duration.ofDays(1);
    }
    if (refreshTtl == null) {
      refreshTtl = Duration.ofDays(7);
    }
    if (issuer == null || issuer.isBlank()) {
      issuer = "lms-backend";
    }
  }
}
