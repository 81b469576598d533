package io.b2mash.lms.security;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("lms.security")
public record SecurityProperties(Integer bcryptRounds, List<String> allowedOrigins) {

  public SecurityProperties {
    if (bcryptRounds == null) {
      bcryptRounds = 10;
    }
    if (allowedOrigins == null) {
      allowedOrigins = List.of();
    }
  }
}
