package io.b2mash.lms.security;

import io.b2mash.lms.multitenancy.TenantFilter;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Request pipeline: tenant resolution, then bearer authentication, then route rules. Role checks
 * happen per endpoint through {@link RoleBasedAuthorizer}.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final TenantFilter tenantFilter;
  private final JwtAuthenticationFilter jwtAuthenticationFilter;
  private final AuthFailureEntryPoint authFailureEntryPoint;
  private final SecurityProperties securityProperties;

  public SecurityConfig(
      TenantFilter tenantFilter,
      JwtAuthenticationFilter jwtAuthenticationFilter,
      AuthFailureEntryPoint authFailureEntryPoint,
      SecurityProperties securityProperties) {
    this.tenantFilter = tenantFilter;
    this.jwtAuthenticationFilter = jwtAuthenticationFilter;
    this.authFailureEntryPoint = authFailureEntryPoint;
    this.securityProperties = securityProperties;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/api/auth/**")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/api/public/tenants/**")
                    .permitAll()
                    .requestMatchers("/api/tenant/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authFailureEntryPoint))
        .addFilterBefore(tenantFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(jwtAuthenticationFilter, TenantFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    var config = new CorsConfiguration();
    if (!securityProperties.allowedOrigins().isEmpty()) {
      config.setAllowedOrigins(securityProperties.allowedOrigins());
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
