package io.b2mash.lms.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.multitenancy.TenantResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class JwtAuthenticationFilterTest {

  private JwtTokenService tokenService;
  private JwtAuthenticationFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private final AtomicReference<Authentication> authInChain = new AtomicReference<>();
  private boolean filterChainCalled;

  private final FilterChain filterChain =
      (req, res) -> {
        filterChainCalled = true;
        authInChain.set(SecurityContextHolder.getContext().getAuthentication());
      };

  @BeforeEach
  void setUp() {
    tokenService = new JwtTokenService(JwtTokenServiceTest.properties());
    filter = new JwtAuthenticationFilter(tokenService, new TenantResolver());
    request = new MockHttpServletRequest("GET", "/api/tenant/courses");
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    SecurityContextHolder.clearContext();
    TenantContext.setTenantId("t2");
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
    TenantContext.clear();
  }

  @Test
  void validToken_setsAuthenticatedUser() throws ServletException, IOException {
    var userId = UUID.randomUUID();
    request.addHeader("Authorization", "Bearer " + accessToken(userId, "T2", Role.INSTRUCTOR));

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    assertThat(authInChain.get().getPrincipal()).isInstanceOf(AuthenticatedUser.class);
    var user = (AuthenticatedUser) authInChain.get().getPrincipal();
    assertThat(user.userId()).isEqualTo(userId);
    assertThat(user.tenantId()).isEqualTo("t2");
    assertThat(user.roles()).containsExactly(Role.INSTRUCTOR);
    assertThat(authInChain.get().getAuthorities())
        .extracting("authority")
        .containsExactly("ROLE_INSTRUCTOR");
  }

  @Test
  void missingHeader_returns401() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void wrongScheme_returns401() throws ServletException, IOException {
    request.addHeader("Authorization", "Basic dXNlcjpwYXNz");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void refreshTokenAsBearer_returns401() throws ServletException, IOException {
    var pair = tokenService.issuePair(identity(UUID.randomUUID(), "t2", Role.STUDENT));
    request.addHeader("Authorization", "Bearer " + pair.refreshToken());

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void tokenForOtherTenant_returns403() throws ServletException, IOException {
    request.addHeader("Authorization", "Bearer " + accessToken(UUID.randomUUID(), "t1", Role.TENANT_ADMIN));

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(403);
  }

  @Test
  void invalidTokenIsRejectedBeforeTenantComparison() throws ServletException, IOException {
    var foreign =
        new JwtTokenService(
            new JwtProperties(
                "some-other-access-secret-at-least-32-bytes",
                "some-other-refresh-secret-at-least-32-bytes",
                null,
                null,
                null));
    String token =
        foreign.issuePair(identity(UUID.randomUUID(), "t1", Role.STUDENT)).accessToken();
    request.addHeader("Authorization", "Bearer " + token);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void shouldNotFilter_authRoutes() {
    request.setRequestURI("/api/auth/login");

    assertThat(filter.shouldNotFilter(request)).isTrue();
  }

  private String accessToken(UUID userId, String tenantId, Role role) {
    return tokenService.issuePair(identity(userId, tenantId, role)).accessToken();
  }

  private static AuthenticatedUser identity(UUID userId, String tenantId, Role role) {
    return new AuthenticatedUser(userId, "user@x.com", tenantId, List.of(role), null, List.of());
  }
}
