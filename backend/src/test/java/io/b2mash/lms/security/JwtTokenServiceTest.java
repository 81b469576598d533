package io.b2mash.lms.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

  static final String ACCESS_SECRET = "access-secret-that-is-at-least-32-bytes-long";
  static final String REFRESH_SECRET = "refresh-secret-that-is-at-least-32-bytes-long";

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private JwtTokenService tokenService;
  private AuthenticatedUser identity;

  @BeforeEach
  void setUp() {
    tokenService = new JwtTokenService(properties(), Clock.fixed(NOW, ZoneOffset.UTC));
    identity =
        new AuthenticatedUser(
            UUID.randomUUID(),
            "ada@acme.test",
            "acme",
            List.of(Role.INSTRUCTOR, Role.STUDENT),
            "Ada Lovelace",
            List.of("courses:write"));
  }

  @Test
  void issuePair_accessTokenRoundTrips() {
    var pair = tokenService.issuePair(identity);

    var claims = tokenService.verify(pair.accessToken(), TokenType.ACCESS);

    assertThat(claims.subject()).isEqualTo(identity.userId().toString());
    assertThat(claims.tenantId()).isEqualTo("acme");
    assertThat(claims.roles()).containsExactly("instructor", "student");
    assertThat(claims.email()).isEqualTo("ada@acme.test");
    assertThat(claims.name()).isEqualTo("Ada Lovelace");
    assertThat(claims.permissions()).containsExactly("courses:write");
    assertThat(claims.tokenType()).isEqualTo(TokenType.ACCESS);
    assertThat(claims.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
  }

  @Test
  void issuePair_reportsExpiriesInSeconds() {
    var pair = tokenService.issuePair(identity);

    assertThat(pair.expiresIn()).isEqualTo(3600);
    assertThat(pair.refreshExpiresIn()).isEqualTo(Duration.ofDays(7).toSeconds());
  }

  @Test
  void refreshTokenVerifiesOnlyAsRefresh() {
    var pair = tokenService.issuePair(identity);

    assertThat(tokenService.verify(pair.refreshToken(), TokenType.REFRESH).subject())
        .isEqualTo(identity.userId().toString());
    assertThatThrownBy(() -> tokenService.verify(pair.refreshToken(), TokenType.ACCESS))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void accessTokenIsRejectedAsRefresh() {
    var pair = tokenService.issuePair(identity);

    assertThatThrownBy(() -> tokenService.verify(pair.accessToken(), TokenType.REFRESH))
        .isInstanceOf(InvalidTokenException.class)
        .hasMessage(InvalidTokenException.MESSAGE);
  }

  @Test
  void expiredTokenIsRejected() {
    var pair = tokenService.issuePair(identity);
    var later =
        new JwtTokenService(properties(), Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

    assertThatThrownBy(() -> later.verify(pair.accessToken(), TokenType.ACCESS))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void tamperedTokenIsRejected() {
    String token = tokenService.issuePair(identity).accessToken();
    String[] parts = token.split("\\.");
    String tampered = parts[0] + "." + parts[1] + "x." + parts[2];

    assertThatThrownBy(() -> tokenService.verify(tampered, TokenType.ACCESS))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void garbageIsRejected() {
    assertThatThrownBy(() -> tokenService.verify("not-a-jwt", TokenType.ACCESS))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void tokenSignedWithOtherSecretIsRejected() {
    var other =
        new JwtTokenService(
            new JwtProperties(
                "another-access-secret-of-sufficient-length!",
                REFRESH_SECRET,
                Duration.ofHours(1),
                null,
                null),
            Clock.fixed(NOW, ZoneOffset.UTC));
    String foreign = other.issuePair(identity).accessToken();

    assertThatThrownBy(() -> tokenService.verify(foreign, TokenType.ACCESS))
        .isInstanceOf(InvalidTokenException.class);
  }

  @Test
  void constructor_rejectsEqualSecrets() {
    var properties = new JwtProperties(ACCESS_SECRET, ACCESS_SECRET, null, null, null);

    assertThatThrownBy(() -> new JwtTokenService(properties))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void constructor_rejectsMissingSecret() {
    var properties = new JwtProperties(null, REFRESH_SECRET, null, null, null);

    assertThatThrownBy(() -> new JwtTokenService(properties))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void constructor_rejectsShortSecret() {
    var properties = new JwtProperties("too-short", REFRESH_SECRET, null, null, null);

    assertThatThrownBy(() -> new JwtTokenService(properties))
        .isInstanceOf(IllegalStateException.class);
  }

  static JwtProperties properties() {
    return new JwtProperties(ACCESS_SECRET, REFRESH_SECRET, Duration.ofHours(1), null, null);
  }
}
