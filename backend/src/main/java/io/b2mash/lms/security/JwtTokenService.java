package io.b2mash.lms.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access/refresh token pairs. The two token types are signed with
 * different secrets and carry a {@code tokenType} claim, so neither can stand in for the other.
 */
@Service
public class JwtTokenService {

  private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_TENANT = "tenantId";
  static final String CLAIM_ROLES = "roles";
  static final String CLAIM_NAME = "name";
  static final String CLAIM_PERMISSIONS = "permissions";
  static final String CLAIM_TOKEN_TYPE = "tokenType";

  private final JWSSigner accessSigner;
  private final JWSSigner refreshSigner;
  private final JWSVerifier accessVerifier;
  private final JWSVerifier refreshVerifier;
  private final Duration accessTtl;
  private final Duration refreshTtl;
  private final String issuer;
  private final Clock clock;

  @Autowired
  public JwtTokenService(JwtProperties properties) {
    this(properties, Clock.systemUTC());
  }

  JwtTokenService(JwtProperties properties, Clock clock) {
    byte[] accessSecret = requireSecret(properties.accessSecret(), "lms.jwt.access-secret");
    byte[] refreshSecret = requireSecret(properties.refreshSecret(), "lms.jwt.refresh-secret");
    if (Arrays.equals(accessSecret, refreshSecret)) {
      throw new IllegalStateException("Access and refresh token secrets must differ");
    }
    try {
      this.accessSigner = new MACSigner(accessSecret);
      this.refreshSigner = new MACSigner(refreshSecret);
      this.accessVerifier = new MACVerifier(accessSecret);
      this.refreshVerifier = new MACVerifier(refreshSecret);
    } catch (JOSEException e) {
      throw new IllegalStateException("Token secrets must be at least 256 bits", e);
    }
    this.accessTtl = properties.accessTtl();
    this.refreshTtl = properties.refreshTtl();
    this.issuer = properties.issuer();
    this.clock = clock;
  }

  public TokenPair issuePair(AuthenticatedUser identity) {
    String accessToken = sign(identity, TokenType.ACCESS, accessTtl, accessSigner);
    String refreshToken = sign(identity, TokenType.REFRESH, refreshTtl, refreshSigner);
    log.debug("Issued token pair for user {} in tenant {}", identity.userId(), identity.tenantId());
    return new TokenPair(
        accessToken, refreshToken, accessTtl.toSeconds(), refreshTtl.toSeconds());
  }

  /**
   * Verifies signature, expiry and token type.
   *
   * @throws InvalidTokenException for every kind of failure
   */
  public TokenClaims verify(String token, TokenType expectedType) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = expectedType == TokenType.ACCESS ? accessVerifier : refreshVerifier;

      if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())) {
        throw reject("unexpected algorithm " + signedJwt.getHeader().getAlgorithm());
      }
      if (!signedJwt.verify(verifier)) {
        throw reject("signature mismatch");
      }

      var claims = signedJwt.getJWTClaimsSet();
      Date expiration = claims.getExpirationTime();
      if (expiration == null || !expiration.toInstant().isAfter(clock.instant())) {
        throw reject("expired");
      }
      if (!expectedType.claimValue().equals(claims.getStringClaim(CLAIM_TOKEN_TYPE))) {
        throw reject("token type is not " + expectedType.claimValue());
      }
      if (claims.getSubject() == null) {
        throw reject("missing subject");
      }

      List<String> roles = claims.getStringListClaim(CLAIM_ROLES);
      List<String> permissions = claims.getStringListClaim(CLAIM_PERMISSIONS);
      return new TokenClaims(
          claims.getSubject(),
          claims.getStringClaim(CLAIM_EMAIL),
          claims.getStringClaim(CLAIM_TENANT),
          roles != null ? roles : List.of(),
          claims.getStringClaim(CLAIM_NAME),
          permissions != null ? permissions : List.of(),
          expectedType,
          claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null,
          expiration.toInstant());
    } catch (ParseException | JOSEException e) {
      throw reject("malformed token: " + e.getMessage());
    }
  }

  private String sign(
      AuthenticatedUser identity, TokenType type, Duration ttl, JWSSigner signer) {
    Instant now = clock.instant();
    var builder =
        new JWTClaimsSet.Builder()
            .jwtID(UUID.randomUUID().toString())
            .issuer(issuer)
            .subject(identity.userId().toString())
            .claim(CLAIM_EMAIL, identity.email())
            .claim(CLAIM_TENANT, identity.tenantId())
            .claim(CLAIM_ROLES, Role.wireNames(identity.roles()))
            .claim(CLAIM_TOKEN_TYPE, type.claimValue())
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(ttl)));
    if (identity.name() != null) {
      builder.claim(CLAIM_NAME, identity.name());
    }
    if (!identity.permissions().isEmpty()) {
      builder.claim(CLAIM_PERMISSIONS, identity.permissions());
    }

    try {
      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), builder.build());
      signedJwt.sign(signer);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign " + type.claimValue() + " token", e);
    }
  }

  private static InvalidTokenException reject(String reason) {
    log.debug("Token rejected: {}", reason);
    return new InvalidTokenException();
  }

  private static byte[] requireSecret(String secret, String property) {
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException(property + " must be configured");
    }
    return secret.getBytes(StandardCharsets.UTF_8);
  }
}
