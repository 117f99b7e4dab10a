package com.codeheadsystems.courier.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.courier.server.auth.TokenService.TokenClaims;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final String EMAIL = "a@x.com";
  private static final String HASH = "$2b$04$abcdefghijklmnopqrstuu5MZPBaWXNL8hbfcMzeXhDcHDXMCHUm";

  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    tokenService = new TokenService(SigningSecret.of(SECRET), TokenService.DEFAULT_TTL, clockAt(NOW));
  }

  @Test
  void issueAndValidate_roundTrip() {
    String token = tokenService.issue(EMAIL, HASH);

    Optional<TokenClaims> claims = tokenService.validate(token);

    assertThat(claims).isPresent();
    assertThat(claims.get().email()).isEqualTo(EMAIL);
    assertThat(claims.get().passwordHashFingerprint()).isEqualTo(HASH);
    assertThat(claims.get().expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
  }

  @Test
  void issue_payloadHasExactlyEmailPasswordAndExp() {
    DecodedJWT decoded = JWT.decode(tokenService.issue(EMAIL, HASH));

    assertThat(decoded.getAlgorithm()).isEqualTo("HS256");
    assertThat(decoded.getClaims()).containsOnlyKeys("email", "password", "exp");
    assertThat(decoded.getClaim("password").asString()).isEqualTo(HASH);
    assertThat(decoded.getExpiresAtAsInstant()).isEqualTo(NOW.plus(Duration.ofHours(24)));
  }

  @Test
  void issue_isDeterministicForSameInputsAndClock() {
    assertThat(tokenService.issue(EMAIL, HASH)).isEqualTo(tokenService.issue(EMAIL, HASH));
  }

  @Test
  void validate_afterExpiry_returnsEmpty() {
    String token = tokenService.issue(EMAIL, HASH);
    TokenService later = new TokenService(SigningSecret.of(SECRET), TokenService.DEFAULT_TTL,
        clockAt(NOW.plus(Duration.ofHours(24)).plusSeconds(1)));
    TokenService justBefore = new TokenService(SigningSecret.of(SECRET), TokenService.DEFAULT_TTL,
        clockAt(NOW.plus(Duration.ofHours(23))));

    assertThat(justBefore.validate(token)).isPresent();
    assertThat(later.validate(token)).isEmpty();
  }

  @Test
  void issue_withExplicitLifetime() {
    String token = tokenService.issue(EMAIL, HASH, Duration.ofMinutes(5));
    TokenService later = new TokenService(SigningSecret.of(SECRET), TokenService.DEFAULT_TTL,
        clockAt(NOW.plus(Duration.ofMinutes(6))));

    assertThat(tokenService.validate(token)).isPresent();
    assertThat(later.validate(token)).isEmpty();
  }

  @Test
  void validate_wrongSecret_returnsEmpty() {
    String token = tokenService.issue(EMAIL, HASH);
    TokenService other = new TokenService(SigningSecret.of(WRONG_SECRET), TokenService.DEFAULT_TTL,
        clockAt(NOW));

    assertThat(other.validate(token)).isEmpty();
  }

  @Test
  void validate_tamperedSignature_returnsEmpty() {
    String token = tokenService.issue(EMAIL, HASH);
    int signatureStart = token.lastIndexOf('.') + 1;
    char replacement = token.charAt(signatureStart) == 'A' ? 'B' : 'A';
    String tampered = token.substring(0, signatureStart) + replacement
        + token.substring(signatureStart + 1);

    assertThat(tokenService.validate(tampered)).isEmpty();
  }

  @Test
  void validate_tamperedPayload_returnsEmpty() {
    String[] parts = tokenService.issue(EMAIL, HASH).split("\\.");
    String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
        ("{\"email\":\"mallory@x.com\",\"password\":\"" + HASH + "\",\"exp\":4102444800}")
            .getBytes(StandardCharsets.UTF_8));

    assertThat(tokenService.validate(parts[0] + "." + forgedPayload + "." + parts[2])).isEmpty();
  }

  @Test
  void validate_malformedOrTruncated_returnsEmpty() {
    String token = tokenService.issue(EMAIL, HASH);

    assertThat(tokenService.validate("garbage-token")).isEmpty();
    assertThat(tokenService.validate(token.substring(0, token.lastIndexOf('.')))).isEmpty();
    assertThat(tokenService.validate(token.substring(0, token.length() / 2))).isEmpty();
    assertThat(tokenService.validate("")).isEmpty();
    assertThat(tokenService.validate(null)).isEmpty();
  }

  @Test
  void validate_missingPasswordClaim_returnsEmpty() {
    String token = JWT.create()
        .withClaim("email", EMAIL)
        .withExpiresAt(NOW.plusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenService.validate(token)).isEmpty();
  }

  @Test
  void validate_missingExpiry_returnsEmpty() {
    String token = JWT.create()
        .withClaim("email", EMAIL)
        .withClaim("password", HASH)
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenService.validate(token)).isEmpty();
  }

  @Test
  void validate_nonStringEmailClaim_returnsEmpty() {
    String token = JWT.create()
        .withClaim("email", 42)
        .withClaim("password", HASH)
        .withExpiresAt(NOW.plusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenService.validate(token)).isEmpty();
  }

  @Test
  void validate_unsignedToken_returnsEmpty() {
    String token = JWT.create()
        .withClaim("email", EMAIL)
        .withClaim("password", HASH)
        .withExpiresAt(NOW.plusSeconds(3600))
        .sign(Algorithm.none());

    assertThat(tokenService.validate(token)).isEmpty();
  }

  @Test
  void constructor_nonPositiveLifetime_throwsIAE() {
    assertThatThrownBy(() -> new TokenService(SigningSecret.of(SECRET), Duration.ZERO, clockAt(NOW)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void claimsToString_omitsFingerprint() {
    TokenClaims claims = new TokenClaims(EMAIL, HASH, NOW);

    assertThat(claims.toString()).contains(EMAIL).doesNotContain(HASH);
  }

  private static Clock clockAt(Instant instant) {
    return Clock.fixed(instant, ZoneOffset.UTC);
  }
}
