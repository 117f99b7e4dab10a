package com.codeheadsystems.courier.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates stateless session tokens.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256. The payload carries exactly three claims:
 * {@code email}, {@code password} (the user's bcrypt hash at issuance, used as a credential
 * fingerprint) and {@code exp}. Nothing is stored server-side: a token is valid when its
 * signature verifies against the {@link SigningSecret} and {@code exp} is in the future.
 * <p>
 * The signature is always checked before any claim is read.
 */
public class TokenService {

  /**
   * Default token lifetime.
   */
  public static final Duration DEFAULT_TTL = Duration.ofHours(24);

  static final String EMAIL_CLAIM = "email";
  static final String PASSWORD_CLAIM = "password";

  private static final Logger log = LoggerFactory.getLogger(TokenService.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final Duration ttl;
  private final Clock clock;

  public TokenService(SigningSecret secret) {
    this(secret, DEFAULT_TTL, Clock.systemUTC());
  }

  /**
   * Instantiates a new Token service.
   *
   * @param secret signing secret
   * @param ttl    lifetime of issued tokens
   * @param clock  clock used for issuance and expiry checks
   */
  public TokenService(SigningSecret secret, Duration ttl, Clock clock) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Token lifetime must be positive");
    }
    this.algorithm = Algorithm.HMAC256(secret.bytes());
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withClaimPresence(EMAIL_CLAIM)
        .withClaimPresence(PASSWORD_CLAIM)
        .withClaimPresence(RegisteredClaims.EXPIRES_AT))
        .build(clock);
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Issues a token for the user with the configured lifetime.
   *
   * @param email        the user's email
   * @param passwordHash the user's current password hash
   * @return signed token string
   */
  public String issue(String email, String passwordHash) {
    return issue(email, passwordHash, ttl);
  }

  /**
   * Issues a token for the user with an explicit lifetime.
   *
   * @param email        the user's email
   * @param passwordHash the user's current password hash
   * @param lifetime     how long the token stays valid
   * @return signed token string
   */
  public String issue(String email, String passwordHash, Duration lifetime) {
    Instant expiresAt = clock.instant().plus(lifetime);
    String token = JWT.create()
        .withClaim(EMAIL_CLAIM, email)
        .withClaim(PASSWORD_CLAIM, passwordHash)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued token for {} expiring at {}", email, expiresAt);
    return token;
  }

  /**
   * Validated payload of a token.
   *
   * @param email                   the identity the token was issued to
   * @param passwordHashFingerprint the password hash at issuance
   * @param expiresAt               expiry instant
   */
  public record TokenClaims(String email, String passwordHashFingerprint, Instant expiresAt) {

    @Override
    public String toString() {
      return "TokenClaims[email=" + email + ", expiresAt=" + expiresAt + "]";
    }
  }

  /**
   * Validates a token.
   *
   * @param token the token string
   * @return the claims if the signature verifies and the token has not expired, empty otherwise
   */
  public Optional<TokenClaims> validate(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String email = decoded.getClaim(EMAIL_CLAIM).asString();
      String fingerprint = decoded.getClaim(PASSWORD_CLAIM).asString();
      if (email == null || fingerprint == null) {
        log.debug("Token claims are not strings");
        return Optional.empty();
      }
      return Optional.of(new TokenClaims(email, fingerprint, decoded.getExpiresAtAsInstant()));
    } catch (JWTVerificationException e) {
      log.debug("Token validation failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Duration ttl() {
    return ttl;
  }
}
