package com.codeheadsystems.courier.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.courier.server.auth.TokenService;
import java.util.Optional;

/**
 * Health check that issues a short-lived token for a probe identity and validates it again.
 * Fails if signing or verification is broken, for example after a bad secret rotation.
 */
public class TokenServiceHealthCheck extends HealthCheck {

  static final String PROBE_EMAIL = "healthcheck@courier.invalid";
  private static final String PROBE_FINGERPRINT = "healthcheck";

  private final TokenService tokenService;

  /**
   * Instantiates a new Token service health check.
   *
   * @param tokenService the token service
   */
  public TokenServiceHealthCheck(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @Override
  protected Result check() {
    String token = tokenService.issue(PROBE_EMAIL, PROBE_FINGERPRINT);
    Optional<TokenService.TokenClaims> claims = tokenService.validate(token);
    if (claims.isEmpty()) {
      return Result.unhealthy("Freshly issued token failed validation");
    }
    if (!PROBE_EMAIL.equals(claims.get().email())) {
      return Result.unhealthy("Validated token carries the wrong identity");
    }
    return Result.healthy("token ttl=%s", tokenService.ttl());
  }
}
