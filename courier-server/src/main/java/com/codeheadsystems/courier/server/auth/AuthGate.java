package com.codeheadsystems.courier.server.auth;

import com.codeheadsystems.courier.server.auth.AuthDecision.DenialReason;
import com.codeheadsystems.courier.server.auth.TokenService.TokenClaims;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a session token authorizes an operation on a given account.
 * <p>
 * Every token-gated operation goes through {@link #authorize}; handlers never decode tokens
 * themselves. The checks run in order:
 * <ol>
 *   <li>the token must validate (signature, then expiry), otherwise {@code bad token};</li>
 *   <li>the token's email must equal the account being acted on, otherwise
 *       {@code identity mismatch};</li>
 *   <li>the token's password fingerprint must equal the account's current password hash,
 *       otherwise {@code stale credential}. Changing a password therefore revokes every token
 *       issued before the change.</li>
 * </ol>
 */
public class AuthGate {

  private static final Logger log = LoggerFactory.getLogger(AuthGate.class);

  private final TokenService tokenService;

  public AuthGate(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  /**
   * Authorizes a request.
   *
   * @param claimedEmail        the account the request acts on
   * @param token               the presented session token
   * @param currentPasswordHash the account's password hash as stored right now
   * @return the decision
   */
  public AuthDecision authorize(String claimedEmail, String token, String currentPasswordHash) {
    Optional<TokenClaims> validated = tokenService.validate(token);
    if (validated.isEmpty()) {
      return deny(claimedEmail, DenialReason.BAD_TOKEN);
    }
    TokenClaims claims = validated.get();
    if (!claims.email().equals(claimedEmail)) {
      return deny(claimedEmail, DenialReason.IDENTITY_MISMATCH);
    }
    if (!constantTimeEquals(claims.passwordHashFingerprint(), currentPasswordHash)) {
      return deny(claimedEmail, DenialReason.STALE_CREDENTIAL);
    }
    return AuthDecision.allow();
  }

  private static AuthDecision deny(String claimedEmail, DenialReason reason) {
    log.debug("Denied token for {}: {}", claimedEmail, reason.description());
    return AuthDecision.denied(reason);
  }

  private static boolean constantTimeEquals(String a, String b) {
    if (a == null || b == null) {
      return false;
    }
    return MessageDigest.isEqual(
        a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }
}
