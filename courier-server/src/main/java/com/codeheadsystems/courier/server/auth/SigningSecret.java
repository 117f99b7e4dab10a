package com.codeheadsystems.courier.server.auth;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Immutable HMAC-SHA256 key used to sign and verify session tokens.
 * <p>
 * Built once from configuration at start-up and handed to {@link TokenService}. Replacing it
 * invalidates every outstanding token.
 */
public final class SigningSecret {

  /**
   * Minimum key length in bytes (the HMAC-SHA256 block output size).
   */
  public static final int MIN_LENGTH_BYTES = 32;

  private final byte[] key;

  private SigningSecret(byte[] key) {
    if (key == null || key.length < MIN_LENGTH_BYTES) {
      throw new IllegalArgumentException(
          "Signing secret must be at least " + MIN_LENGTH_BYTES + " bytes");
    }
    this.key = key.clone();
  }

  public static SigningSecret of(byte[] key) {
    return new SigningSecret(key);
  }

  /**
   * Parses a hex-encoded secret, e.g. the output of {@code openssl rand -hex 32}.
   *
   * @param hex the hex string
   * @return the signing secret
   * @throws IllegalArgumentException if the value is not hex or too short
   */
  public static SigningSecret fromHex(String hex) {
    return new SigningSecret(HexFormat.of().parseHex(hex));
  }

  /**
   * Generates a random secret. Tokens signed with it do not survive a restart.
   *
   * @param secureRandom the random source
   * @return the signing secret
   */
  public static SigningSecret random(SecureRandom secureRandom) {
    byte[] key = new byte[MIN_LENGTH_BYTES];
    secureRandom.nextBytes(key);
    return new SigningSecret(key);
  }

  byte[] bytes() {
    return key.clone();
  }

  @Override
  public String toString() {
    return "SigningSecret[***]";
  }
}
