package com.codeheadsystems.courier.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-way hashing and verification of user passwords using bcrypt.
 * <p>
 * Each call to {@link #hash(String)} draws a fresh 16-byte salt, so hashing the same
 * plaintext twice yields two different strings that both verify. The output is the standard
 * modular-crypt form ({@code $2b$<cost>$<salt+digest>}) and can be read by any bcrypt
 * implementation.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class PasswordVault {

  /**
   * Default bcrypt cost factor (2^12 rounds).
   */
  public static final int DEFAULT_COST = 12;

  /**
   * bcrypt only reads the first 72 bytes of a password.
   */
  public static final int MAX_PASSWORD_BYTES = 72;

  private static final Logger log = LoggerFactory.getLogger(PasswordVault.class);
  private static final String BCRYPT_VERSION = "2b";
  private static final int SALT_LENGTH = 16;
  private static final int MIN_COST = 4;
  private static final int MAX_COST = 31;
  // "$2b$" + two-digit cost + "$" + 53 characters of salt and digest.
  private static final int HASH_LENGTH = 60;
  private static final String HASH_PREFIX = "$2";

  private final SecureRandom secureRandom;
  private final int cost;

  public PasswordVault() {
    this(new SecureRandom(), DEFAULT_COST);
  }

  /**
   * Instantiates a new Password vault.
   *
   * @param secureRandom source of salts
   * @param cost         bcrypt cost factor, 4 to 31
   */
  public PasswordVault(SecureRandom secureRandom, int cost) {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("bcrypt cost must be between " + MIN_COST + " and " + MAX_COST
          + ", got " + cost);
    }
    this.secureRandom = secureRandom;
    this.cost = cost;
  }

  /**
   * Hashes a plaintext password with a fresh random salt.
   *
   * @param plaintext the password
   * @return the bcrypt hash string
   * @throws IllegalArgumentException if the password is null or longer than {@value #MAX_PASSWORD_BYTES}
   *                                  UTF-8 bytes
   */
  public String hash(String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Password must not be null");
    }
    if (utf8Length(plaintext) > MAX_PASSWORD_BYTES) {
      throw new IllegalArgumentException("Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
    }
    byte[] salt = new byte[SALT_LENGTH];
    secureRandom.nextBytes(salt);
    return OpenBSDBCrypt.generate(BCRYPT_VERSION, plaintext.toCharArray(), salt, cost);
  }

  /**
   * Checks a plaintext password against a stored hash. The comparison is constant-time.
   * A null or malformed hash is a non-match.
   *
   * @param plaintext    the candidate password
   * @param passwordHash the stored bcrypt hash
   * @return true if the password matches
   */
  public boolean verify(String plaintext, String passwordHash) {
    if (plaintext == null || utf8Length(plaintext) > MAX_PASSWORD_BYTES || !isWellFormed(passwordHash)) {
      return false;
    }
    try {
      return OpenBSDBCrypt.checkPassword(passwordHash, plaintext.toCharArray());
    } catch (IllegalArgumentException | DataLengthException | IndexOutOfBoundsException e) {
      log.debug("Rejecting malformed password hash: {}", e.getMessage());
      return false;
    }
  }

  public int cost() {
    return cost;
  }

  private static boolean isWellFormed(String passwordHash) {
    return passwordHash != null
        && passwordHash.length() == HASH_LENGTH
        && passwordHash.startsWith(HASH_PREFIX);
  }

  private static int utf8Length(String s) {
    return s.getBytes(StandardCharsets.UTF_8).length;
  }
}
