package com.codeheadsystems.courier.server.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A registered account.
 * <p>
 * {@code email} is the unique key. {@code passwordHash} is the bcrypt modular-crypt string
 * (for example {@code $2b$12$...}); the plaintext password is never held here.
 *
 * @param email        unique account identifier
 * @param passwordHash bcrypt hash of the password
 * @param handle       display name
 * @param publicKey    opaque public key bytes for end-to-end messaging
 * @param bio          optional bio, may be null
 */
public record User(String email, String passwordHash, String handle, byte[] publicKey, String bio) {

  public User {
    publicKey = publicKey == null ? null : publicKey.clone();
  }

  /**
   * A copy of the public key bytes, or null.
   *
   * @return the public key
   */
  @Override
  public byte[] publicKey() {
    return publicKey == null ? null : publicKey.clone();
  }

  /**
   * Returns a copy of this user with every non-null field of {@code update} applied.
   *
   * @param update the fields to change
   * @return the merged user
   */
  public User merge(UserUpdate update) {
    return new User(
        email,
        update.passwordHash() != null ? update.passwordHash() : passwordHash,
        update.handle() != null ? update.handle() : handle,
        update.publicKey() != null ? update.publicKey() : publicKey,
        update.bio() != null ? update.bio() : bio);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof User other
        && Objects.equals(email, other.email)
        && Objects.equals(passwordHash, other.passwordHash)
        && Objects.equals(handle, other.handle)
        && Arrays.equals(publicKey, other.publicKey)
        && Objects.equals(bio, other.bio);
  }

  @Override
  public int hashCode() {
    return Objects.hash(email, passwordHash, handle, Arrays.hashCode(publicKey), bio);
  }

  @Override
  public String toString() {
    return "User[email=" + email + ", handle=" + handle + "]";
  }
}
