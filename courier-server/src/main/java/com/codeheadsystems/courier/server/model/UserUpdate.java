package com.codeheadsystems.courier.server.model;

/**
 * Fields to change on an existing user. A null field is left unchanged.
 *
 * @param passwordHash new bcrypt hash (already hashed, never plaintext)
 * @param handle       new display name
 * @param publicKey    new public key bytes
 * @param bio          new bio
 */
public record UserUpdate(String passwordHash, String handle, byte[] publicKey, String bio) {

  public UserUpdate {
    publicKey = publicKey == null ? null : publicKey.clone();
  }

  @Override
  public byte[] publicKey() {
    return publicKey == null ? null : publicKey.clone();
  }

  public boolean changesPassword() {
    return passwordHash != null;
  }

  @Override
  public String toString() {
    return "UserUpdate[changesPassword=" + changesPassword() + ", handle=" + handle + "]";
  }
}
