package com.codeheadsystems.courier.server.model;

/**
 * Email and plaintext password pair, alive only for the duration of a login check.
 * Never persisted or logged.
 *
 * @param email    the claimed account
 * @param password the plaintext password
 */
public record Credential(String email, String password) {

  @Override
  public String toString() {
    return "Credential[email=" + email + ", password=***]";
  }
}
