package com.codeheadsystems.courier.server.store;

/**
 * Thrown by {@link UserStore#insert} when the email is already registered.
 */
public class DuplicateUserException extends RuntimeException {

  private final String email;

  public DuplicateUserException(String email, Throwable cause) {
    super("User already exists with email: " + email, cause);
    this.email = email;
  }

  public String getEmail() {
    return email;
  }
}
