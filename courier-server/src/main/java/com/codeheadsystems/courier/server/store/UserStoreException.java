package com.codeheadsystems.courier.server.store;

/**
 * The backing store failed for a reason other than a duplicate email.
 */
public class UserStoreException extends RuntimeException {

  /**
   * Instantiates a new User store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public UserStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
