package com.codeheadsystems.courier.client.exceptions;

/**
 * The account server could not be reached, or answered with an HTTP error status or a body
 * that is not a response envelope.
 */
public class AccountAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Account accessor exception with no HTTP status.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AccountAccessorException(final String message, final Throwable cause) {
    this(message, cause, 0);
  }

  /**
   * Instantiates a new Account accessor exception.
   *
   * @param message    the message
   * @param cause      the cause
   * @param statusCode the HTTP status, or 0 when no response was received
   */
  public AccountAccessorException(final String message, final Throwable cause, final int statusCode) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
