package com.codeheadsystems.courier.client.model;

import com.codeheadsystems.courier.client.exceptions.AccountAccessorException;
import com.codeheadsystems.courier.model.Status;

/**
 * Client-side view of a response envelope. On success {@code value} holds the typed payload;
 * otherwise {@code message} holds the server's explanation.
 *
 * @param status  outcome category
 * @param value   payload on success, null otherwise
 * @param message server message on failure or error, null on success
 * @param <T>     payload type
 */
public record AccountResult<T>(Status status, T value, String message) {

  public static <T> AccountResult<T> success(T value) {
    return new AccountResult<>(Status.SUCCESS, value, null);
  }

  public static <T> AccountResult<T> rejected(Status status, String message) {
    return new AccountResult<>(status, null, message);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  /**
   * Returns the payload, or throws if the server did not report success.
   *
   * @return the payload
   * @throws AccountAccessorException carrying the server's message
   */
  public T orElseThrow() {
    if (!isSuccess()) {
      throw new AccountAccessorException(status + ": " + message, null);
    }
    return value;
  }
}
