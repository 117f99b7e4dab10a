package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response envelope returned by every account endpoint.
 * <p>
 * Wire form: {@code {"status": "Success"|"Failure"|"Error", "data": <payload>}}.
 * For {@link Status#FAILURE} and {@link Status#ERROR} the payload is a human-readable message.
 *
 * @param status outcome category
 * @param data   payload: a user, a token, a list of emails, or a message
 * @param <T>    payload type
 */
public record ApiResponse<T>(
    @JsonProperty("status") Status status,
    @JsonProperty("data") T data) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(Status.SUCCESS, data);
  }

  public static ApiResponse<String> failure(String message) {
    return new ApiResponse<>(Status.FAILURE, message);
  }

  public static ApiResponse<String> error(String message) {
    return new ApiResponse<>(Status.ERROR, message);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
