package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login payload. The email travels in the path.
 * <p>
 * Used by: {@code POST /login/{email}}
 *
 * @param password plaintext password
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginRequest(@JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[password=***]";
  }
}
