package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registration payload.
 * <p>
 * Used by: {@code POST /create/user}
 *
 * @param email     unique account identifier
 * @param password  plaintext password; hashed on arrival and never stored as given
 * @param handle    display name
 * @param publicKey the user's public key for end-to-end messaging, stored and returned untouched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateUserRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("handle") String handle,
    @JsonProperty("public_key") String publicKey) {

  @Override
  public String toString() {
    return "CreateUserRequest[email=" + email + ", handle=" + handle + "]";
  }
}
