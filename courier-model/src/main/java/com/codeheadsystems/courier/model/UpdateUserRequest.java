package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update payload. Absent (null) fields are left unchanged.
 * <p>
 * Changing {@code password} invalidates every token issued against the previous password.
 * <p>
 * Used by: {@code PUT /update/user/{email}/{token}}
 *
 * @param password  new plaintext password
 * @param handle    new display name
 * @param publicKey new public key
 * @param bio       new bio
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateUserRequest(
    @JsonProperty("password") String password,
    @JsonProperty("handle") String handle,
    @JsonProperty("public_key") String publicKey,
    @JsonProperty("bio") String bio) {

  @Override
  public String toString() {
    return "UpdateUserRequest[password=" + (password == null ? "null" : "***")
        + ", handle=" + handle + ", bio=" + bio + "]";
  }
}
