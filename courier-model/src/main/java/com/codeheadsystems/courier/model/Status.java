package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome category carried in every {@link ApiResponse}.
 * <p>
 * Callers must branch on the category, not only on success:
 * <ul>
 *   <li>{@link #SUCCESS}: the operation completed.</li>
 *   <li>{@link #FAILURE}: an expected negative outcome of a well-formed request
 *       (wrong password, unknown user). Safe to show to end users.</li>
 *   <li>{@link #ERROR}: a structural or security problem (bad token, identity
 *       mismatch, duplicate email). Indicates misuse or tampering.</li>
 * </ul>
 */
public enum Status {
  @JsonProperty("Success")
  SUCCESS,
  @JsonProperty("Failure")
  FAILURE,
  @JsonProperty("Error")
  ERROR
}
