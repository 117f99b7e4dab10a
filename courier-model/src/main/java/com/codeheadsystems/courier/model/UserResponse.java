package com.codeheadsystems.courier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a user. Never carries the password hash.
 *
 * @param email     account identifier
 * @param handle    display name
 * @param publicKey public key for end-to-end messaging
 * @param bio       optional bio, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserResponse(
    @JsonProperty("email") String email,
    @JsonProperty("handle") String handle,
    @JsonProperty("public_key") String publicKey,
    @JsonProperty("bio") String bio) {
}
