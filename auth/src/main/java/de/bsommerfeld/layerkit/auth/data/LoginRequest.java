package de.bsommerfeld.layerkit.auth.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /auth/login}.
 */
public record LoginRequest(
        @JsonProperty("email") String email,
        @JsonProperty("password") String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", password=***]";
    }
}
