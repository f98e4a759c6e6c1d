package de.bsommerfeld.layerkit.auth.domain;

import java.util.Objects;

/**
 * Input of {@link LoginUseCase}. The email is trimmed; the password is kept
 * as entered and never printed.
 */
public record LoginParams(String email, String password) {

    public LoginParams {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        Objects.requireNonNull(password, "password");
        email = email.trim();
    }

    @Override
    public String toString() {
        return "LoginParams[email=" + email + ", password=***]";
    }
}
