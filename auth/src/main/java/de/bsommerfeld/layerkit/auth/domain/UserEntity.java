package de.bsommerfeld.layerkit.auth.domain;

import java.util.Objects;

/**
 * An authenticated user as the domain sees it. Carries no credentials.
 */
public record UserEntity(String id, String email) {

    public UserEntity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
    }
}
