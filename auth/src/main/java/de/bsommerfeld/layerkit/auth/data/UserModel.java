package de.bsommerfeld.layerkit.auth.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.layerkit.auth.domain.UserEntity;

/**
 * Wire and storage shape of a session: the user as returned by the auth API
 * together with the bearer token for later calls.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserModel(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("access_token") String accessToken) {

    /**
     * @throws IllegalStateException if the payload lacks an id or email
     */
    public UserEntity toEntity() {
        if (id == null || id.isBlank() || email == null || email.isBlank()) {
            throw new IllegalStateException("Malformed user payload: missing id or email");
        }
        return new UserEntity(id, email);
    }

    /** Copy of this model with the token taken from {@code fallback} when this one carries none. */
    UserModel withTokenFrom(UserModel fallback) {
        if (accessToken != null && !accessToken.isBlank()) {
            return this;
        }
        return new UserModel(id, email, fallback.accessToken());
    }

    @Override
    public String toString() {
        return "UserModel[id=" + id + ", email=" + email + ", accessToken=" + (accessToken != null ? "***" : null) + "]";
    }
}
