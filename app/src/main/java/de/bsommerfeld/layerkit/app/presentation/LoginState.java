package de.bsommerfeld.layerkit.app.presentation;

import de.bsommerfeld.layerkit.auth.domain.UserEntity;
import de.bsommerfeld.layerkit.core.failure.Failure;

import java.util.Objects;

/**
 * What the authentication screen shows. {@code user} is set only when
 * {@link Status#AUTHENTICATED}, {@code failure} only when
 * {@link Status#FAILED} or, after a rejected session check,
 * {@link Status#UNAUTHENTICATED}. Input rejected before any call is
 * {@link Status#FAILED} with a {@code validationError} and no failure.
 */
public record LoginState(Status status, UserEntity user, Failure failure, String validationError) {

    public enum Status {
        IDLE,
        LOADING,
        AUTHENTICATED,
        UNAUTHENTICATED,
        FAILED;

        public boolean isTerminal() {
            return this != IDLE && this != LOADING;
        }
    }

    public LoginState {
        Objects.requireNonNull(status, "status");
    }

    public static LoginState idle() {
        return new LoginState(Status.IDLE, null, null, null);
    }

    public static LoginState loading() {
        return new LoginState(Status.LOADING, null, null, null);
    }

    public static LoginState authenticated(UserEntity user) {
        return new LoginState(Status.AUTHENTICATED, Objects.requireNonNull(user, "user"), null, null);
    }

    public static LoginState unauthenticated() {
        return new LoginState(Status.UNAUTHENTICATED, null, null, null);
    }

    public static LoginState unauthenticated(Failure reason) {
        return new LoginState(Status.UNAUTHENTICATED, null, reason, null);
    }

    public static LoginState failed(Failure failure) {
        return new LoginState(Status.FAILED, null, Objects.requireNonNull(failure, "failure"), null);
    }

    public static LoginState invalid(String validationError) {
        return new LoginState(Status.FAILED, null, null, Objects.requireNonNull(validationError, "validationError"));
    }
}
