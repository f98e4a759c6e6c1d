package de.bsommerfeld.layerkit.auth.domain;

import de.bsommerfeld.layerkit.core.failure.FailureException;

import java.util.concurrent.CompletableFuture;

/**
 * Authentication contract of the domain layer. Implementations live in the
 * data layer.
 *
 * <p>
 * Every returned future either completes with a value or fails with a
 * {@link FailureException}. Nothing else escapes.
 */
public interface AuthRepository {

    CompletableFuture<UserEntity> login(String email, String password);

    /** Ends the current session. Fails with a server error if there is none. */
    CompletableFuture<Void> logout(boolean allDevices);

    /** Fetches the user of the current session. Fails with a server error if there is none. */
    CompletableFuture<UserEntity> currentUser();
}
