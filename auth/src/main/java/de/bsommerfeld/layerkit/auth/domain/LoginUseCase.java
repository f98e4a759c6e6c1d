package de.bsommerfeld.layerkit.auth.domain;

import de.bsommerfeld.layerkit.core.usecase.UseCase;
import jakarta.inject.Inject;

import java.util.concurrent.CompletableFuture;

/**
 * Logs a user in with email and password.
 */
public class LoginUseCase implements UseCase<UserEntity, LoginParams> {

    private final AuthRepository repository;

    @Inject
    public LoginUseCase(AuthRepository repository) {
        this.repository = repository;
    }

    @Override
    public CompletableFuture<UserEntity> call(LoginParams params) {
        return repository.login(params.email(), params.password());
    }
}
