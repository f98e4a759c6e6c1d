package de.bsommerfeld.layerkit.auth.domain;

import de.bsommerfeld.layerkit.core.usecase.NoParamsUseCase;
import jakarta.inject.Inject;

import java.util.concurrent.CompletableFuture;

/**
 * Returns the user behind the persisted session, verified against the remote
 * API.
 */
public class GetCurrentUserUseCase implements NoParamsUseCase<UserEntity> {

    private final AuthRepository repository;

    @Inject
    public GetCurrentUserUseCase(AuthRepository repository) {
        this.repository = repository;
    }

    @Override
    public CompletableFuture<UserEntity> call() {
        return repository.currentUser();
    }
}
