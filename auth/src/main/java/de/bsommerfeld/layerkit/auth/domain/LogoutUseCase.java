package de.bsommerfeld.layerkit.auth.domain;

import de.bsommerfeld.layerkit.core.usecase.VoidUseCase;
import jakarta.inject.Inject;

import java.util.concurrent.CompletableFuture;

public class LogoutUseCase implements VoidUseCase<LogoutParams> {

    private final AuthRepository repository;

    @Inject
    public LogoutUseCase(AuthRepository repository) {
        this.repository = repository;
    }

    @Override
    public CompletableFuture<Void> call(LogoutParams params) {
        return repository.logout(params.allDevices());
    }
}
