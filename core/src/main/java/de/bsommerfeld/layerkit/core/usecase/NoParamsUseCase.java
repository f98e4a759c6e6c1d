package de.bsommerfeld.layerkit.core.usecase;

import java.util.concurrent.CompletableFuture;

/**
 * An operation that needs no input.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface NoParamsUseCase<R> {

    CompletableFuture<R> call();
}
