package de.bsommerfeld.layerkit.core.usecase;

import java.util.concurrent.CompletableFuture;

/**
 * A side-effect-only operation. The future completes with {@code null} on
 * success.
 *
 * @param <P> params type
 */
@FunctionalInterface
public interface VoidUseCase<P> {

    CompletableFuture<Void> call(P params);
}
