package de.bsommerfeld.layerkit.core.usecase;

import java.util.concurrent.CompletableFuture;

/**
 * A single application operation taking one params value and producing one
 * result asynchronously.
 *
 * <p>
 * Implementations hold nothing but their injected repository. They call it
 * exactly once per invocation and hand back its future as is, so a
 * {@link de.bsommerfeld.layerkit.core.failure.FailureException} raised below
 * reaches the caller unchanged.
 *
 * @param <R> result type
 * @param <P> params type
 */
@FunctionalInterface
public interface UseCase<R, P> {

    CompletableFuture<R> call(P params);
}
