package de.bsommerfeld.layerkit.core.network;

import com.google.inject.Singleton;
import de.bsommerfeld.layerkit.core.failure.Failure;
import de.bsommerfeld.layerkit.core.failure.FailureException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The procedure every repository operation goes through before and after
 * touching a data source.
 *
 * <ol>
 * <li>Ask {@link NetworkInfo} whether the network is reachable.</li>
 * <li>Offline: fail with {@link Failure#noConnectivity()}. The data source is
 * never called. There is no retry and no queuing.</li>
 * <li>Online: call the data source once. A synchronous throw and an
 * exceptionally completed future are treated alike.</li>
 * <li>Error: fail with {@link Failure#serverError(String)} carrying the root
 * cause's message. An error that already is a {@link FailureException}
 * passes through untouched.</li>
 * <li>Success: map the data-source model to the domain entity.</li>
 * </ol>
 *
 * <p>
 * The check and the call are not atomic; the network may drop in between.
 * That case ends up as a server error from the data source.
 *
 * <p>
 * A connectivity check that fails by itself counts as offline.
 */
@Singleton
public class NetworkGuard {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkGuard.class);

    private final NetworkInfo networkInfo;

    @Inject
    public NetworkGuard(NetworkInfo networkInfo) {
        this.networkInfo = networkInfo;
    }

    /**
     * Runs {@code remoteCall} behind the connectivity gate and maps its result
     * with {@code toEntity}.
     *
     * @param remoteCall starts the data-source operation; invoked at most once
     * @param toEntity   converts the data-source model into the domain type
     * @return future failing with a {@link FailureException} on any error
     */
    public <M, E> CompletableFuture<E> call(Supplier<CompletableFuture<M>> remoteCall,
            Function<? super M, ? extends E> toEntity) {
        return checkConnectivity().thenCompose(connected -> {
            if (!connected) {
                LOG.debug("Remote call skipped: no connectivity.");
                return CompletableFuture.<E>failedFuture(new FailureException(Failure.noConnectivity()));
            }
            return invoke(remoteCall, toEntity);
        });
    }

    /** Same as {@link #call(Supplier, Function)} without a model conversion. */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> remoteCall) {
        return call(remoteCall, model -> model);
    }

    private CompletableFuture<Boolean> checkConnectivity() {
        CompletableFuture<Boolean> check;
        try {
            check = networkInfo.isConnected();
        } catch (RuntimeException e) {
            LOG.warn("Connectivity check threw, treating network as unreachable.", e);
            return CompletableFuture.completedFuture(false);
        }

        return check.handle((connected, error) -> {
            if (error != null) {
                LOG.warn("Connectivity check failed, treating network as unreachable.", error);
                return false;
            }
            return Boolean.TRUE.equals(connected);
        });
    }

    private <M, E> CompletableFuture<E> invoke(Supplier<CompletableFuture<M>> remoteCall,
            Function<? super M, ? extends E> toEntity) {
        CompletableFuture<M> pending;
        try {
            pending = remoteCall.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toFailure(e));
        }
        if (pending == null) {
            return CompletableFuture.failedFuture(
                    new FailureException(Failure.serverError("Data source returned no result")));
        }

        return pending.handle((model, error) -> {
            if (error != null) {
                throw toFailure(error);
            }
            try {
                return toEntity.apply(model);
            } catch (RuntimeException e) {
                throw toFailure(e);
            }
        });
    }

    /**
     * Wraps an arbitrary data-source error as a server failure. Future
     * wrappers are stripped so the message is the one the data source raised.
     */
    static FailureException toFailure(Throwable error) {
        Throwable root = error;
        while ((root instanceof CompletionException || root instanceof ExecutionException)
                && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof FailureException failureException) {
            return failureException;
        }

        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        LOG.warn("Remote call failed: {}", message);
        return new FailureException(Failure.serverError(message), root);
    }
}
