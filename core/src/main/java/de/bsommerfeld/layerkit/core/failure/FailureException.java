package de.bsommerfeld.layerkit.core.failure;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Carries a {@link Failure} through a {@link java.util.concurrent.CompletableFuture}
 * pipeline. Unchecked because it travels inside futures, where checked
 * exceptions cannot be declared.
 */
public class FailureException extends RuntimeException {

    private final Failure failure;

    public FailureException(Failure failure) {
        super(failure.kind() + ": " + failure.message());
        this.failure = failure;
    }

    public FailureException(Failure failure, Throwable cause) {
        super(failure.kind() + ": " + failure.message(), cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }

    /**
     * Finds the failure in an error as delivered by a future, looking through
     * {@link java.util.concurrent.CompletionException} and
     * {@link java.util.concurrent.ExecutionException} wrappers.
     */
    public static Optional<Failure> extract(Throwable error) {
        Set<Throwable> seen = new HashSet<>();
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (current instanceof FailureException failureException) {
                return Optional.of(failureException.getFailure());
            }
            current = current.getCause();
        }
        return Optional.empty();
    }
}
