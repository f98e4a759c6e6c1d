package de.bsommerfeld.layerkit.core.failure;

import java.util.Objects;

/**
 * Immutable description of what went wrong. Created at the repository
 * boundary and passed up unchanged.
 *
 * @param kind    failure category
 * @param message human-readable detail, never {@code null}
 */
public record Failure(FailureKind kind, String message) {

    static final String NO_CONNECTIVITY_MESSAGE = "No internet connection";

    public Failure {
        Objects.requireNonNull(kind, "kind");
        message = message != null ? message : "";
    }

    public static Failure noConnectivity() {
        return new Failure(FailureKind.NO_CONNECTIVITY, NO_CONNECTIVITY_MESSAGE);
    }

    public static Failure serverError(String message) {
        return new Failure(FailureKind.SERVER_ERROR, message);
    }

    public boolean is(FailureKind other) {
        return kind == other;
    }
}
