package de.bsommerfeld.layerkit.core.failure;

/**
 * Expected runtime failure categories surfaced to the presentation layer.
 */
public enum FailureKind {

    /** The connectivity check said the network is unreachable. The data source was not called. */
    NO_CONNECTIVITY,

    /** The data source was called and failed. */
    SERVER_ERROR
}
