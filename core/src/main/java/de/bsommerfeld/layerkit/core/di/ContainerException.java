package de.bsommerfeld.layerkit.core.di;

/**
 * Base type for wiring errors raised by {@link ServiceContainer}. These are
 * configuration mistakes and are treated as fatal at startup.
 */
public class ContainerException extends RuntimeException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
