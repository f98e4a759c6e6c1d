package de.bsommerfeld.layerkit.core.di;

/**
 * How long a resolved instance lives inside a {@link ServiceContainer}.
 */
public enum Lifetime {

    /** Created on first resolution, then cached until the container is closed. */
    LAZY_SINGLETON,

    /** Created anew on every resolution. */
    FACTORY,

    /** Supplied at registration time. */
    INSTANCE
}
