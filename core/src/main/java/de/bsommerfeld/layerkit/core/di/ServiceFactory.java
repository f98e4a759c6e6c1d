package de.bsommerfeld.layerkit.core.di;

/**
 * Creates an instance for a registration. Dependencies are pulled from the
 * container passed in, so a factory may be registered before the types it
 * resolves.
 *
 * @param <T> the produced type
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(ServiceContainer container);
}
