package de.bsommerfeld.layerkit.core.di;

/**
 * Frozen registration entry: the exposed type plus exactly one of factory,
 * implementation class or instance.
 */
record Registration<T>(
        Class<T> type,
        Lifetime lifetime,
        ServiceFactory<? extends T> factory,
        Class<? extends T> implementation,
        T instance) {

    static <T> Registration<T> ofFactory(Class<T> type, Lifetime lifetime, ServiceFactory<? extends T> factory) {
        return new Registration<>(type, lifetime, factory, null, null);
    }

    static <T> Registration<T> ofImplementation(Class<T> type, Lifetime lifetime, Class<? extends T> implementation) {
        return new Registration<>(type, lifetime, null, implementation, null);
    }

    static <T> Registration<T> ofInstance(Class<T> type, T instance) {
        return new Registration<>(type, Lifetime.INSTANCE, null, null, instance);
    }

    boolean isFactoryBased() {
        return factory != null;
    }
}
