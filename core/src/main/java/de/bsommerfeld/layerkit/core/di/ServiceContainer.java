package de.bsommerfeld.layerkit.core.di;

import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Binding;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.ProvisionException;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.google.inject.Stage;
import com.google.inject.binder.ScopedBindingBuilder;
import com.google.inject.matcher.Matchers;
import com.google.inject.spi.Element;
import com.google.inject.spi.Elements;
import com.google.inject.spi.Message;
import com.google.inject.spi.ProvisionListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * Process-wide registry that resolves abstract types to instances.
 *
 * <p>
 * Registrations are collected by a {@link Builder} during startup and frozen
 * by {@link Builder#build()}. The container is backed by a Guice injector
 * with explicit bindings only, so nothing is resolved that was not registered
 * (or bound by an installed module).
 *
 * <h3>Lifetimes</h3>
 * <ul>
 * <li>{@link Lifetime#LAZY_SINGLETON}: the factory (or constructor) runs at
 * most once, on first resolution. Concurrent first resolutions block on
 * Guice's singleton scope until the single instance exists.</li>
 * <li>{@link Lifetime#FACTORY}: a new instance per resolution.</li>
 * <li>{@link Lifetime#INSTANCE}: a pre-built instance, never closed by the
 * container.</li>
 * </ul>
 *
 * <h3>Failure modes</h3>
 * <ul>
 * <li>{@link NotRegisteredException}: at build time for a missing
 * constructor dependency, at resolution time for an unknown type. No factory
 * runs in either case.</li>
 * <li>{@link CircularDependencyException}: at build time for cycles visible
 * in constructor signatures, at resolution time for cycles through
 * factories.</li>
 * </ul>
 *
 * <p>
 * {@link #close()} ends the container's lifetime: singletons that implement
 * {@link AutoCloseable} are closed in reverse creation order.
 */
public final class ServiceContainer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceContainer.class);

    private final Injector injector;
    private final Set<Key<?>> registeredKeys;
    private final Set<Class<?>> lazySingletonTypes;
    private final Deque<AutoCloseable> closeables = new ConcurrentLinkedDeque<>();
    private final Set<Object> tracked = Collections.synchronizedSet(
            Collections.newSetFromMap(new IdentityHashMap<>()));
    private final ThreadLocal<Deque<Class<?>>> resolving = ThreadLocal.withInitial(ArrayDeque::new);
    private volatile boolean closed;

    private ServiceContainer(List<Registration<?>> registrations, List<Module> modules) {
        this.lazySingletonTypes = lazySingletonTypesOf(registrations);

        List<Module> all = new ArrayList<>(modules);
        all.add(new RegistrationModule(registrations));

        List<Element> elements = Elements.getElements(Stage.DEVELOPMENT, all);
        new WiringValidator(elements).validate();
        this.registeredKeys = registeredKeysOf(elements);

        try {
            this.injector = Guice.createInjector(Stage.DEVELOPMENT, Elements.getModule(elements));
        } catch (CreationException e) {
            throw new ContainerException("Invalid container configuration", e);
        }
        LOG.debug("ServiceContainer built with {} registrations and {} modules.",
                registrations.size(), modules.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the instance registered for {@code type}.
     *
     * @throws NotRegisteredException       if the type has no registration
     * @throws CircularDependencyException  if creating it requires itself
     * @throws ContainerException           if a factory or constructor fails
     * @throws IllegalStateException        after {@link #close()}
     */
    public <T> T resolve(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (closed) {
            throw new IllegalStateException("ServiceContainer is closed");
        }

        Binding<T> binding = explicitBinding(type);
        if (binding == null) {
            throw new NotRegisteredException(type);
        }

        try {
            return binding.getProvider().get();
        } catch (ProvisionException e) {
            throw translate(type, e);
        }
    }

    /** Whether {@link #resolve} can answer for {@code type}. */
    public boolean isRegistered(Class<?> type) {
        return registeredKeys.contains(Key.get(type));
    }

    /**
     * Binding of a registered or module-bound type. Guice's own bindings
     * ({@code Injector}, {@code Stage}, ...) are not part of the registry.
     */
    private <T> Binding<T> explicitBinding(Class<T> type) {
        Key<T> key = Key.get(type);
        return registeredKeys.contains(key) ? injector.getBinding(key) : null;
    }

    private static Set<Key<?>> registeredKeysOf(List<Element> elements) {
        Set<Key<?>> keys = new HashSet<>();
        for (Element element : elements) {
            if (element instanceof Binding<?> binding) {
                keys.add(binding.getKey());
            }
        }
        return Set.copyOf(keys);
    }

    /**
     * Closes every resolved singleton that implements {@link AutoCloseable},
     * newest first. Failures are logged and do not stop the remaining closes.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Closing ServiceContainer ({} closeable singletons)...", closeables.size());

        AutoCloseable next;
        while ((next = closeables.pollFirst()) != null) {
            try {
                next.close();
            } catch (Exception e) {
                LOG.warn("Failed to close {}", next.getClass().getName(), e);
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private RuntimeException translate(Class<?> type, ProvisionException e) {
        ContainerException nested = findContainerException(e);
        if (nested != null) {
            return nested;
        }
        // Guice may detect the re-entry before our factory runs again.
        Deque<Class<?>> stack = resolving.get();
        if (stack.contains(type)) {
            return new CircularDependencyException(type.getName(), describePath(stack, type));
        }
        for (Message message : e.getErrorMessages()) {
            if (message.getMessage().toLowerCase(Locale.ROOT).contains("circular")) {
                return new CircularDependencyException(type);
            }
        }
        return new ContainerException("Failed to provide " + type.getName(), e);
    }

    private static ContainerException findContainerException(ProvisionException e) {
        for (Message message : e.getErrorMessages()) {
            Throwable cause = message.getCause();
            Set<Throwable> seen = new HashSet<>();
            while (cause != null && seen.add(cause)) {
                if (cause instanceof ContainerException containerException) {
                    return containerException;
                }
                if (cause instanceof ProvisionException inner) {
                    ContainerException found = findContainerException(inner);
                    if (found != null) {
                        return found;
                    }
                }
                cause = cause.getCause();
            }
        }
        return null;
    }

    private static Set<Class<?>> lazySingletonTypesOf(List<Registration<?>> registrations) {
        Set<Class<?>> types = new HashSet<>();
        for (Registration<?> registration : registrations) {
            if (registration.lifetime() == Lifetime.LAZY_SINGLETON) {
                types.add(registration.type());
                if (registration.implementation() != null) {
                    types.add(registration.implementation());
                }
            }
        }
        return types;
    }

    private static String describePath(Deque<Class<?>> stack, Class<?> repeated) {
        List<Class<?>> trail = new ArrayList<>(stack);
        Collections.reverse(trail);
        List<Class<?>> cycle = new ArrayList<>(trail.subList(trail.indexOf(repeated), trail.size()));
        cycle.add(repeated);
        return cycle.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
    }

    /**
     * Translates the frozen registrations into Guice bindings.
     */
    private final class RegistrationModule extends AbstractModule {

        private final List<Registration<?>> registrations;

        RegistrationModule(List<Registration<?>> registrations) {
            this.registrations = registrations;
        }

        @Override
        protected void configure() {
            binder().requireExplicitBindings();
            binder().disableCircularProxies();

            bind(ServiceContainer.class).toInstance(ServiceContainer.this);
            bindListener(Matchers.any(), new CloseableTracker());

            for (Registration<?> registration : registrations) {
                bindRegistration(binder(), registration);
            }
        }

        private <T> void bindRegistration(Binder binder, Registration<T> registration) {
            if (registration.lifetime() == Lifetime.INSTANCE) {
                binder.bind(registration.type()).toInstance(registration.instance());
                return;
            }

            ScopedBindingBuilder target;
            if (registration.isFactoryBased()) {
                target = binder.bind(registration.type())
                        .toProvider(new FactoryProvider<>(registration.type(), registration.factory()));
            } else if (registration.implementation() == registration.type()) {
                target = binder.bind(registration.type());
            } else {
                target = binder.bind(registration.type()).to(registration.implementation());
            }

            if (registration.lifetime() == Lifetime.LAZY_SINGLETON) {
                target.in(Singleton.class);
            }
        }
    }

    /**
     * Runs a {@link ServiceFactory} and detects re-entrant resolution of the
     * same type on the calling thread.
     */
    private final class FactoryProvider<T> implements Provider<T> {

        private final Class<T> type;
        private final ServiceFactory<? extends T> factory;

        FactoryProvider(Class<T> type, ServiceFactory<? extends T> factory) {
            this.type = type;
            this.factory = factory;
        }

        @Override
        public T get() {
            Deque<Class<?>> stack = resolving.get();
            if (stack.contains(type)) {
                throw new CircularDependencyException(type.getName(), describePath(stack, type));
            }

            stack.push(type);
            try {
                T instance = factory.create(ServiceContainer.this);
                if (instance == null) {
                    throw new ContainerException("Factory for " + type.getName() + " returned null");
                }
                return instance;
            } finally {
                stack.pop();
            }
        }
    }

    /**
     * Remembers singletons that need closing. Provision listeners run inside
     * the scope, so a singleton is seen exactly once.
     */
    private final class CloseableTracker implements ProvisionListener {

        @Override
        public <T> void onProvision(ProvisionInvocation<T> provision) {
            T instance = provision.provision();
            if (!(instance instanceof AutoCloseable closeable)) {
                return;
            }
            Binding<T> binding = provision.getBinding();
            Class<?> rawType = binding.getKey().getTypeLiteral().getRawType();
            boolean singleton = Scopes.isSingleton(binding) || lazySingletonTypes.contains(rawType);
            if (singleton && tracked.add(instance)) {
                closeables.push(closeable);
            }
        }
    }

    /**
     * Collects registrations during startup. A builder builds exactly one
     * container; registering afterwards is an error.
     */
    public static final class Builder {

        private final Map<Class<?>, Registration<?>> registrations = new LinkedHashMap<>();
        private final List<Module> modules = new ArrayList<>();
        private boolean built;

        private Builder() {
        }

        public <T> Builder registerLazySingleton(Class<T> type, ServiceFactory<? extends T> factory) {
            return add(Registration.ofFactory(type, Lifetime.LAZY_SINGLETON, Objects.requireNonNull(factory)));
        }

        public <T> Builder registerLazySingleton(Class<T> type, Class<? extends T> implementation) {
            return add(Registration.ofImplementation(type, Lifetime.LAZY_SINGLETON,
                    Objects.requireNonNull(implementation)));
        }

        public <T> Builder registerFactory(Class<T> type, ServiceFactory<? extends T> factory) {
            return add(Registration.ofFactory(type, Lifetime.FACTORY, Objects.requireNonNull(factory)));
        }

        /**
         * Registers a per-resolution implementation class. The class must not
         * carry {@link Singleton}, which would silently turn it into a
         * singleton.
         */
        public <T> Builder registerFactory(Class<T> type, Class<? extends T> implementation) {
            Objects.requireNonNull(implementation);
            if (implementation.isAnnotationPresent(Singleton.class)
                    || implementation.isAnnotationPresent(jakarta.inject.Singleton.class)) {
                throw new IllegalArgumentException(
                        implementation.getName() + " is annotated @Singleton and cannot use the factory lifetime");
            }
            return add(Registration.ofImplementation(type, Lifetime.FACTORY, implementation));
        }

        public <T> Builder registerInstance(Class<T> type, T instance) {
            return add(Registration.ofInstance(type, Objects.requireNonNull(instance)));
        }

        /**
         * Adds the bindings of a Guice module to the same graph, e.g. for
         * configuration objects or environment-dependent implementations.
         */
        public Builder install(Module module) {
            ensureOpen();
            modules.add(Objects.requireNonNull(module));
            return this;
        }

        private Builder add(Registration<?> registration) {
            ensureOpen();
            Objects.requireNonNull(registration.type(), "type");
            if (registrations.containsKey(registration.type())) {
                throw new IllegalStateException("Type already registered: " + registration.type().getName());
            }
            registrations.put(registration.type(), registration);
            return this;
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("ServiceContainer already built; registrations are frozen");
            }
        }

        /**
         * Validates and freezes the registrations.
         *
         * @throws NotRegisteredException      for a missing constructor dependency
         * @throws CircularDependencyException for a constructor cycle
         * @throws ContainerException          for any other wiring error
         */
        public ServiceContainer build() {
            ensureOpen();
            built = true;
            return new ServiceContainer(List.copyOf(registrations.values()), List.copyOf(modules));
        }
    }
}
