package de.bsommerfeld.layerkit.core.di;

import com.google.inject.Binding;
import com.google.inject.ConfigurationException;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.MembersInjector;
import com.google.inject.Stage;
import com.google.inject.TypeLiteral;
import com.google.inject.spi.Dependency;
import com.google.inject.spi.Element;
import com.google.inject.spi.InjectionPoint;
import com.google.inject.spi.LinkedKeyBinding;
import com.google.inject.spi.UntargettedBinding;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the recorded bindings before the injector is created, so wiring
 * mistakes surface at startup as {@link NotRegisteredException} or
 * {@link CircularDependencyException} instead of at first use.
 *
 * <p>
 * Only bindings whose construction is visible from class signatures are
 * walked: linked bindings, untargetted bindings and the {@code @Inject}
 * constructors, fields and methods of the classes they construct. Factory
 * and instance bindings are opaque here; cycles through factories are
 * caught by the container at resolution time.
 *
 * <p>
 * A {@code Provider<T>} dependency is not an edge. It defers construction,
 * which is the sanctioned way to break a cycle.
 */
final class WiringValidator {

    private static final Set<Class<?>> BUILT_INS = Set.of(
            Injector.class,
            Stage.class,
            java.util.logging.Logger.class,
            com.google.inject.Provider.class,
            jakarta.inject.Provider.class,
            MembersInjector.class,
            TypeLiteral.class);

    private enum Mark {
        VISITING, DONE
    }

    private final Map<Key<?>, Binding<?>> bindings = new LinkedHashMap<>();
    private final Map<Key<?>, Mark> marks = new HashMap<>();
    private final Deque<Key<?>> path = new ArrayDeque<>();

    WiringValidator(List<Element> elements) {
        for (Element element : elements) {
            if (element instanceof Binding<?> binding) {
                bindings.put(binding.getKey(), binding);
            }
        }
    }

    void validate() {
        for (Key<?> key : new ArrayList<>(bindings.keySet())) {
            visit(key);
        }
    }

    private void visit(Key<?> key) {
        Mark mark = marks.get(key);
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.VISITING) {
            throw new CircularDependencyException(typeName(key), describeCycle(key));
        }

        marks.put(key, Mark.VISITING);
        path.addLast(key);

        Binding<?> binding = bindings.get(key);
        if (binding instanceof LinkedKeyBinding<?> linked) {
            // Link targets are constructed just-in-time and need no binding of their own.
            visit(linked.getLinkedKey());
        } else if (binding == null || binding instanceof UntargettedBinding<?>) {
            for (Key<?> dependency : injectedDependencies(key)) {
                if (!bindings.containsKey(dependency)) {
                    throw new NotRegisteredException(typeName(dependency), typeName(key));
                }
                visit(dependency);
            }
        }

        path.removeLast();
        marks.put(key, Mark.DONE);
    }

    private static List<Key<?>> injectedDependencies(Key<?> key) {
        TypeLiteral<?> literal = key.getTypeLiteral();
        Class<?> raw = literal.getRawType();
        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
            // Guice reports the missing implementation itself when the injector is created.
            return List.of();
        }

        List<InjectionPoint> points = new ArrayList<>();
        try {
            points.add(InjectionPoint.forConstructorOf(literal));
            points.addAll(InjectionPoint.forInstanceMethodsAndFields(literal));
        } catch (ConfigurationException e) {
            // Malformed injection points are reported by Guice with full detail.
            return List.of();
        }

        List<Key<?>> keys = new ArrayList<>();
        for (InjectionPoint point : points) {
            if (point.isOptional()) {
                continue;
            }
            for (Dependency<?> dependency : point.getDependencies()) {
                Class<?> dependencyType = dependency.getKey().getTypeLiteral().getRawType();
                if (!BUILT_INS.contains(dependencyType)) {
                    keys.add(dependency.getKey());
                }
            }
        }
        return keys;
    }

    private String describeCycle(Key<?> repeated) {
        List<Key<?>> trail = new ArrayList<>(path);
        List<Key<?>> cycle = new ArrayList<>(trail.subList(trail.indexOf(repeated), trail.size()));
        cycle.add(repeated);
        return cycle.stream()
                .map(k -> k.getTypeLiteral().getRawType().getSimpleName())
                .collect(Collectors.joining(" -> "));
    }

    private static String typeName(Key<?> key) {
        return key.getTypeLiteral().toString();
    }
}
