package de.bsommerfeld.layerkit.core.di;

/**
 * Thrown when resolving a type requires resolving that same type again,
 * either detected from constructor signatures at build time or from factory
 * calls at resolution time.
 */
public class CircularDependencyException extends ContainerException {

    private final String typeName;

    public CircularDependencyException(Class<?> type) {
        this(type.getName());
    }

    public CircularDependencyException(String typeName) {
        super("Circular dependency involving type: " + typeName);
        this.typeName = typeName;
    }

    public CircularDependencyException(String typeName, String path) {
        super("Circular dependency involving type: " + typeName + " (" + path + ")");
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
