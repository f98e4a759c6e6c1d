package de.bsommerfeld.layerkit.core.di;

/**
 * Thrown when a type is resolved (or required as a constructor dependency)
 * without having been registered in the {@link ServiceContainer}.
 */
public class NotRegisteredException extends ContainerException {

    private final String typeName;

    public NotRegisteredException(Class<?> type) {
        this(type.getName());
    }

    public NotRegisteredException(String typeName) {
        super("No registration for type: " + typeName);
        this.typeName = typeName;
    }

    public NotRegisteredException(String typeName, String requiredBy) {
        super("No registration for type: " + typeName + " (required by " + requiredBy + ")");
        this.typeName = typeName;
    }

    /** Fully qualified name of the missing type. */
    public String getTypeName() {
        return typeName;
    }
}
