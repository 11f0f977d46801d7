package org.kwindex.runtime.value;

import org.kwindex.runtime.index.IndexType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping interpretation kind names to their shared descriptors.
 * <p>
 * Lets generic code (e.g., a command that converts a value to a kind named by the user)
 * find a descriptor without compile-time knowledge of the kind.
 */
public final class TypeRegistry {

    private final Map<String, ITypeDescriptor<?>> types = new LinkedHashMap<>();

    /**
     * Registers a descriptor under its {@link ITypeDescriptor#name()}.
     *
     * @param type The descriptor to register.
     * @throws IllegalArgumentException If another descriptor is already registered under that name.
     */
    public void register(ITypeDescriptor<?> type) {
        ITypeDescriptor<?> existing = types.putIfAbsent(type.name(), type);
        if (existing != null && existing != type) {
            throw new IllegalArgumentException("Interpretation kind already registered: " + type.name());
        }
    }

    /**
     * Looks up a descriptor by kind name.
     *
     * @param name The kind name.
     * @return The descriptor, or empty if no kind of that name is registered.
     */
    public Optional<ITypeDescriptor<?>> lookup(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * Gets all registered descriptors in registration order.
     *
     * @return An unmodifiable view of the registered descriptors.
     */
    public Map<String, ITypeDescriptor<?>> getTypes() {
        return Collections.unmodifiableMap(types);
    }

    /**
     * Creates a registry pre-populated with the built-in interpretation kinds.
     *
     * @return A registry containing the index kind.
     */
    public static TypeRegistry initializeWithDefaults() {
        TypeRegistry registry = new TypeRegistry();
        registry.register(IndexType.INSTANCE);
        return registry;
    }
}
