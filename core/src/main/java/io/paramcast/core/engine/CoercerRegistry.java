package io.paramcast.core.engine;

import io.paramcast.core.coerce.BuiltinCoercers;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for type coercers. Manages coercer registration and lookup by type tag. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class CoercerRegistry {

    private final Map<String, TypeCoercer> coercers = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public CoercerRegistry() {}

    /** Creates a registry holding every built-in coercer. */
    public static CoercerRegistry withBuiltins() {
        CoercerRegistry registry = new CoercerRegistry();
        BuiltinCoercers.all().forEach(registry::register);
        return registry;
    }

    /**
     * Registers a coercer. If a coercer with the same type tag is already registered, it is
     * replaced (last-write-wins semantics).
     *
     * @param coercer the coercer to register
     * @throws NullPointerException     if coercer or coercer.type() is null
     * @throws IllegalArgumentException if coercer.type() is empty
     */
    public void register(TypeCoercer coercer) {
        if (coercer == null) {
            throw new NullPointerException("coercer must not be null");
        }
        String type = coercer.type();
        if (type == null) {
            throw new NullPointerException("coercer type must not be null");
        }
        if (type.isEmpty()) {
            throw new IllegalArgumentException("coercer type must not be empty");
        }
        coercers.put(type, coercer);
    }

    /**
     * Looks up a coercer by type tag.
     *
     * @param type the type tag (e.g. "integer")
     * @return the coercer, or empty if not registered
     */
    public Optional<TypeCoercer> getCoercer(String type) {
        return Optional.ofNullable(coercers.get(type));
    }

    /**
     * Looks up a coercer by type tag, throwing if not found.
     *
     * @param type the type tag
     * @return the registered coercer
     * @throws IllegalArgumentException if no coercer is registered for the tag
     */
    public TypeCoercer requireCoercer(String type) {
        return getCoercer(type)
                .orElseThrow(() -> new IllegalArgumentException("No coercer registered for type: '" + type + "'"));
    }

    /** Returns {@code true} if a coercer is registered for the given tag. */
    public boolean hasCoercer(String type) {
        return coercers.containsKey(type);
    }

    /** Registered type tags, sorted. */
    public Set<String> types() {
        return new TreeSet<>(coercers.keySet());
    }

    /** Returns the number of registered coercers. */
    public int size() {
        return coercers.size();
    }
}
