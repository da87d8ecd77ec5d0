package io.paramcast.core.engine;

import io.paramcast.core.model.Schema;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named compiled schemas: the schemas defined by callers and every inline embed, registered under
 * its path name ({@code Kitten.NearLocation}). {@code embeds_one}/{@code embeds_many} references
 * are resolved here.
 *
 * <p>
 * Thread-safe. Registered schemas are immutable, so a lookup may be shared by any number of
 * concurrent casts.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

    /**
     * Registers a schema under its name. A schema already registered under the same name is
     * replaced (last-write-wins), which is logged.
     *
     * @param schema the schema to register
     */
    public void register(Schema schema) {
        if (schema == null) {
            throw new NullPointerException("schema must not be null");
        }
        Schema previous = schemas.put(schema.name(), schema);
        if (previous != null && previous != schema) {
            LOG.warn("Schema '{}' re-registered — previous definition replaced", schema.name());
        } else {
            LOG.debug("Registered schema '{}' ({} fields)", schema.name(), schema.fields().size());
        }
    }

    /**
     * Looks up a schema by name.
     *
     * @param name the schema name
     * @return the schema, or empty if none is registered under the name
     */
    public Optional<Schema> getSchema(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    /**
     * Looks up a schema by name, throwing if not found.
     *
     * @param name the schema name
     * @return the registered schema
     * @throws IllegalArgumentException if no schema is registered under the name
     */
    public Schema requireSchema(String name) {
        return getSchema(name)
                .orElseThrow(() -> new IllegalArgumentException("No schema registered under name: '" + name + "'"));
    }

    public boolean hasSchema(String name) {
        return schemas.containsKey(name);
    }

    /** Registered schema names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(schemas.keySet()));
    }

    public int size() {
        return schemas.size();
    }
}
