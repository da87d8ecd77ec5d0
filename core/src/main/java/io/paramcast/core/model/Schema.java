package io.paramcast.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paramcast.core.spi.ValidationHook;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled, read-only description of a set of named fields. Created once by {@code
 * SchemaCompiler} and shared across concurrent casts without locking.
 *
 * <p>
 * Inline embeds are schemas of their own, named after their parent and field
 * ({@code Kitten.NearLocation}). Schemas only ever reference schemas that existed before them,
 * so the embed graph is acyclic and casting recursion is bounded by schema depth.
 */
public final class Schema {

    private final String name;
    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> byName;
    private final ValidationHook hook;

    /**
     * Creates a schema.
     *
     * @param name   schema identity, used for inline-embed naming and registry lookup
     * @param fields fields in declaration order; names must be distinct
     * @param hook   per-schema validation hook, or {@code null} for the identity hook
     * @throws IllegalArgumentException if two fields share a name
     */
    public Schema(String name, List<FieldDescriptor> fields, ValidationHook hook) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Map<String, FieldDescriptor> index = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            if (index.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException(
                        "Duplicate field '" + field.name() + "' in schema '" + name + "'");
            }
        }
        this.fields = List.copyOf(fields);
        this.byName = Collections.unmodifiableMap(index);
        this.hook = hook;
    }

    public Schema(String name, List<FieldDescriptor> fields) {
        this(name, fields, null);
    }

    public String name() {
        return name;
    }

    /** Fields in declaration order. Order is kept for diagnostics only. */
    public List<FieldDescriptor> fields() {
        return fields;
    }

    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(byName.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return byName.containsKey(fieldName);
    }

    /** Names of required fields, in declaration order. */
    public List<String> required() {
        List<String> names = new ArrayList<>();
        for (FieldDescriptor field : fields) {
            if (field.required()) {
                names.add(field.name());
            }
        }
        return names;
    }

    /** Names of optional fields, in declaration order. */
    public List<String> optional() {
        List<String> names = new ArrayList<>();
        for (FieldDescriptor field : fields) {
            if (!field.required()) {
                names.add(field.name());
            }
        }
        return names;
    }

    /** The per-schema hook, if one was installed at compile time. */
    public Optional<ValidationHook> hook() {
        return Optional.ofNullable(hook);
    }

    /**
     * The zero value of this schema's output type: every field {@code null}, except EmbedMany
     * fields which start as an empty array. A fresh node on each call.
     */
    public ObjectNode zeroValue() {
        ObjectNode zero = JsonNodeFactory.instance.objectNode();
        for (FieldDescriptor field : fields) {
            if (field.kind() instanceof FieldKind.EmbedMany) {
                zero.putArray(field.name());
            } else {
                zero.putNull(field.name());
            }
        }
        return zero;
    }

    @Override
    public String toString() {
        return "Schema[" + name + ", fields=" + byName.keySet() + "]";
    }
}
