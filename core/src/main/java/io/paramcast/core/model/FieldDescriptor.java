package io.paramcast.core.model;

import java.util.Objects;

/**
 * Normalized metadata for one schema field. Immutable once compiled.
 *
 * @param name     field name, unique within its schema (the {@code !} marker already stripped)
 * @param required whether the field must be supplied
 * @param kind     field shape
 * @param inline   whether an embedded schema was declared inline and is owned by this field
 * @param options  default value and coercion options
 */
public record FieldDescriptor(String name, boolean required, FieldKind kind, boolean inline, FieldOptions options) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("field name must not be empty");
        }
        if (inline && !kind.isRelation()) {
            throw new IllegalArgumentException("only embeds can be inline, field '" + name + "' is " + kind);
        }
        if (options == null) {
            options = FieldOptions.none();
        }
    }

    /** Convenience constructor for a field without options. */
    public FieldDescriptor(String name, boolean required, FieldKind kind) {
        this(name, required, kind, false, FieldOptions.none());
    }

    public boolean isRelation() {
        return kind.isRelation();
    }

    public boolean hasDefault() {
        return options.hasDefault();
    }
}
