package io.paramcast.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Shape of a schema field. Scalars and scalar arrays name a coercer type tag; embeds reference the
 * compiled schema their values are cast against.
 */
public sealed interface FieldKind
        permits FieldKind.Scalar, FieldKind.Array, FieldKind.EmbedOne, FieldKind.EmbedMany {

    /** Returns {@code true} for EmbedOne/EmbedMany, which are cast recursively. */
    default boolean isRelation() {
        return false;
    }

    /** The embedded schema for relations, empty for scalars and arrays. */
    default Optional<Schema> embedded() {
        return Optional.empty();
    }

    /** A single scalar value of the given type tag. */
    record Scalar(String type) implements FieldKind {
        public Scalar {
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** A sequence of scalars of the given element type tag. */
    record Array(String elementType) implements FieldKind {
        public Array {
            Objects.requireNonNull(elementType, "elementType must not be null");
        }
    }

    /** A single nested object cast against {@code schema}. */
    record EmbedOne(Schema schema) implements FieldKind {
        public EmbedOne {
            Objects.requireNonNull(schema, "schema must not be null");
        }

        @Override
        public boolean isRelation() {
            return true;
        }

        @Override
        public Optional<Schema> embedded() {
            return Optional.of(schema);
        }

        @Override
        public String toString() {
            return "EmbedOne[" + schema.name() + "]";
        }
    }

    /** A sequence of nested objects, each cast against {@code schema}. */
    record EmbedMany(Schema schema) implements FieldKind {
        public EmbedMany {
            Objects.requireNonNull(schema, "schema must not be null");
        }

        @Override
        public boolean isRelation() {
            return true;
        }

        @Override
        public Optional<Schema> embedded() {
            return Optional.of(schema);
        }

        @Override
        public String toString() {
            return "EmbedMany[" + schema.name() + "]";
        }
    }
}
