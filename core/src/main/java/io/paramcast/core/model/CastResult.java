package io.paramcast.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a cast. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: the input was valid; {@code value} holds the projected output.
 * <li>{@link Type#ERROR}: the input was invalid; {@code changeset} holds the errors.
 * </ul>
 *
 * In both states {@link #changeset()} returns the sealed result the value was projected from.
 */
public final class CastResult {

    /** The type of cast outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final JsonNode value;
    private final ValidationResult changeset;

    private CastResult(Type type, JsonNode value, ValidationResult changeset) {
        this.type = type;
        this.value = value;
        this.changeset = changeset;
    }

    /** Creates a SUCCESS result holding the projected value. */
    public static CastResult success(JsonNode value, ValidationResult changeset) {
        Objects.requireNonNull(value, "value must not be null for SUCCESS");
        Objects.requireNonNull(changeset, "changeset must not be null");
        return new CastResult(Type.SUCCESS, value, changeset);
    }

    /** Creates an ERROR result carrying the invalid changeset. */
    public static CastResult error(ValidationResult changeset) {
        Objects.requireNonNull(changeset, "changeset must not be null for ERROR");
        return new CastResult(Type.ERROR, null, changeset);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns a copy of the projected value. Only valid when {@code type() == SUCCESS}.
     *
     * @throws IllegalStateException on an ERROR result
     */
    public JsonNode value() {
        if (type != Type.SUCCESS) {
            throw new IllegalStateException("CastResult is an error, no value: " + changeset.errors());
        }
        return value.deepCopy();
    }

    public ValidationResult changeset() {
        return changeset;
    }

    /** Validation errors, empty on SUCCESS. */
    public List<FieldError> errors() {
        return changeset.errors();
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "CastResult[SUCCESS, schema=" + changeset.schema().name() + "]";
            case ERROR -> "CastResult[ERROR, schema=" + changeset.schema().name() + ", errors="
                    + changeset.errors().size() + "]";
        };
    }
}
