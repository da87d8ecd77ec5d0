package io.paramcast.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-field configuration. {@code default} is interpreted by the projector; every other option is
 * handed untouched to the field's {@code TypeCoercer} (e.g. {@code precision} for decimals).
 *
 * @param defaultValue    declared default, or {@code null} when the field has none (a declared
 *                        {@code null} default is a {@code NullNode})
 * @param coercionOptions coercer-specific options, opaque to the core
 */
public record FieldOptions(JsonNode defaultValue, Map<String, JsonNode> coercionOptions) {

    private static final FieldOptions NONE = new FieldOptions(null, Map.of());

    public FieldOptions {
        coercionOptions = coercionOptions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(coercionOptions));
        if (defaultValue != null) {
            defaultValue = defaultValue.deepCopy();
        }
    }

    /** Options with no default and no coercion options. */
    public static FieldOptions none() {
        return NONE;
    }

    /** The declared default, or {@code null}. A copy: compiled schemas are shared. */
    @Override
    public JsonNode defaultValue() {
        return defaultValue != null ? defaultValue.deepCopy() : null;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /** The default as an optional; a copy, so callers may merge it freely. */
    public Optional<JsonNode> defaultOption() {
        return Optional.ofNullable(defaultValue).map(JsonNode::deepCopy);
    }
}
