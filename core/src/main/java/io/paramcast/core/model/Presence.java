package io.paramcast.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/** How a field appeared in the raw input: not at all, as an explicit {@code null}, or with a value. */
public enum Presence {
    ABSENT,
    NULL,
    VALUE;

    /**
     * Reads the presence of {@code name} in a raw input object.
     *
     * @param input raw input, any node type (non-objects hold no fields)
     * @param name  field name
     * @return the field's presence
     */
    public static Presence of(JsonNode input, String name) {
        if (input == null || !input.isObject() || !input.has(name)) {
            return ABSENT;
        }
        return input.get(name).isNull() ? NULL : VALUE;
    }
}
