package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;

/**
 * {@code integer} (and its alias {@code id}): accepts integral numbers and text holding a decimal
 * integer. Fractional numbers are rejected rather than truncated. Values that fit an {@code int}
 * come back as {@link IntNode}, larger ones as {@link LongNode}.
 */
public final class IntegerCoercer implements TypeCoercer {

    private final String type;

    public IntegerCoercer() {
        this("integer");
    }

    public IntegerCoercer(String type) {
        this.type = type;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (raw.isIntegralNumber()) {
            return raw.canConvertToLong() ? Optional.of(normalize(raw.longValue())) : Optional.empty();
        }
        if (raw.isTextual()) {
            try {
                return Optional.of(normalize(Long.parseLong(raw.textValue().trim())));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static JsonNode normalize(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return IntNode.valueOf((int) value);
        }
        return LongNode.valueOf(value);
    }
}
