package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;

/** {@code string}: accepts text only. Numbers and booleans are not silently stringified. */
public final class StringCoercer implements TypeCoercer {

    @Override
    public String type() {
        return "string";
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        return raw.isTextual() ? Optional.of(raw) : Optional.empty();
    }
}
