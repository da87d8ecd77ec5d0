package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;

/** {@code boolean}: accepts booleans and the texts {@code true}, {@code false}, {@code 1}, {@code 0}. */
public final class BooleanCoercer implements TypeCoercer {

    @Override
    public String type() {
        return "boolean";
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (raw.isBoolean()) {
            return Optional.of(raw);
        }
        if (raw.isTextual()) {
            return switch (raw.textValue().trim()) {
                case "true", "1" -> Optional.of(BooleanNode.TRUE);
                case "false", "0" -> Optional.of(BooleanNode.FALSE);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }
}
