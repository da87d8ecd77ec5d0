package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;

/** {@code float}: accepts any number or numeric text, always producing a {@link DoubleNode}. */
public final class FloatCoercer implements TypeCoercer {

    @Override
    public String type() {
        return "float";
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (raw.isNumber()) {
            return Optional.of(DoubleNode.valueOf(raw.doubleValue()));
        }
        if (raw.isTextual()) {
            try {
                double value = Double.parseDouble(raw.textValue().trim());
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return Optional.empty();
                }
                return Optional.of(DoubleNode.valueOf(value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
