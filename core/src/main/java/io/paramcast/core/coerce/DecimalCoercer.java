package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import io.paramcast.core.spi.TypeCoercer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;

/**
 * {@code decimal}: accepts any number or numeric text as a {@link BigDecimal}. Honors the
 * {@code scale} option, rounding half-up.
 */
public final class DecimalCoercer implements TypeCoercer {

    static final String SCALE_OPTION = "scale";

    @Override
    public String type() {
        return "decimal";
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        BigDecimal value;
        if (raw.isNumber()) {
            value = raw.decimalValue();
        } else if (raw.isTextual()) {
            try {
                value = new BigDecimal(raw.textValue().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        JsonNode scale = options.get(SCALE_OPTION);
        if (scale != null && scale.canConvertToInt()) {
            value = value.setScale(scale.intValue(), RoundingMode.HALF_UP);
        }
        return Optional.of(DecimalNode.valueOf(value));
    }
}
