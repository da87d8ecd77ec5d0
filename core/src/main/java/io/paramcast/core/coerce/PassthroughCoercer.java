package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;

/**
 * Types that keep the raw value: {@code map} (any object, not cast field by field) and
 * {@code any} (any non-null value).
 */
public final class PassthroughCoercer implements TypeCoercer {

    private final String type;
    private final boolean objectsOnly;

    private PassthroughCoercer(String type, boolean objectsOnly) {
        this.type = type;
        this.objectsOnly = objectsOnly;
    }

    public static PassthroughCoercer map() {
        return new PassthroughCoercer("map", true);
    }

    public static PassthroughCoercer any() {
        return new PassthroughCoercer("any", false);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (objectsOnly && !raw.isObject()) {
            return Optional.empty();
        }
        return Optional.of(raw.deepCopy());
    }
}
