package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.paramcast.core.spi.TypeCoercer;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/** {@code binary_id}: a canonical 36-character UUID, normalized to lowercase. */
public final class UuidCoercer implements TypeCoercer {

    private static final Pattern CANONICAL =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    @Override
    public String type() {
        return "binary_id";
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (!raw.isTextual() || !CANONICAL.matcher(raw.textValue()).matches()) {
            return Optional.empty();
        }
        return Optional.of(TextNode.valueOf(UUID.fromString(raw.textValue()).toString()));
    }
}
