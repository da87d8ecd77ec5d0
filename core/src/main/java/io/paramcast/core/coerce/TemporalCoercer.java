package io.paramcast.core.coerce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.paramcast.core.spi.TypeCoercer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * ISO-8601 date and time types. The value tree has no temporal node type, so the coerced value is
 * the normalized ISO text of the parsed value (e.g. {@code 2024-1-5} is rejected,
 * {@code 2024-01-05T10:00:00+02:00} as {@code utc_datetime} becomes {@code 2024-01-05T08:00:00Z}).
 */
public final class TemporalCoercer implements TypeCoercer {

    private final String type;
    private final Function<String, String> normalizer;

    private TemporalCoercer(String type, Function<String, String> normalizer) {
        this.type = type;
        this.normalizer = normalizer;
    }

    /** {@code date}: {@code yyyy-MM-dd}. */
    public static TemporalCoercer date() {
        return new TemporalCoercer("date", s -> LocalDate.parse(s).toString());
    }

    /** {@code time}: {@code HH:mm[:ss[.fraction]]}. */
    public static TemporalCoercer time() {
        return new TemporalCoercer("time", s -> LocalTime.parse(s).toString());
    }

    /** {@code naive_datetime}: a date-time without offset. */
    public static TemporalCoercer naiveDateTime() {
        return new TemporalCoercer("naive_datetime", s -> LocalDateTime.parse(s).toString());
    }

    /** {@code utc_datetime}: a date-time with offset, shifted to UTC. */
    public static TemporalCoercer utcDateTime() {
        return new TemporalCoercer("utc_datetime", s -> OffsetDateTime.parse(s)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .toInstant()
                .toString());
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Optional<JsonNode> coerce(JsonNode raw, Map<String, JsonNode> options) {
        if (!raw.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(TextNode.valueOf(normalizer.apply(raw.textValue().trim())));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
