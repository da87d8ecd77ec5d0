package io.paramcast.core.hook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramcast.core.model.ErrorKind;
import io.paramcast.core.model.FieldPath;
import io.paramcast.core.model.ValidationResult;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ready-made checks for use inside a {@link io.paramcast.core.spi.ValidationHook}.
 *
 * <p>
 * Each check reads the coerced change of a field and appends {@link ErrorKind#USER_RULE} errors
 * to the open result; the result is returned so checks chain:
 *
 * <pre>{@code
 * ValidationHook kidRules = (result, raw) -> Validations.range(
 *         Validations.required(result, "name"), "age", 10, 20);
 * }</pre>
 *
 * Checks skip fields without a change; pair them with {@link #required} where presence matters.
 */
public final class Validations {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Validations() {
        // utility class
    }

    /** Requires a change for each field that does not already carry an error. */
    public static ValidationResult required(ValidationResult result, String... fields) {
        for (String field : fields) {
            FieldPath path = FieldPath.of(field);
            if (!result.hasChange(field) && result.errorsAt(path).isEmpty()) {
                result.addError(path, ErrorKind.MISSING_REQUIRED, ErrorKind.MISSING_REQUIRED.defaultMessage());
            }
        }
        return result;
    }

    /** Requires the changed value of {@code field} to equal one of {@code allowed}. */
    public static ValidationResult inclusion(ValidationResult result, String field, Collection<?> allowed) {
        Objects.requireNonNull(allowed, "allowed must not be null");
        Optional<JsonNode> value = result.changedValue(field);
        if (value.isEmpty()) {
            return result;
        }
        List<JsonNode> candidates =
                allowed.stream().map(a -> (JsonNode) MAPPER.valueToTree(a)).toList();
        if (candidates.stream().noneMatch(c -> sameValue(c, value.get()))) {
            result.addError(field, ErrorKind.USER_RULE, "is invalid");
        }
        return result;
    }

    /** Requires the changed number of {@code field} to lie within {@code min..max}, inclusive. */
    public static ValidationResult range(ValidationResult result, String field, Number min, Number max) {
        Optional<JsonNode> value = result.changedValue(field);
        if (value.isEmpty() || value.get().isNull()) {
            return result;
        }
        if (!value.get().isNumber()) {
            result.addError(field, ErrorKind.USER_RULE, "is not a number");
            return result;
        }
        BigDecimal actual = value.get().decimalValue();
        if (actual.compareTo(new BigDecimal(min.toString())) < 0
                || actual.compareTo(new BigDecimal(max.toString())) > 0) {
            result.addError(field, ErrorKind.USER_RULE, "must be between " + min + " and " + max);
        }
        return result;
    }

    /**
     * Requires the changed text (in characters) or array (in elements) of {@code field} to have a
     * length within {@code min..max}, inclusive.
     */
    public static ValidationResult length(ValidationResult result, String field, int min, int max) {
        Optional<JsonNode> value = result.changedValue(field);
        if (value.isEmpty()) {
            return result;
        }
        JsonNode node = value.get();
        int length;
        if (node.isTextual()) {
            length = node.asText().codePointCount(0, node.asText().length());
        } else if (node.isArray()) {
            length = node.size();
        } else {
            return result;
        }
        if (length < min) {
            result.addError(field, ErrorKind.USER_RULE, "should be at least " + min + " long");
        } else if (length > max) {
            result.addError(field, ErrorKind.USER_RULE, "should be at most " + max + " long");
        }
        return result;
    }

    /** Appends a custom error on {@code field}. */
    public static ValidationResult error(ValidationResult result, String field, String message) {
        return result.addError(field, ErrorKind.USER_RULE, message);
    }

    private static boolean sameValue(JsonNode expected, JsonNode actual) {
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }
}
