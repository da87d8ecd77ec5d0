package io.paramcast.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paramcast.core.model.Change;
import io.paramcast.core.model.ErrorKind;
import io.paramcast.core.model.FieldDescriptor;
import io.paramcast.core.model.FieldKind;
import io.paramcast.core.model.FieldPath;
import io.paramcast.core.model.Presence;
import io.paramcast.core.model.Schema;
import io.paramcast.core.model.ValidationResult;
import io.paramcast.core.spi.TypeCoercer;
import io.paramcast.core.spi.ValidationHook;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Casts raw input against a compiled {@link Schema}, producing a sealed {@link ValidationResult}.
 *
 * <p>
 * Fields are processed in four buckets: required scalars, optional scalars, required relations
 * and optional relations. Every field and every embedded element is evaluated; errors accumulate
 * and never short-circuit. Invalid input never throws. Exceptions raised by a coercer or hook are
 * propagated as-is.
 *
 * <p>
 * Thread-safe: holds no per-call state.
 */
public final class Caster {

    private static final Logger LOG = LoggerFactory.getLogger(Caster.class);

    private final CoercerRegistry coercerRegistry;

    public Caster(CoercerRegistry coercerRegistry) {
        this.coercerRegistry = Objects.requireNonNull(coercerRegistry, "coercerRegistry must not be null");
    }

    /**
     * Casts {@code rawInput} against {@code schema}.
     *
     * @param schema   the compiled schema
     * @param target   pre-existing data, or {@code null} for the schema's zero value
     * @param rawInput raw input; anything but an object yields an invalid result
     * @param hook     per-call hook, or {@code null} to use the schema's own (or the identity hook)
     * @return the sealed result
     */
    public ValidationResult cast(Schema schema, ObjectNode target, JsonNode rawInput, ValidationHook hook) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rawInput, "rawInput must not be null");

        ValidationResult result = castFields(schema, target, rawInput);

        ValidationHook effective = hook != null ? hook : schema.hook().orElse(ValidationHook.identity());
        ValidationResult accepted = effective.validate(result, rawInput);
        if (accepted == null) {
            throw new NullPointerException("ValidationHook returned null for schema '" + schema.name() + "'");
        }
        if (accepted.schema() != schema) {
            throw new IllegalStateException("ValidationHook for schema '" + schema.name()
                    + "' returned a result for schema '" + accepted.schema().name() + "'");
        }
        if (accepted != result) {
            // Presence describes the raw input, not the hook's view of it
            accepted.inheritPresence(result);
        }
        return accepted.seal();
    }

    private ValidationResult castFields(Schema schema, ObjectNode target, JsonNode rawInput) {
        ValidationResult result = ValidationResult.open(schema, target);
        if (!rawInput.isObject()) {
            result.addError(
                    FieldPath.root(), ErrorKind.INVALID_RELATION, "expected an object, got: " + rawInput.getNodeType());
            return result;
        }

        List<FieldDescriptor> requiredScalars = new ArrayList<>();
        List<FieldDescriptor> optionalScalars = new ArrayList<>();
        List<FieldDescriptor> requiredRelations = new ArrayList<>();
        List<FieldDescriptor> optionalRelations = new ArrayList<>();
        for (FieldDescriptor field : schema.fields()) {
            result.recordPresence(field.name(), Presence.of(rawInput, field.name()));
            if (field.isRelation()) {
                (field.required() ? requiredRelations : optionalRelations).add(field);
            } else {
                (field.required() ? requiredScalars : optionalScalars).add(field);
            }
        }

        requiredScalars.forEach(field -> castScalar(result, field, rawInput));
        optionalScalars.forEach(field -> castScalar(result, field, rawInput));
        requiredRelations.forEach(field -> castRelation(result, field, rawInput));
        optionalRelations.forEach(field -> castRelation(result, field, rawInput));

        LOG.debug(
                "Cast schema '{}': changes={}, errors={}",
                schema.name(),
                result.changes().keySet(),
                result.errors().size());
        return result;
    }

    private void castScalar(ValidationResult result, FieldDescriptor field, JsonNode rawInput) {
        String name = field.name();
        Presence presence = result.presence(name);
        if (presence == Presence.VALUE) {
            Optional<JsonNode> coerced = coerce(field, rawInput.get(name));
            if (coerced.isPresent()) {
                result.putChange(name, coerced.get());
            } else {
                LOG.debug("Field '{}.{}' failed coercion to {}", result.schema().name(), name, field.kind());
                result.addError(FieldPath.of(name), ErrorKind.TYPE_MISMATCH, "is invalid");
            }
        } else if (field.required()) {
            result.addError(FieldPath.of(name), ErrorKind.MISSING_REQUIRED, "can't be blank");
        }
    }

    private Optional<JsonNode> coerce(FieldDescriptor field, JsonNode raw) {
        FieldKind kind = field.kind();
        if (kind instanceof FieldKind.Scalar scalar) {
            return coercerRegistry.requireCoercer(scalar.type()).coerce(raw, field.options().coercionOptions());
        }
        FieldKind.Array array = (FieldKind.Array) kind;
        if (!raw.isArray()) {
            return Optional.empty();
        }
        TypeCoercer coercer = coercerRegistry.requireCoercer(array.elementType());
        ArrayNode out = JsonNodeFactory.instance.arrayNode(raw.size());
        for (JsonNode element : raw) {
            if (element.isNull()) {
                out.addNull();
                continue;
            }
            Optional<JsonNode> coerced = coercer.coerce(element, field.options().coercionOptions());
            if (coerced.isEmpty()) {
                return Optional.empty();
            }
            out.add(coerced.get());
        }
        return Optional.of(out);
    }

    private void castRelation(ValidationResult result, FieldDescriptor field, JsonNode rawInput) {
        String name = field.name();
        FieldPath path = FieldPath.of(name);
        Presence presence = result.presence(name);
        JsonNode raw = rawInput.get(name);

        if (field.kind() instanceof FieldKind.EmbedOne one) {
            if (presence == Presence.VALUE) {
                if (raw.isObject()) {
                    ValidationResult nested = cast(one.schema(), null, raw, null);
                    result.putChange(name, new Change.One(nested));
                    result.absorbErrors(path, nested);
                } else {
                    result.addError(path, ErrorKind.INVALID_RELATION, "expected an object, got: " + raw.getNodeType());
                }
            } else if (field.required()) {
                result.addError(path, ErrorKind.MISSING_REQUIRED, "can't be blank");
            }
            return;
        }

        FieldKind.EmbedMany many = (FieldKind.EmbedMany) field.kind();
        if (presence == Presence.VALUE) {
            if (raw.isArray()) {
                List<ValidationResult> elements = new ArrayList<>(raw.size());
                for (int i = 0; i < raw.size(); i++) {
                    ValidationResult nested = cast(many.schema(), null, raw.get(i), null);
                    elements.add(nested);
                    result.absorbErrors(path.index(i), nested);
                }
                result.putChange(name, new Change.Many(elements));
                if (field.required() && elements.isEmpty()) {
                    result.addError(path, ErrorKind.MISSING_REQUIRED, "can't be blank");
                }
            } else {
                result.addError(path, ErrorKind.INVALID_RELATION, "expected an array, got: " + raw.getNodeType());
            }
        } else if (field.required()) {
            result.addError(path, ErrorKind.MISSING_REQUIRED, "can't be blank");
        }
    }
}
