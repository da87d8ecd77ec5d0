package io.paramcast.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.paramcast.core.model.CastResult;
import io.paramcast.core.model.Change;
import io.paramcast.core.model.FieldDescriptor;
import io.paramcast.core.model.FieldKind;
import io.paramcast.core.model.OutputMode;
import io.paramcast.core.model.Presence;
import io.paramcast.core.model.Schema;
import io.paramcast.core.model.ValidationResult;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects a sealed {@link ValidationResult} into its output value.
 *
 * <p>
 * The value of each level is built in layers, later layers winning:
 * <ol>
 * <li>base: what the lower layers of the parent hold at this level's path, then the set fields
 * of the result's target (in {@link OutputMode#STRUCT} on top of the schema's zero value). Null
 * and empty-array target entries leave the path as the layers below had it.</li>
 * <li>defaults: schema defaults, filled in only where the path is still unset</li>
 * <li>changes: coerced values, with nested results projected recursively on top of what the
 * lower layers hold at their path</li>
 * <li>explicit nulls: fields the caller supplied as {@code null}</li>
 * </ol>
 * In {@link OutputMode#MAP} a field the caller never mentioned, that has no default and whose
 * value is still empty, is dropped.
 *
 * <p>
 * Projection is pure: it reads the result and returns fresh nodes, so it may run any number of
 * times with identical output.
 */
public final class OutputProjector {

    private static final Logger LOG = LoggerFactory.getLogger(OutputProjector.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Projects {@code result} in {@code mode}.
     *
     * @throws IllegalStateException if {@code result} is still open
     */
    public CastResult project(ValidationResult result, OutputMode mode) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (!result.isSealed()) {
            throw new IllegalStateException(
                    "Cannot project an open ValidationResult for schema '" + result.schema().name() + "'");
        }
        if (!result.isValid()) {
            LOG.debug("Not projecting '{}': {} error(s)", result.schema().name(), result.errors().size());
            return CastResult.error(result);
        }
        ObjectNode value = projectLevel(result, mode, null);
        LOG.debug("Projected '{}' in {} mode: fields={}", result.schema().name(), mode, value.size());
        return CastResult.success(value, result);
    }

    /**
     * The defaults tree of {@code schema}: explicit field defaults plus the defaults of embedded
     * single schemas, recursively. In {@link OutputMode#STRUCT} an embedded schema that carries any
     * default expands to its full zero value with the defaults set.
     */
    public ObjectNode defaults(Schema schema, OutputMode mode) {
        ObjectNode out = NODES.objectNode();
        for (FieldDescriptor field : schema.fields()) {
            JsonNode value = null;
            if (field.kind() instanceof FieldKind.EmbedOne one && hasDefaults(one.schema())) {
                ObjectNode nested = defaults(one.schema(), mode);
                value = mode == OutputMode.STRUCT ? one.schema().zeroValue().setAll(nested) : nested;
            }
            JsonNode explicit = field.options().defaultOption().orElse(null);
            if (explicit != null) {
                if (value != null && explicit.isObject()) {
                    value = JsonValues.fillUnset((ObjectNode) explicit, (ObjectNode) value);
                } else {
                    value = explicit;
                }
            }
            if (value != null) {
                out.set(field.name(), value);
            }
        }
        return out;
    }

    private static boolean hasDefaults(Schema schema) {
        for (FieldDescriptor field : schema.fields()) {
            if (field.hasDefault()) {
                return true;
            }
            if (field.kind() instanceof FieldKind.EmbedOne one && hasDefaults(one.schema())) {
                return true;
            }
        }
        return false;
    }

    private ObjectNode projectLevel(ValidationResult result, OutputMode mode, ObjectNode inherited) {
        Schema schema = result.schema();

        ObjectNode value = mode == OutputMode.STRUCT ? schema.zeroValue() : NODES.objectNode();
        if (inherited != null) {
            value.setAll(inherited.deepCopy());
        }
        value.setAll(JsonValues.withoutUnset(result.target()));

        JsonValues.fillUnset(value, defaults(schema, mode));

        for (Map.Entry<String, Change> entry : result.changes().entrySet()) {
            String name = entry.getKey();
            value.set(name, projectChange(entry.getValue(), mode, value.get(name)));
        }

        for (FieldDescriptor field : schema.fields()) {
            if (result.presence(field.name()) == Presence.NULL) {
                value.putNull(field.name());
            }
        }

        if (mode == OutputMode.MAP) {
            for (FieldDescriptor field : schema.fields()) {
                String name = field.name();
                if (result.presence(name) == Presence.ABSENT
                        && !field.hasDefault()
                        && JsonValues.isEmptyValue(value.get(name))) {
                    value.remove(name);
                }
            }
        }
        return value;
    }

    private JsonNode projectChange(Change change, OutputMode mode, JsonNode below) {
        if (change instanceof Change.Value scalar) {
            return scalar.value();
        }
        if (change instanceof Change.One one) {
            return projectLevel(one.result(), mode, asObject(below));
        }
        Change.Many many = (Change.Many) change;
        ArrayNode out = NODES.arrayNode();
        int i = 0;
        for (ValidationResult element : many.results()) {
            JsonNode under = below != null && below.isArray() ? below.get(i) : null;
            out.add(projectLevel(element, mode, asObject(under)));
            i++;
        }
        // Lower-layer elements beyond the supplied ones are kept.
        if (below != null && below.isArray()) {
            for (int j = i; j < below.size(); j++) {
                out.add(below.get(j).deepCopy());
            }
        }
        return out;
    }

    private static ObjectNode asObject(JsonNode node) {
        return node != null && node.isObject() ? (ObjectNode) node : null;
    }
}
