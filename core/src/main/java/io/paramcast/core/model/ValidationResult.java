package io.paramcast.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The changeset of one cast call: what was supplied, what it was coerced to, and what failed.
 *
 * <p>
 * A result is <em>open</em> while the caster and the validation hook build it and
 * <em>sealed</em> once the cast call returns. Mutators throw {@link IllegalStateException} on a
 * sealed result, and the projector refuses open ones. Results are never shared across calls.
 *
 * <p>
 * Errors of nested results are copied into their parent under the embed's path, so
 * {@link #isValid()} of the root reflects the whole tree while each nested result still reports
 * its own errors relative to itself.
 */
public final class ValidationResult {

    private final Schema schema;
    private final ObjectNode target;
    private final Map<String, Change> changes = new LinkedHashMap<>();
    private final List<FieldError> errors = new ArrayList<>();
    private final Map<String, Presence> presence = new LinkedHashMap<>();
    private boolean sealed;

    private ValidationResult(Schema schema, ObjectNode target) {
        this.schema = schema;
        this.target = target;
    }

    /**
     * Opens a result for {@code schema} on top of pre-existing data.
     *
     * @param schema the schema being cast
     * @param target pre-existing data, or {@code null} for the schema's zero value
     * @return a new open result with no changes or errors
     */
    public static ValidationResult open(Schema schema, ObjectNode target) {
        Objects.requireNonNull(schema, "schema must not be null");
        return new ValidationResult(schema, target != null ? target.deepCopy() : schema.zeroValue());
    }

    /** Opens a result for {@code schema} on top of its zero value. */
    public static ValidationResult open(Schema schema) {
        return open(schema, null);
    }

    public Schema schema() {
        return schema;
    }

    /** Pre-existing data the changes apply to. A copy. */
    public ObjectNode target() {
        return target.deepCopy();
    }

    /** Changes keyed by field name, in the order they were recorded. */
    public Map<String, Change> changes() {
        return Collections.unmodifiableMap(changes);
    }

    public Optional<Change> change(String field) {
        return Optional.ofNullable(changes.get(field));
    }

    public boolean hasChange(String field) {
        return changes.containsKey(field);
    }

    /** The coerced value of a scalar change, if the field has one. */
    public Optional<JsonNode> changedValue(String field) {
        return change(field)
                .filter(Change.Value.class::isInstance)
                .map(c -> ((Change.Value) c).value());
    }

    /** The nested result of an EmbedOne change, if the field has one. */
    public Optional<ValidationResult> nested(String field) {
        return change(field).filter(Change.One.class::isInstance).map(c -> ((Change.One) c).result());
    }

    /** The nested results of an EmbedMany change, empty if the field has none. */
    public List<ValidationResult> nestedMany(String field) {
        return change(field)
                .filter(Change.Many.class::isInstance)
                .map(c -> ((Change.Many) c).results())
                .orElse(List.of());
    }

    /** All errors of this result and, under their paths, of its nested results. */
    public List<FieldError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Errors whose path is exactly {@code path}. */
    public List<FieldError> errorsAt(FieldPath path) {
        return errors.stream().filter(e -> e.path().equals(path)).toList();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** How {@code field} appeared in the raw input, as captured at cast time. */
    public Presence presence(String field) {
        return presence.getOrDefault(field, Presence.ABSENT);
    }

    public boolean isSealed() {
        return sealed;
    }

    // --- Mutators (open results only) ---

    /** Records a coerced scalar change. */
    public ValidationResult putChange(String field, JsonNode value) {
        return putChange(field, new Change.Value(value));
    }

    /** Records a change of any shape. */
    public ValidationResult putChange(String field, Change change) {
        ensureOpen();
        requireField(field);
        Objects.requireNonNull(change, "change must not be null");
        changes.put(field, change);
        return this;
    }

    public ValidationResult removeChange(String field) {
        ensureOpen();
        changes.remove(field);
        return this;
    }

    public ValidationResult addError(FieldError error) {
        ensureOpen();
        errors.add(Objects.requireNonNull(error, "error must not be null"));
        return this;
    }

    public ValidationResult addError(FieldPath path, ErrorKind kind, String message) {
        return addError(new FieldError(path, kind, message));
    }

    /** Records an error on a top-level field of this result. */
    public ValidationResult addError(String field, ErrorKind kind, String message) {
        return addError(FieldPath.of(field), kind, message);
    }

    /** Copies the errors of a nested result into this one, re-rooted under {@code prefix}. */
    public ValidationResult absorbErrors(FieldPath prefix, ValidationResult nested) {
        ensureOpen();
        for (FieldError error : nested.errors) {
            errors.add(error.under(prefix));
        }
        return this;
    }

    /** Records how {@code field} appeared in the raw input. */
    public ValidationResult recordPresence(String field, Presence fieldPresence) {
        ensureOpen();
        requireField(field);
        presence.put(field, Objects.requireNonNull(fieldPresence, "presence must not be null"));
        return this;
    }

    /**
     * Copies the presence captured on {@code source} for every field this result has not recorded
     * itself.
     */
    public ValidationResult inheritPresence(ValidationResult source) {
        ensureOpen();
        source.presence.forEach(presence::putIfAbsent);
        return this;
    }

    /**
     * Seals this result and every nested result reachable through its changes. Idempotent.
     *
     * @return this result
     */
    public ValidationResult seal() {
        if (sealed) {
            return this;
        }
        for (Change change : changes.values()) {
            if (change instanceof Change.One one) {
                one.result().seal();
            } else if (change instanceof Change.Many many) {
                many.results().forEach(ValidationResult::seal);
            }
        }
        sealed = true;
        return this;
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("ValidationResult for schema '" + schema.name() + "' is sealed");
        }
    }

    private void requireField(String field) {
        if (!schema.hasField(field)) {
            throw new IllegalArgumentException("Schema '" + schema.name() + "' has no field '" + field + "'");
        }
    }

    @Override
    public String toString() {
        return "ValidationResult[" + schema.name() + ", valid=" + isValid() + ", changes=" + changes.keySet()
                + ", errors=" + errors + "]";
    }
}
