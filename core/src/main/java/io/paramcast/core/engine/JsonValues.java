package io.paramcast.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Shared value-tree helpers for the projector.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonValues {

    private JsonValues() {}

    /**
     * Determines if a node leaves its path unset for the purpose of default filling.
     *
     * <ul>
     * <li>{@code null}, {@code MissingNode}, {@code NullNode} → unset</li>
     * <li>empty array (the zero value of an embedded array) → unset</li>
     * <li>anything else, including an empty object → set</li>
     * </ul>
     */
    public static boolean isUnset(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        return node.isArray() && node.isEmpty();
    }

    /** Unset, or an empty object: a value map-mode output drops for untouched fields. */
    public static boolean isEmptyValue(JsonNode node) {
        return isUnset(node) || (node.isObject() && node.isEmpty());
    }

    /**
     * Returns a copy of {@code node} without its top-level unset entries ({@code null}s and empty
     * arrays), so that laying it over another value never blanks a path.
     */
    public static ObjectNode withoutUnset(ObjectNode node) {
        ObjectNode copy = node.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> it = copy.fields();
        while (it.hasNext()) {
            if (isUnset(it.next().getValue())) {
                it.remove();
            }
        }
        return copy;
    }

    /**
     * Deep-sets every value of {@code defaults} into {@code target} where the path is unset.
     * Where both sides hold objects the merge recurses; a path already holding any other set value
     * keeps it. Mutates and returns {@code target}; the values set are copies.
     *
     * @param target   accumulated value
     * @param defaults default values, same shape
     * @return {@code target}
     */
    public static ObjectNode fillUnset(ObjectNode target, ObjectNode defaults) {
        for (Map.Entry<String, JsonNode> entry : defaults.properties()) {
            String key = entry.getKey();
            JsonNode current = target.get(key);
            JsonNode fallback = entry.getValue();
            if (isUnset(current)) {
                target.set(key, fallback.deepCopy());
            } else if (current.isObject() && fallback.isObject()) {
                fillUnset((ObjectNode) current, (ObjectNode) fallback);
            }
        }
        return target;
    }
}
