package io.paramcast.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a field inside a (possibly nested) input, as the sequence of field names from the
 * root. Elements of an embedded array are addressed by their decimal index, so the second
 * location's latitude renders as {@code near_locations.1.latitude}.
 *
 * @param segments path segments from root to field, empty for the root itself
 */
public record FieldPath(List<String> segments) {

    private static final FieldPath ROOT = new FieldPath(List.of());

    public FieldPath {
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    /** The empty path, addressing the input as a whole. */
    public static FieldPath root() {
        return ROOT;
    }

    /** Creates a path from the given segments. */
    public static FieldPath of(String... segments) {
        return new FieldPath(List.of(segments));
    }

    /** Returns this path extended by a field name. */
    public FieldPath child(String name) {
        Objects.requireNonNull(name, "name must not be null");
        List<String> next = new ArrayList<>(segments);
        next.add(name);
        return new FieldPath(next);
    }

    /** Returns this path extended by an array index. */
    public FieldPath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        return child(Integer.toString(index));
    }

    /** Returns {@code prefix} followed by this path. */
    public FieldPath under(FieldPath prefix) {
        if (prefix.isRoot()) {
            return this;
        }
        List<String> next = new ArrayList<>(prefix.segments);
        next.addAll(segments);
        return new FieldPath(next);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** The last segment, or {@code null} for the root. */
    public String leaf() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    @Override
    public String toString() {
        return segments.isEmpty() ? "<root>" : String.join(".", segments);
    }
}
