package io.paramcast.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/** A value the caller supplied for one field, recorded in a {@link ValidationResult}. */
public sealed interface Change permits Change.Value, Change.One, Change.Many {

    /** A coerced scalar or scalar array. */
    record Value(JsonNode value) implements Change {
        public Value {
            Objects.requireNonNull(value, "value must not be null");
            value = value.deepCopy();
        }

        /** Returns a copy so the recorded change cannot be altered through it. */
        @Override
        public JsonNode value() {
            return value.deepCopy();
        }
    }

    /** The nested result of an EmbedOne field. */
    record One(ValidationResult result) implements Change {
        public One {
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    /** The nested results of an EmbedMany field, in input order. */
    record Many(List<ValidationResult> results) implements Change {
        public Many {
            results = List.copyOf(results);
        }
    }
}
