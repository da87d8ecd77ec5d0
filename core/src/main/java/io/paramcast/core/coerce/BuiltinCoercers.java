package io.paramcast.core.coerce;

import io.paramcast.core.spi.TypeCoercer;
import java.util.List;

/** The coercers every {@code CoercerRegistry.withBuiltins()} registry starts with. */
public final class BuiltinCoercers {

    private BuiltinCoercers() {}

    /**
     * Returns fresh instances of all built-in coercers: {@code string}, {@code integer},
     * {@code id}, {@code float}, {@code decimal}, {@code boolean}, {@code date}, {@code time},
     * {@code naive_datetime}, {@code utc_datetime}, {@code binary_id}, {@code map}, {@code any}.
     */
    public static List<TypeCoercer> all() {
        return List.of(
                new StringCoercer(),
                new IntegerCoercer(),
                new IntegerCoercer("id"),
                new FloatCoercer(),
                new DecimalCoercer(),
                new BooleanCoercer(),
                TemporalCoercer.date(),
                TemporalCoercer.time(),
                TemporalCoercer.naiveDateTime(),
                TemporalCoercer.utcDateTime(),
                new UuidCoercer(),
                PassthroughCoercer.map(),
                PassthroughCoercer.any());
    }
}
