package io.paramcast.core.model;

import java.util.Locale;

/**
 * Output projection variant.
 *
 * <ul>
 * <li>{@link #MAP}: fields the caller never mentioned and that carry no default are omitted
 * from the output object (default).</li>
 * <li>{@link #STRUCT}: every declared field is present, untouched ones holding their zero
 * value.</li>
 * </ul>
 */
public enum OutputMode {
    /** Omit untouched optional fields. */
    MAP,

    /** Keep the full typed value with all fields present. */
    STRUCT;

    /**
     * Parses a mode name as written in configuration ({@code map} or {@code struct}, any case).
     *
     * @param value the configured value
     * @return the matching mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static OutputMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("output mode must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "map" -> MAP;
            case "struct" -> STRUCT;
            default -> throw new IllegalArgumentException(
                    "Unknown output mode '" + value + "' — expected one of: map, struct");
        };
    }
}
