package io.covenantc.core.engine;

import java.util.Locale;

/**
 * Whether published argument schemas are enforced at compile time.
 *
 * <ul>
 * <li>{@link #STRICT} — stateful arguments are validated against a branch's schema before
 * coercion. Non-conforming arguments fail the branch as an argument coercion failure.</li>
 * <li>{@link #LENIENT} — schemas are descriptive only (default).</li>
 * </ul>
 */
public enum SchemaValidationMode {
    /** Validate stateful arguments against the branch schema before coercion. */
    STRICT,

    /** Skip compile-time schema validation (default). */
    LENIENT;

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @throws IllegalArgumentException for anything other than {@code strict} or {@code lenient}
     */
    public static SchemaValidationMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("schema validation mode must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> STRICT;
            case "lenient" -> LENIENT;
            default -> throw new IllegalArgumentException(
                    "Unknown schema validation mode '" + value + "', expected 'strict' or 'lenient'");
        };
    }
}
