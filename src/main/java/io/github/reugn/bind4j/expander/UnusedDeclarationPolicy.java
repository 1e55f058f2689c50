package io.github.reugn.bind4j.expander;

import java.util.Locale;

/**
 * What to do with declarations no binding claimed.
 *
 * <p>The process-wide default is read from the system property
 * {@value #PROPERTY} using the option spellings {@code print-warning},
 * {@code warn} and {@code error}; it falls back to {@link #PRINT_WARNING}.
 */
public enum UnusedDeclarationPolicy {
    /**
     * Print every unused declaration as a note, then report a warning.
     */
    PRINT_WARNING("print-warning"),
    /**
     * Report a warning only.
     */
    WARN_ONLY("warn"),
    /**
     * Fail the expansion with {@link io.github.reugn.bind4j.UnusedDeclarationsException}.
     */
    ERROR("error");

    public static final String PROPERTY = "bind4j.unused-declarations";

    private final String option;

    UnusedDeclarationPolicy(String option) {
        this.option = option;
    }

    public String option() {
        return option;
    }

    /**
     * Parses an option spelling, case-insensitively. Enum constant names are accepted too.
     *
     * @throws IllegalArgumentException for an unknown spelling
     */
    public static UnusedDeclarationPolicy fromOption(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (UnusedDeclarationPolicy policy : values()) {
            if (policy.option.equals(normalized) || policy.name().equalsIgnoreCase(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown unused-declaration policy '" + value
                + "'. Use 'print-warning', 'warn' or 'error'.");
    }

    /**
     * Reads the policy from {@value #PROPERTY}.
     */
    public static UnusedDeclarationPolicy fromSystemProperty() {
        String value = System.getProperty(PROPERTY);
        return value == null || value.isBlank() ? PRINT_WARNING : fromOption(value);
    }
}
