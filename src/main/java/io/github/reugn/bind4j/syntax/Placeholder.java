package io.github.reugn.bind4j.syntax;

/**
 * Reserved markers inside a binding-form template.
 *
 * <p><b>Markers:</b>
 * <ul>
 *   <li>{@link #BODY} - replaced by the continuation as a single form, wrapped in
 *       {@code progn} when it holds zero or several forms; safe in any expression
 *       position, e.g. the protected form of {@code unwind-protect}</li>
 *   <li>{@link #BODY_FORMS} - replaced by the continuation's forms spliced in
 *       place; only valid where the construct takes an implicit body</li>
 *   <li>{@link #DECLARATIONS} - replaced by the declare clause owned by the
 *       binding, or by nothing when no declaration applies</li>
 * </ul>
 */
public enum Placeholder implements Form {
    BODY("<body>"),
    BODY_FORMS("<body-forms>"),
    DECLARATIONS("<declarations>");

    private final String text;

    Placeholder(String text) {
        this.text = text;
    }

    @Override
    public boolean containsPlaceholder() {
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}
