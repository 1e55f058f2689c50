package io.github.reugn.bind4j.syntax;

/**
 * A node of the syntax tree handled by the expander.
 * <p>
 * Forms are immutable. {@link #toString()} prints canonical s-expression text,
 * which {@link FormReader} reads back to an equal form (except for generated
 * symbols and placeholders, which have no readable syntax).
 */
public sealed interface Form permits Symbol, Literal, ListForm, VectorForm, Placeholder {

    /**
     * Returns {@code true} if this form is a {@link Placeholder} or contains one
     * at any depth.
     */
    default boolean containsPlaceholder() {
        return false;
    }
}
