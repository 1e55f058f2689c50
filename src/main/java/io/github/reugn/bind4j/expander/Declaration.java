package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;

import java.util.Objects;

/**
 * An atomic declaration specifier.
 * <p>
 * Variable kinds always carry exactly one target, e.g. {@code (type integer a)}
 * or {@code (ignore b)}. Non-variable kinds have no target and keep their
 * specifier as written, e.g. {@code (optimize (speed 3))}.
 *
 * @param kind      the declaration kind
 * @param target    the declared variable or function reference, {@code null} for non-variable kinds
 * @param specifier the atomic specifier as it is emitted inside {@code (declare ...)}
 */
public record Declaration(DeclarationKind kind, Form target, ListForm specifier) {

    public Declaration {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(specifier, "specifier");
        if (kind.isVariable() && target == null) {
            throw new IllegalArgumentException("Variable declaration requires a target: " + specifier);
        }
    }

    public boolean hasTarget() {
        return target != null;
    }

    @Override
    public String toString() {
        return specifier.toString();
    }
}
