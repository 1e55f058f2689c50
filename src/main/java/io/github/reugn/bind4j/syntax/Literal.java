package io.github.reugn.bind4j.syntax;

import java.util.Objects;

/**
 * A self-evaluating constant: a number, string or character.
 *
 * @param value the constant value
 */
public record Literal(Object value) implements Form {

    public Literal {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof Number || value instanceof String
                || value instanceof Character)) {
            throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
        }
    }

    public static Literal of(Object value) {
        return new Literal(value);
    }

    @Override
    public String toString() {
        if (value instanceof String s) {
            return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        if (value instanceof Character c) {
            return "#\\" + c;
        }
        return value.toString();
    }
}
