package io.github.reugn.bind4j.syntax;

import java.util.Objects;

/**
 * A symbol. Keywords are symbols whose name starts with a colon.
 * <p>
 * Generated symbols stand for synthetic variables introduced by the expander.
 * They print as {@code #:name} and never equal a symbol of the same name that
 * came from source text.
 * <p>
 * Generated symbols compare by name. Numbering restarts with every top-level
 * expansion, so {@code #:ignore1} from one expansion equals {@code #:ignore1}
 * from another. Feeding one expansion's output into another as a value form can
 * therefore capture a synthetic variable.
 *
 * @param name      the symbol name
 * @param generated {@code true} for synthetic symbols
 */
public record Symbol(String name, boolean generated) implements Form {

    public static final Symbol NIL = of("nil");

    public Symbol {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
    }

    public static Symbol of(String name) {
        return new Symbol(name, false);
    }

    public static Symbol generated(String name) {
        return new Symbol(name, true);
    }

    public boolean isKeyword() {
        return !generated && name.startsWith(":");
    }

    /**
     * Checks whether this is the source symbol with the given name.
     */
    public boolean is(String other) {
        return !generated && name.equals(other);
    }

    @Override
    public String toString() {
        return generated ? "#:" + name : name;
    }
}
