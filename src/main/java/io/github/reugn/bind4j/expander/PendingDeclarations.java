package io.github.reugn.bind4j.expander;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Declarations not yet claimed by a binding during one top-level expansion.
 * <p>
 * Not thread-safe. Each expansion owns its own instance; nested expansions
 * never share one.
 */
final class PendingDeclarations {

    private final List<Declaration> declarations;

    PendingDeclarations(Collection<Declaration> declarations) {
        this.declarations = new ArrayList<>(declarations);
    }

    /**
     * Removes and returns every pending declaration accepted by the predicate,
     * preserving order.
     */
    List<Declaration> claim(Predicate<Declaration> owned) {
        List<Declaration> claimed = new ArrayList<>();
        Iterator<Declaration> it = declarations.iterator();
        while (it.hasNext()) {
            Declaration declaration = it.next();
            if (owned.test(declaration)) {
                claimed.add(declaration);
                it.remove();
            }
        }
        return claimed;
    }

    List<Declaration> remaining() {
        return List.copyOf(declarations);
    }

    boolean isEmpty() {
        return declarations.isEmpty();
    }

    int size() {
        return declarations.size();
    }
}
