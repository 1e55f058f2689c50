package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decides which pending declarations belong to a binding.
 *
 * <p>A declaration is applicable to a binding when:
 * <ul>
 *   <li>its kind is non-variable, or</li>
 *   <li>its target, after unwrapping {@code (function f)} to {@code f}, is one
 *       of the names the binding owns</li>
 * </ul>
 *
 * <p>Applicable declarations are removed from the pending set, so the first
 * binding that owns a name receives every declaration about it.
 */
final class DeclarationFilter {

    private DeclarationFilter() {
    }

    /**
     * Claims the declarations applicable to a binding owning {@code ownedNames}.
     *
     * @param pending    the pending set, mutated in place
     * @param ownedNames every variable or function name the binding introduces
     * @return the claimed declarations in source order, possibly empty
     */
    static List<Declaration> filter(PendingDeclarations pending, Collection<Symbol> ownedNames) {
        return pending.claim(declaration -> isApplicable(declaration, ownedNames));
    }

    static boolean isApplicable(Declaration declaration, Collection<Symbol> ownedNames) {
        if (!declaration.kind().isVariable()) {
            return true;
        }
        Form target = resolveTarget(declaration.target());
        return target instanceof Symbol symbol && ownedNames.contains(symbol);
    }

    /**
     * Unwraps one level of {@code (function name)}.
     */
    static Form resolveTarget(Form target) {
        if (target instanceof ListForm list && list.size() == 2 && list.isHeaded("function")) {
            return list.get(1);
        }
        return target;
    }

    /**
     * Groups specifiers into a single {@code (declare ...)} form.
     *
     * @param declarations claimed declarations
     * @param ignorable    synthetic names to declare ignorable
     * @return the declare form, or empty when there is nothing to declare
     */
    static Optional<ListForm> declareForm(List<Declaration> declarations, List<Symbol> ignorable) {
        if (declarations.isEmpty() && ignorable.isEmpty()) {
            return Optional.empty();
        }
        List<Form> elements = new ArrayList<>(declarations.size() + 2);
        elements.add(Symbol.of("declare"));
        for (Declaration declaration : declarations) {
            elements.add(declaration.specifier());
        }
        if (!ignorable.isEmpty()) {
            List<Form> spec = new ArrayList<>(ignorable.size() + 1);
            spec.add(Symbol.of("ignorable"));
            spec.addAll(ignorable);
            elements.add(new ListForm(spec));
        }
        return Optional.of(new ListForm(elements));
    }
}
