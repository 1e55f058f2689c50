package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Placeholder;
import io.github.reugn.bind4j.syntax.Symbol;
import io.github.reugn.bind4j.syntax.VectorForm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Completes a binding's fragment with its declare clause and the expansion of
 * the remaining bindings.
 *
 * <p>Exactly one strategy applies, in this order:
 * <ol>
 *   <li><b>Substitution</b> - every {@link Placeholder#DECLARATIONS} becomes the
 *       declare clause (or nothing), every {@link Placeholder#BODY_FORMS} the
 *       spliced body forms and every {@link Placeholder#BODY} the body as one
 *       form, at any depth</li>
 *   <li><b>Trailing extension</b> - declare clause and body are appended to the
 *       last element of the fragment</li>
 *   <li><b>Merge</b> - {@code (let* (a))} around {@code (let* (b) ...)} becomes
 *       {@code (let* (a b) ...)}</li>
 *   <li><b>Nesting</b> - declare clause and body are appended to the fragment</li>
 * </ol>
 *
 * <p>A {@code (progn ...)} body is spliced into implicit body positions. In an
 * expression position ({@link Placeholder#BODY}) it stays one form.
 *
 * <p>Without a {@link Placeholder#DECLARATIONS} placeholder the declare clause
 * goes in front of the first body. When that body is a {@link Placeholder#BODY},
 * the clause and the body are wrapped in {@code (locally ...)}.
 */
final class FragmentCombiner {

    static final Set<String> MERGEABLE_HEADS = Set.of("let*");

    private FragmentCombiner() {
    }

    static ListForm combine(SyntaxFragment fragment, Optional<ListForm> declare, Form inner) {
        List<Form> declarations = declare.<List<Form>>map(List::of).orElse(List.of());
        List<Form> body = bodyForms(inner);

        if (fragment.containsPlaceholder()) {
            return substitute(fragment.forms(), declarations, body);
        }
        if (fragment.extendsTrailing()) {
            return extendTrailing(fragment.forms(), declarations, body);
        }
        Optional<ListForm> merged = merge(fragment.forms(), declarations, inner);
        if (merged.isPresent()) {
            return merged.get();
        }
        List<Form> nested = new ArrayList<>(fragment.forms());
        nested.addAll(declarations);
        nested.addAll(body);
        return new ListForm(nested);
    }

    /**
     * Returns the forms a continuation contributes to a body position.
     */
    static List<Form> bodyForms(Form inner) {
        if (inner instanceof ListForm list && list.isHeaded("progn")) {
            return list.rest();
        }
        return List.of(inner);
    }

    // ==================== SUBSTITUTION ====================

    private static ListForm substitute(List<Form> forms, List<Form> declarations, List<Form> body) {
        boolean hasDeclarations = occurs(forms, Placeholder.DECLARATIONS);
        boolean hasBody = occurs(forms, Placeholder.BODY) || occurs(forms, Placeholder.BODY_FORMS);
        Substitution substitution = new Substitution(
                hasDeclarations ? declarations : List.of(), body, hasDeclarations ? List.of() : declarations);
        List<Form> out = substitution.rewrite(forms);
        if (!hasBody) {
            out.addAll(body);
        }
        return new ListForm(out);
    }

    private static boolean occurs(List<Form> forms, Placeholder placeholder) {
        for (Form form : forms) {
            if (form == placeholder) {
                return true;
            }
            if (form instanceof ListForm list && occurs(list.elements(), placeholder)) {
                return true;
            }
            if (form instanceof VectorForm vector && occurs(vector.elements(), placeholder)) {
                return true;
            }
        }
        return false;
    }

    private static final class Substitution {
        private final List<Form> declarations;
        private final List<Form> body;
        private List<Form> leadingDeclarations;

        Substitution(List<Form> declarations, List<Form> body, List<Form> leadingDeclarations) {
            this.declarations = declarations;
            this.body = body;
            this.leadingDeclarations = leadingDeclarations;
        }

        List<Form> rewrite(List<Form> forms) {
            List<Form> out = new ArrayList<>(forms.size() + body.size());
            for (Form form : forms) {
                if (form == Placeholder.BODY_FORMS) {
                    out.addAll(takeLeadingDeclarations());
                    out.addAll(body);
                } else if (form == Placeholder.BODY) {
                    out.add(singleForm(takeLeadingDeclarations()));
                } else if (form == Placeholder.DECLARATIONS) {
                    out.addAll(declarations);
                } else if (form instanceof ListForm list && list.containsPlaceholder()) {
                    out.add(new ListForm(rewrite(list.elements())));
                } else if (form instanceof VectorForm vector && vector.containsPlaceholder()) {
                    out.add(new VectorForm(rewrite(vector.elements())));
                } else {
                    out.add(form);
                }
            }
            return out;
        }

        private List<Form> takeLeadingDeclarations() {
            List<Form> taken = leadingDeclarations;
            leadingDeclarations = List.of();
            return taken;
        }

        // declare is only allowed at the head of a body
        private Form singleForm(List<Form> leading) {
            if (leading.isEmpty() && body.size() == 1) {
                return body.get(0);
            }
            List<Form> elements = new ArrayList<>(leading.size() + body.size() + 1);
            elements.add(Symbol.of(leading.isEmpty() ? "progn" : "locally"));
            elements.addAll(leading);
            elements.addAll(body);
            return new ListForm(elements);
        }
    }

    // ==================== TRAILING EXTENSION ====================

    private static ListForm extendTrailing(List<Form> forms, List<Form> declarations, List<Form> body) {
        Form last = forms.get(forms.size() - 1);
        if (!(last instanceof ListForm trailing)) {
            throw new IllegalStateException("Fragment to extend must end with a list: " + last);
        }
        List<Form> extended = new ArrayList<>(trailing.elements());
        extended.addAll(declarations);
        extended.addAll(body);

        List<Form> out = new ArrayList<>(forms.subList(0, forms.size() - 1));
        out.add(new ListForm(extended));
        return new ListForm(out);
    }

    // ==================== MERGE ====================

    private static Optional<ListForm> merge(List<Form> forms, List<Form> declarations, Form inner) {
        if (forms.size() != 2
                || !(forms.get(0) instanceof Symbol head)
                || head.generated()
                || !MERGEABLE_HEADS.contains(head.name())
                || !(forms.get(1) instanceof ListForm outerBindings)) {
            return Optional.empty();
        }
        if (!(inner instanceof ListForm innerForm)
                || innerForm.size() < 2
                || !innerForm.isHeaded(head.name())
                || !(innerForm.get(1) instanceof ListForm innerBindings)) {
            return Optional.empty();
        }
        // a rebound name would pick up the outer declarations
        Set<Symbol> outerNames = boundNames(outerBindings);
        for (Symbol name : boundNames(innerBindings)) {
            if (outerNames.contains(name)) {
                return Optional.empty();
            }
        }

        List<Form> mergedBindings = new ArrayList<>(outerBindings.elements());
        mergedBindings.addAll(innerBindings.elements());

        List<Form> out = new ArrayList<>();
        out.add(head);
        out.add(new ListForm(mergedBindings));
        out.addAll(declarations);
        out.addAll(innerForm.elements().subList(2, innerForm.size()));
        return Optional.of(new ListForm(out));
    }

    private static Set<Symbol> boundNames(ListForm bindings) {
        Set<Symbol> names = new HashSet<>();
        for (Form binding : bindings.elements()) {
            if (binding instanceof Symbol symbol) {
                names.add(symbol);
            } else if (binding instanceof ListForm list && !list.isEmpty() && list.get(0) instanceof Symbol symbol) {
                names.add(symbol);
            }
        }
        return names;
    }
}
