package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Normalizes raw declare clauses into one declaration per variable.
 *
 * <p><b>Normalization rules:</b>
 * <table border="1">
 *   <caption>Raw specifier to atomic declarations</caption>
 *   <tr><th>Raw</th><th>Atomic</th></tr>
 *   <tr><td>{@code (optimize (speed 3))}</td><td>{@code (optimize (speed 3))}</td></tr>
 *   <tr><td>{@code (ignore a b)}</td><td>{@code (ignore a)}, {@code (ignore b)}</td></tr>
 *   <tr><td>{@code (type integer a b)}</td><td>{@code (type integer a)}, {@code (type integer b)}</td></tr>
 *   <tr><td>{@code (fixnum a b)}</td><td>{@code (type fixnum a)}, {@code (type fixnum b)}</td></tr>
 * </table>
 *
 * <p>Emission order follows the input, so diagnostics list unused declarations
 * in the order they were written.
 */
final class DeclarationPreprocessor {

    /**
     * Type names accepted as the abbreviated {@code (typename var...)} form.
     */
    static final Set<String> TYPE_ABBREVIATIONS = Set.of(
            "array", "atom", "bit", "boolean", "character", "cons", "double-float", "fixnum",
            "float", "hash-table", "integer", "keyword", "list", "number", "real", "sequence",
            "simple-string", "simple-vector", "single-float", "string", "symbol", "vector"
    );

    private DeclarationPreprocessor() {
    }

    /**
     * Normalizes a sequence of {@code (declare spec...)} forms.
     *
     * @param declareForms the leading declare forms of a body
     * @return atomic declarations in source order
     * @throws MalformedBindingException if a form is not a declare form or a specifier is malformed
     */
    static List<Declaration> normalize(List<Form> declareForms) {
        List<Declaration> result = new ArrayList<>();
        for (Form form : declareForms) {
            if (!isDeclareForm(form)) {
                throw new MalformedBindingException(form, "Expected a declare form");
            }
            for (Form specifier : ((ListForm) form).rest()) {
                result.addAll(normalizeSpecifier(specifier));
            }
        }
        return result;
    }

    /**
     * Splits a single raw specifier into atomic declarations.
     */
    static List<Declaration> normalizeSpecifier(Form specifier) {
        if (!(specifier instanceof ListForm list) || list.head().isEmpty()) {
            throw new MalformedBindingException(specifier, "Malformed declaration specifier");
        }
        Symbol head = list.head().get();
        DeclarationKind kind = DeclarationKind.of(head);

        if (kind == DeclarationKind.TYPE) {
            if (list.size() < 2) {
                throw new MalformedBindingException(specifier, "Type declaration without a type");
            }
            return explodeType(list.get(1), list.elements().subList(2, list.size()));
        }
        if (kind == DeclarationKind.OTHER && TYPE_ABBREVIATIONS.contains(head.name())) {
            return explodeType(head, list.rest());
        }
        if (!kind.isVariable()) {
            return List.of(new Declaration(kind, null, list));
        }

        List<Declaration> result = new ArrayList<>(list.size() - 1);
        for (Form target : list.rest()) {
            result.add(new Declaration(kind, target, ListForm.of(head, target)));
        }
        return result;
    }

    private static List<Declaration> explodeType(Form type, List<Form> targets) {
        List<Declaration> result = new ArrayList<>(targets.size());
        for (Form target : targets) {
            result.add(new Declaration(DeclarationKind.TYPE, target,
                    ListForm.of(Symbol.of("type"), type, target)));
        }
        return result;
    }

    static boolean isDeclareForm(Form form) {
        return form instanceof ListForm list && list.isHeaded("declare");
    }
}
