package io.github.reugn.bind4j.forms;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.expander.VariableExtractor;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared helpers for the standard binding forms.
 */
final class FormSupport {

    static final Symbol LET = Symbol.of("let");
    static final Symbol LET_STAR = Symbol.of("let*");

    private FormSupport() {
    }

    /**
     * Returns the pattern as a list of entries.
     *
     * @throws MalformedBindingException if the pattern is not a list
     */
    static ListForm entries(Form pattern, String formName) {
        if (!(pattern instanceof ListForm list)) {
            throw new MalformedBindingException(pattern, formName + " expects a list of entries");
        }
        return list;
    }

    /**
     * Checks that a form can name a variable.
     */
    static Symbol variable(Form form, Form pattern) {
        if (!(form instanceof Symbol symbol) || symbol.isKeyword() || VariableExtractor.isLambdaListMarker(symbol)) {
            throw new MalformedBindingException(pattern, "Not a variable: " + form);
        }
        return symbol;
    }

    /**
     * Returns the variable of an entry written {@code var} or {@code (var ...)}.
     */
    static Symbol entryVariable(Form entry, Form pattern) {
        if (entry instanceof ListForm list) {
            if (list.isEmpty()) {
                throw new MalformedBindingException(pattern, "Empty entry");
            }
            return variable(list.get(0), pattern);
        }
        return variable(entry, pattern);
    }

    /**
     * Collects the entry variables of a pattern, skipping ignorable ones.
     */
    static List<Symbol> entryVariables(List<Form> entries, Form pattern) {
        List<Symbol> names = new ArrayList<>(entries.size());
        for (Form entry : entries) {
            Symbol name = entryVariable(entry, pattern);
            if (!VariableExtractor.isIgnorable(name)) {
                names.add(name);
            }
        }
        return names;
    }

    static ListForm binding(Symbol variable, Form value) {
        return ListForm.of(variable, value);
    }

    /**
     * Builds a mergeable {@code (let* bindings)} fragment.
     */
    static SyntaxFragment letStar(List<Form> bindings) {
        return SyntaxFragment.of(LET_STAR, new ListForm(bindings));
    }

    /**
     * Builds {@code (let ((instance value)) (construct spec instance))}, to be
     * completed inside {@code construct}.
     */
    static SyntaxFragment letAround(Symbol instance, Form value, ListForm construct) {
        return SyntaxFragment.extendingTrailing(LET, ListForm.of(binding(instance, value)), construct);
    }
}
