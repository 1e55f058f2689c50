package io.github.reugn.bind4j.forms;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Placeholder;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for bindings that define one local function. The pattern is
 * {@code (name lambda-list)} and the value forms are the function body.
 * <p>
 * The binding owns only the function name, so {@code (notinline f)} or
 * {@code (dynamic-extent #'f)} land in the body of the defining form.
 */
abstract class LocalFunctionForm implements BindingFormGenerator {

    private final Symbol operator;

    LocalFunctionForm(String operator) {
        this.operator = Symbol.of(operator);
    }

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm signature = signature(pattern);
        List<Form> definition = new ArrayList<>(valueForms.size() + 2);
        definition.add(signature.get(0));
        definition.add(signature.get(1));
        definition.addAll(valueForms);
        return SyntaxFragment.of(operator, ListForm.of(new ListForm(definition)),
                Placeholder.DECLARATIONS, Placeholder.BODY_FORMS);
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        return List.of((Symbol) signature(pattern).get(0));
    }

    private ListForm signature(Form pattern) {
        if (!(pattern instanceof ListForm list) || list.size() != 2 || !(list.get(1) instanceof ListForm)) {
            throw new MalformedBindingException(pattern, operator + " expects (name lambda-list)");
        }
        FormSupport.variable(list.get(0), pattern);
        return list;
    }
}
