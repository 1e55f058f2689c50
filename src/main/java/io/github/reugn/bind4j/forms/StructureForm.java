package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.expander.VariableExtractor;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds structure slots through the structure's accessor functions.
 *
 * <pre>{@code
 * ((:structure point- x (py y)) p)
 * (let* ((#:instance1 p) (x (point-x #:instance1)) (py (point-y #:instance1))))
 * }</pre>
 *
 * The first element is the accessor prefix (the structure's conc-name); each
 * entry is {@code slot} or {@code (variable slot)}.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":structure", synonyms = ":struct")
public final class StructureForm implements BindingFormGenerator {

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm list = FormSupport.entries(pattern, "structure");
        String prefix = prefix(list);
        Symbol instance = context.gensym("instance");

        List<Form> bindings = new ArrayList<>(list.size());
        bindings.add(FormSupport.binding(instance, valueForms.get(0)));
        for (Form entry : list.rest()) {
            Symbol variable = FormSupport.entryVariable(entry, pattern);
            if (VariableExtractor.isIgnorable(variable)) {
                continue;
            }
            Symbol slot = slot(entry, variable, pattern);
            bindings.add(FormSupport.binding(variable, ListForm.of(Symbol.of(prefix + slot.name()), instance)));
        }
        return FormSupport.letStar(bindings);
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        ListForm list = FormSupport.entries(pattern, "structure");
        prefix(list);
        return FormSupport.entryVariables(list.rest(), pattern);
    }

    private static String prefix(ListForm list) {
        if (list.isEmpty() || !(list.get(0) instanceof Symbol prefix) || prefix.isKeyword()) {
            throw new MalformedBindingException(list, "structure expects an accessor prefix first");
        }
        return prefix.name();
    }

    private static Symbol slot(Form entry, Symbol variable, Form pattern) {
        if (entry instanceof ListForm list) {
            if (list.size() != 2) {
                throw new MalformedBindingException(entry, "Expected (variable slot)");
            }
            return FormSupport.variable(list.get(1), pattern);
        }
        return variable;
    }
}
