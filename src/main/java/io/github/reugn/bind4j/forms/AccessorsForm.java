package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds accessor places with {@code with-accessors}. An entry {@code name}
 * uses the accessor of the same name; {@code (variable accessor)} names it.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":accessors", synonyms = ":with-accessors")
public final class AccessorsForm implements BindingFormGenerator {

    private static final Symbol WITH_ACCESSORS = Symbol.of("with-accessors");

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm entries = FormSupport.entries(pattern, "accessors");
        List<Form> specs = new ArrayList<>(entries.size());
        for (Form entry : entries.elements()) {
            Symbol variable = FormSupport.entryVariable(entry, pattern);
            if (entry instanceof ListForm list) {
                if (list.size() != 2) {
                    throw new MalformedBindingException(entry, "Expected (variable accessor)");
                }
                specs.add(ListForm.of(variable, FormSupport.variable(list.get(1), pattern)));
            } else {
                specs.add(ListForm.of(variable, variable));
            }
        }
        Symbol instance = context.gensym("instance");
        return FormSupport.letAround(instance, valueForms.get(0),
                ListForm.of(WITH_ACCESSORS, new ListForm(specs), instance));
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        return FormSupport.entryVariables(FormSupport.entries(pattern, "accessors").elements(), pattern);
    }
}
