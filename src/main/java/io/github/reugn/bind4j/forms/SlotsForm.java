package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Binds object slots with {@code with-slots}.
 *
 * <pre>{@code
 * ((:slots a (b slot-b)) obj)
 * (let ((#:instance1 obj)) (with-slots (a (b slot-b)) #:instance1 ...))
 * }</pre>
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":slots", synonyms = ":with-slots")
public final class SlotsForm implements BindingFormGenerator {

    private static final Symbol WITH_SLOTS = Symbol.of("with-slots");

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm entries = FormSupport.entries(pattern, "slots");
        FormSupport.entryVariables(entries.elements(), pattern);
        Symbol instance = context.gensym("instance");
        return FormSupport.letAround(instance, valueForms.get(0), ListForm.of(WITH_SLOTS, entries, instance));
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        return FormSupport.entryVariables(FormSupport.entries(pattern, "slots").elements(), pattern);
    }
}
