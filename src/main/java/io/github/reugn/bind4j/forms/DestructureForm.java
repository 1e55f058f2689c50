package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.BindingSpec;
import io.github.reugn.bind4j.expander.ExtractedVariables;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.Placeholder;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Destructures a list value against a lambda list:
 * {@code ((a &optional (b 2)) xs)} becomes
 * {@code (destructuring-bind (a &optional (b 2)) xs ...)}.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = BindingSpec.DESTRUCTURE, synonyms = ":destructuring-bind")
public final class DestructureForm implements BindingFormGenerator {

    private static final Symbol DESTRUCTURING_BIND = Symbol.of("destructuring-bind");

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ExtractedVariables extracted = context.extractDestructured(pattern);
        return SyntaxFragment.of(DESTRUCTURING_BIND, extracted.pattern(), valueForms.get(0),
                Placeholder.DECLARATIONS, Placeholder.BODY_FORMS);
    }
}
