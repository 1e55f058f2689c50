package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.BindingSpec;
import io.github.reugn.bind4j.expander.ExtractedVariables;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.expander.VariableExtractor;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Binds a single variable with {@code let*}.
 * <p>
 * {@code (a 1)} becomes {@code (let* ((a 1)))}; a bare {@code a} becomes
 * {@code (let* (a))}. Consecutive variable bindings merge into one {@code let*}.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = BindingSpec.VARIABLE, synonyms = ":var")
public final class VariableForm implements BindingFormGenerator {

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ExtractedVariables extracted = context.extract(variable(pattern));
        Form name = extracted.pattern();
        Form binding = valueForms.isEmpty() ? name : ListForm.of(name, valueForms.get(0));
        return FormSupport.letStar(List.of(binding));
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        Form variable = variable(pattern);
        return VariableExtractor.isIgnorable(variable) ? List.of() : List.of((Symbol) variable);
    }

    private static Form variable(Form pattern) {
        Form variable = pattern instanceof ListForm list && list.size() == 1 ? list.get(0) : pattern;
        if (VariableExtractor.isIgnorable(variable)) {
            return variable;
        }
        if (!(variable instanceof Symbol)) {
            throw new MalformedBindingException(pattern, "Expected a single variable");
        }
        return FormSupport.variable(variable, pattern);
    }
}
