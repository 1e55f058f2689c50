package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.BindingSpec;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.expander.VariableExtractor;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Literal;
import io.github.reugn.bind4j.syntax.Symbol;
import io.github.reugn.bind4j.syntax.VectorForm;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the elements of an array by position.
 * <p>
 * {@code (#(a _ c) v)} becomes
 * {@code (let* ((#:array1 v) (a (aref #:array1 0)) (c (aref #:array1 2))))}.
 * Ignored positions are skipped.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = BindingSpec.ARRAY, synonyms = ":vector")
public final class ArrayForm implements BindingFormGenerator {

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        List<Form> elements = elements(pattern);
        Symbol array = context.gensym("array");

        List<Form> bindings = new ArrayList<>(elements.size() + 1);
        bindings.add(FormSupport.binding(array, valueForms.get(0)));
        for (int i = 0; i < elements.size(); i++) {
            Form element = elements.get(i);
            if (VariableExtractor.isIgnorable(element)) {
                continue;
            }
            Symbol variable = FormSupport.variable(element, pattern);
            bindings.add(FormSupport.binding(variable, ListForm.call("aref", array, Literal.of((long) i))));
        }
        return FormSupport.letStar(bindings);
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        return FormSupport.entryVariables(elements(pattern), pattern);
    }

    private static List<Form> elements(Form pattern) {
        if (pattern instanceof VectorForm vector) {
            return vector.elements();
        }
        return FormSupport.entries(pattern, "array").elements();
    }
}
