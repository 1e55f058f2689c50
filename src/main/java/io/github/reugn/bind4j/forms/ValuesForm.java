package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.BadDefaultForKeywordOrOptionalException;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;
import io.github.reugn.bind4j.expander.BindingSpec;
import io.github.reugn.bind4j.expander.ExtractedVariables;
import io.github.reugn.bind4j.expander.GenerationContext;
import io.github.reugn.bind4j.expander.SyntaxFragment;
import io.github.reugn.bind4j.expander.VariableExtractor;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Placeholder;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Binds the multiple values of one form.
 *
 * <pre>{@code
 * ((:values q _ r) (floor-ish x))
 * (multiple-value-bind (q #:ignore1 r) (floor-ish x) (declare (ignorable #:ignore1)) ...)
 * }</pre>
 *
 * <p>Entries are plain variables; an entry with a default such as {@code (r 0)}
 * is rejected because {@code multiple-value-bind} has no defaults.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = BindingSpec.VALUES, synonyms = ":multiple-value-bind")
public final class ValuesForm implements BindingFormGenerator {

    private static final Symbol MULTIPLE_VALUE_BIND = Symbol.of("multiple-value-bind");

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm entries = FormSupport.entries(pattern, "values");
        for (Form entry : entries.elements()) {
            if (entry instanceof ListForm list && !list.isEmpty()) {
                throw new BadDefaultForKeywordOrOptionalException(entry, pattern);
            }
            if (!VariableExtractor.isIgnorable(entry)) {
                FormSupport.variable(entry, pattern);
            }
        }
        ExtractedVariables extracted = context.extract(entries);
        return SyntaxFragment.of(MULTIPLE_VALUE_BIND, extracted.pattern(), valueForms.get(0),
                Placeholder.DECLARATIONS, Placeholder.BODY_FORMS);
    }
}
