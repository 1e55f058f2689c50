package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.BadDefaultForKeywordOrOptionalException;
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
 * Binds entries of a property list.
 *
 * <p><b>Entries:</b>
 * <ul>
 *   <li>{@code a} - {@code (getf plist :a)}</li>
 *   <li>{@code (a key)} - {@code (getf plist key)}</li>
 *   <li>{@code (a key default)} - {@code (getf plist key default)}</li>
 * </ul>
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":plist", synonyms = ":property-list")
public final class PlistForm implements BindingFormGenerator {

    @Override
    public SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context) {
        ListForm entries = FormSupport.entries(pattern, "plist");
        Symbol plist = context.gensym("plist");

        List<Form> bindings = new ArrayList<>(entries.size() + 1);
        bindings.add(FormSupport.binding(plist, valueForms.get(0)));
        for (Form entry : entries.elements()) {
            if (entry instanceof ListForm list && list.size() > 3) {
                throw new BadDefaultForKeywordOrOptionalException(entry, pattern);
            }
            Symbol variable = FormSupport.entryVariable(entry, pattern);
            if (VariableExtractor.isIgnorable(variable)) {
                continue;
            }
            List<Form> getf = new ArrayList<>(4);
            getf.add(Symbol.of("getf"));
            getf.add(plist);
            if (entry instanceof ListForm list && list.size() > 1) {
                getf.addAll(list.rest());
            } else {
                getf.add(Symbol.of(":" + variable.name()));
            }
            bindings.add(FormSupport.binding(variable, new ListForm(getf)));
        }
        return FormSupport.letStar(bindings);
    }

    @Override
    public List<Symbol> ownedVariables(Form pattern) {
        return FormSupport.entryVariables(FormSupport.entries(pattern, "plist").elements(), pattern);
    }
}
