package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Turns one binding into a syntax fragment.
 *
 * <p>Implementations are stateless and shared by every expansion. Standard
 * generators are annotated with {@link io.github.reugn.bind4j.annotation.BindingForm}
 * and published as services, so {@link BindingFormRegistry#standard()} picks them
 * up; custom generators may also be registered directly with
 * {@link BindingFormRegistry#register(String, java.util.Collection, BindingFormGenerator, boolean)}.
 *
 * <p><b>Fragment protocol:</b> a generator returns the elements of the construct
 * it introduces. It either places placeholders where the nested body and the
 * binding's declarations go, or omits them and lets the expander append
 * declarations and body at the end (see {@link SyntaxFragment}). Use
 * {@link io.github.reugn.bind4j.syntax.Placeholder#BODY_FORMS} in an implicit
 * body and {@link io.github.reugn.bind4j.syntax.Placeholder#BODY} where a single
 * form is expected.
 *
 * <pre>{@code
 * // ((:values q r) (floor x 3))
 * SyntaxFragment.of(sym("multiple-value-bind"), list(q, r), (floor x 3),
 *                   Placeholder.DECLARATIONS, Placeholder.BODY_FORMS)
 * }</pre>
 */
@FunctionalInterface
public interface BindingFormGenerator {

    /**
     * Generates the fragment for one binding.
     *
     * @param pattern    the binding pattern; for a tagged binding the elements after the tag
     * @param valueForms the value forms, never empty (a missing value is passed as {@code nil})
     *                   unless the binding is a bare variable
     * @param context    per-expansion services: synthetic names and pattern extraction
     * @return the fragment to combine with the rest of the expansion
     */
    SyntaxFragment generate(Form pattern, List<Form> valueForms, GenerationContext context);

    /**
     * Returns the names this binding introduces, used to decide which pending
     * declarations it owns.
     * <p>
     * The default reads the pattern as a destructuring lambda list.
     *
     * @param pattern the binding pattern as passed to {@link #generate}
     * @return the owned names, possibly empty
     */
    default List<Symbol> ownedVariables(Form pattern) {
        return VariableExtractor.variableNames(pattern);
    }
}
