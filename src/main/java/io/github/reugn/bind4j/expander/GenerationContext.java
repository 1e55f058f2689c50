package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.Symbol;

/**
 * Services offered to a {@link BindingFormGenerator} during one expansion.
 * <p>
 * Names generated through a context are unique within its top-level expansion.
 * Ignorable names produced by {@link #extract} and {@link #extractDestructured}
 * are declared {@code ignorable} in the binding's declare clause automatically.
 */
public interface GenerationContext {

    /**
     * Returns a fresh generated symbol named {@code prefix} followed by a counter.
     */
    Symbol gensym(String prefix);

    /**
     * Extracts variables from every leaf of the pattern.
     *
     * @see VariableExtractor#extract(Form)
     */
    ExtractedVariables extract(Form pattern);

    /**
     * Extracts variables from a destructuring lambda list.
     *
     * @see VariableExtractor#extractDestructured(Form)
     */
    ExtractedVariables extractDestructured(Form pattern);

    /**
     * Declares a generated name ignorable in the current binding.
     */
    void markIgnorable(Symbol name);
}
