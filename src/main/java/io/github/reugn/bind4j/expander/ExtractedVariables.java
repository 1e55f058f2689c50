package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.List;

/**
 * Result of walking a binding pattern.
 *
 * @param pattern    the pattern with every ignorable placeholder replaced by a generated symbol
 * @param variables  user-written variable names in left-to-right order, duplicates kept
 * @param ignorables generated names that replaced ignorable placeholders, in order
 */
public record ExtractedVariables(Form pattern, List<Symbol> variables, List<Symbol> ignorables) {

    public ExtractedVariables {
        variables = List.copyOf(variables);
        ignorables = List.copyOf(ignorables);
    }
}
