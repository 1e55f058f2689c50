package io.github.reugn.bind4j;

import io.github.reugn.bind4j.syntax.Form;

/**
 * Raised when a keyword or optional sub-pattern carries a default value
 * where the binding form does not allow one, or carries more than
 * {@code (var default supplied-p)}.
 */
public class BadDefaultForKeywordOrOptionalException extends BindException {

    private final Form subPattern;
    private final Form binding;

    public BadDefaultForKeywordOrOptionalException(Form subPattern, Form binding) {
        super("Bad default in " + subPattern + " of binding " + binding);
        this.subPattern = subPattern;
        this.binding = binding;
    }

    public Form getSubPattern() {
        return subPattern;
    }

    public Form getBinding() {
        return binding;
    }
}
