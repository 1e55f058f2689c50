package io.github.reugn.bind4j;

import io.github.reugn.bind4j.syntax.Form;

/**
 * Raised for binding or declaration syntax the expander cannot interpret.
 */
public class MalformedBindingException extends BindException {

    private final Form form;

    public MalformedBindingException(Form form, String reason) {
        super(reason + ": " + form);
        this.form = form;
    }

    public Form getForm() {
        return form;
    }
}
