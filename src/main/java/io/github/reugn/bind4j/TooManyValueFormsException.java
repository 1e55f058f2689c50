package io.github.reugn.bind4j;

import io.github.reugn.bind4j.syntax.Form;

import java.util.List;

/**
 * Raised when a binding supplies more than one value form to a binding form
 * that accepts a single one.
 */
public class TooManyValueFormsException extends BindException {

    private final Form pattern;
    private final List<Form> valueForms;

    public TooManyValueFormsException(Form pattern, List<Form> valueForms) {
        super("Binding " + pattern + " has " + valueForms.size()
                + " value forms but its binding form accepts only one: " + valueForms);
        this.pattern = pattern;
        this.valueForms = List.copyOf(valueForms);
    }

    public Form getPattern() {
        return pattern;
    }

    public List<Form> getValueForms() {
        return valueForms;
    }
}
