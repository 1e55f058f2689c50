package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;

/**
 * {@code ((:flet double (x)) (* 2 x))} becomes
 * {@code (flet ((double (x) (* 2 x))) ...)}.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":flet", synonyms = ":function", acceptsMultipleValues = true)
public final class FletForm extends LocalFunctionForm {

    public FletForm() {
        super("flet");
    }
}
