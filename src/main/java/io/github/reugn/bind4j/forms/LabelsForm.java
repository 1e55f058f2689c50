package io.github.reugn.bind4j.forms;

import com.google.auto.service.AutoService;
import io.github.reugn.bind4j.annotation.BindingForm;
import io.github.reugn.bind4j.expander.BindingFormGenerator;

/**
 * Like {@link FletForm}, but the function may call itself.
 */
@AutoService(BindingFormGenerator.class)
@BindingForm(value = ":labels", acceptsMultipleValues = true)
public final class LabelsForm extends LocalFunctionForm {

    public LabelsForm() {
        super("labels");
    }
}
