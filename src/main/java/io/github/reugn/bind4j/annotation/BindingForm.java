package io.github.reugn.bind4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes how a {@code BindingFormGenerator} implementation is registered.
 * <p>
 * The registry reads this annotation when a generator is registered without
 * explicit metadata, which is how service-loaded generators are installed:
 *
 * <pre>
 * {@code
 * @AutoService(BindingFormGenerator.class)
 * @BindingForm(value = ":values", synonyms = ":multiple-value-bind")
 * public final class ValuesForm implements BindingFormGenerator {
 *     ...
 * }
 * }
 * </pre>
 *
 * <p>Tags are matched case-sensitively. A binding written as
 * {@code ((:values a b) (floor x 2))} resolves to the generator whose
 * {@link #value()} or one of whose {@link #synonyms()} is {@code :values}.
 *
 * @see io.github.reugn.bind4j.expander.BindingFormRegistry
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface BindingForm {
    /**
     * The canonical tag, including the leading colon (e.g. {@code ":values"}).
     *
     * @return the canonical tag
     */
    String value();

    /**
     * Additional tags that resolve to the same generator.
     *
     * @return the synonym tags, empty by default
     */
    String[] synonyms() default {};

    /**
     * Whether a binding may supply more than one value form.
     * <p>
     * Binding forms whose value forms are a body (such as local function
     * definitions) set this to {@code true}; supplying several value forms to
     * any other form is an error.
     *
     * @return {@code true} if several value forms are accepted
     */
    boolean acceptsMultipleValues() default false;
}
