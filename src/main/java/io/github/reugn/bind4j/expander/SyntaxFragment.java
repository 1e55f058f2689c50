package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;

import java.util.Arrays;
import java.util.List;

/**
 * The construct a generator produced for one binding, still missing its body.
 *
 * <p>{@link #forms()} are the elements of the construct, head first. How the
 * expander completes it:
 * <table border="1">
 *   <caption>Fragment combination, in priority order</caption>
 *   <tr><th>Fragment</th><th>Result</th></tr>
 *   <tr>
 *     <td>contains a placeholder</td>
 *     <td>placeholders replaced by the declare clause and the body</td>
 *   </tr>
 *   <tr>
 *     <td>{@link #extendsTrailing()}</td>
 *     <td>declare clause and body appended to the last element</td>
 *   </tr>
 *   <tr>
 *     <td>{@code (let* bindings)} and the body is also a {@code let*}</td>
 *     <td>one merged {@code let*}</td>
 *   </tr>
 *   <tr>
 *     <td>anything else</td>
 *     <td>declare clause and body appended to the construct</td>
 *   </tr>
 * </table>
 *
 * @param forms           the construct elements
 * @param extendsTrailing whether declarations and body go into the last element
 */
public record SyntaxFragment(List<Form> forms, boolean extendsTrailing) {

    public SyntaxFragment {
        forms = List.copyOf(forms);
        if (forms.isEmpty()) {
            throw new IllegalArgumentException("A fragment needs at least one form");
        }
    }

    public static SyntaxFragment of(Form... forms) {
        return new SyntaxFragment(Arrays.asList(forms), false);
    }

    /**
     * A fragment whose declarations and body are appended to its last element,
     * e.g. {@code (let ((#:instance x)) (with-slots (a b) #:instance))}.
     */
    public static SyntaxFragment extendingTrailing(Form... forms) {
        return new SyntaxFragment(Arrays.asList(forms), true);
    }

    public boolean containsPlaceholder() {
        for (Form form : forms) {
            if (form.containsPlaceholder()) {
                return true;
            }
        }
        return false;
    }
}
