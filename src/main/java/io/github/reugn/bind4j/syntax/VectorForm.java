package io.github.reugn.bind4j.syntax;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A literal vector, written {@code #(a b c)}.
 *
 * @param elements the vector elements, in order
 */
public record VectorForm(List<Form> elements) implements Form {

    public VectorForm {
        elements = List.copyOf(elements);
    }

    public static VectorForm of(Form... elements) {
        return new VectorForm(Arrays.asList(elements));
    }

    @Override
    public boolean containsPlaceholder() {
        for (Form element : elements) {
            if (element.containsPlaceholder()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return elements.stream().map(Form::toString).collect(Collectors.joining(" ", "#(", ")"));
    }
}
