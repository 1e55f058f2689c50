package io.github.reugn.bind4j.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A parenthesized list of forms. The empty list prints as {@code ()}.
 *
 * @param elements the list elements, in order
 */
public record ListForm(List<Form> elements) implements Form {

    public static final ListForm EMPTY = new ListForm(List.of());

    public ListForm {
        elements = List.copyOf(elements);
    }

    public static ListForm of(Form... elements) {
        return new ListForm(Arrays.asList(elements));
    }

    /**
     * Builds a list whose first element is the symbol {@code head}.
     */
    public static ListForm call(String head, Form... args) {
        List<Form> elements = new ArrayList<>(args.length + 1);
        elements.add(Symbol.of(head));
        elements.addAll(Arrays.asList(args));
        return new ListForm(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Form get(int index) {
        return elements.get(index);
    }

    /**
     * Returns the first element when it is a symbol.
     */
    public Optional<Symbol> head() {
        if (!elements.isEmpty() && elements.get(0) instanceof Symbol symbol) {
            return Optional.of(symbol);
        }
        return Optional.empty();
    }

    /**
     * Checks whether the first element is the source symbol {@code name}.
     */
    public boolean isHeaded(String name) {
        return head().map(s -> s.is(name)).orElse(false);
    }

    /**
     * Returns every element but the first.
     */
    public List<Form> rest() {
        return elements.isEmpty() ? List.of() : elements.subList(1, elements.size());
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
        return elements.stream().map(Form::toString).collect(Collectors.joining(" ", "(", ")"));
    }
}
