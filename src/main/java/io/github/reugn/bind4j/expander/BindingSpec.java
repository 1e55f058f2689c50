package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;
import io.github.reugn.bind4j.syntax.VectorForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a binding list.
 *
 * <p><b>Accepted shapes:</b>
 * <table border="1">
 *   <caption>Binding syntax</caption>
 *   <tr><th>Binding</th><th>Pattern</th><th>Tag</th></tr>
 *   <tr><td>{@code a}</td><td>{@code a}</td><td>none</td></tr>
 *   <tr><td>{@code (a 1)}</td><td>{@code a}</td><td>none</td></tr>
 *   <tr><td>{@code ((a &rest b) xs)}</td><td>{@code (a &rest b)}</td><td>none</td></tr>
 *   <tr><td>{@code ((:values q r) (floor x 3))}</td><td>{@code (:values q r)}</td><td>{@code :values}</td></tr>
 * </table>
 *
 * <p>Untagged bindings resolve to a binding form by the shape of their pattern,
 * see {@link #resolvedTag()}.
 *
 * @param pattern    the pattern as written, including the tag when there is one
 * @param valueForms the value forms, possibly empty
 * @param formTag    the tag heading the pattern, {@code null} for plain bindings
 */
public record BindingSpec(Form pattern, List<Form> valueForms, String formTag) {

    public static final String VARIABLE = ":variable";
    public static final String DESTRUCTURE = ":destructure";
    public static final String ARRAY = ":array";
    public static final String VALUES = ":values";

    public BindingSpec {
        Objects.requireNonNull(pattern, "pattern");
        valueForms = List.copyOf(valueForms);
    }

    /**
     * Parses one element of a binding list.
     *
     * @throws MalformedBindingException if the binding is neither a symbol nor a non-empty list,
     *                                   or its pattern is a keyword or a literal
     */
    public static BindingSpec parse(Form binding) {
        if (binding instanceof Symbol symbol && !symbol.isKeyword()) {
            return new BindingSpec(symbol, List.of(), null);
        }
        if (!(binding instanceof ListForm list) || list.isEmpty()) {
            throw new MalformedBindingException(binding, "Malformed binding");
        }
        Form pattern = list.get(0);
        String tag = null;
        if (pattern instanceof ListForm patternList) {
            tag = patternList.head().filter(Symbol::isKeyword).map(Symbol::name).orElse(null);
        } else if (pattern instanceof Symbol symbol && symbol.isKeyword()) {
            throw new MalformedBindingException(binding, "A keyword cannot be bound");
        } else if (!(pattern instanceof Symbol || pattern instanceof VectorForm)) {
            throw new MalformedBindingException(binding, "Pattern must be a symbol, a list or a vector");
        }
        return new BindingSpec(pattern, list.rest(), tag);
    }

    /**
     * Parses a whole binding list.
     */
    public static List<BindingSpec> parseAll(Form bindings) {
        if (!(bindings instanceof ListForm list)) {
            throw new MalformedBindingException(bindings, "Binding list must be a list");
        }
        List<BindingSpec> specs = new ArrayList<>(list.size());
        for (Form binding : list.elements()) {
            specs.add(parse(binding));
        }
        return specs;
    }

    public boolean isTagged() {
        return formTag != null;
    }

    public boolean isAtomic() {
        return pattern instanceof Symbol;
    }

    /**
     * Returns the tag used to look up the binding form.
     * <ul>
     *   <li>tagged binding - its tag</li>
     *   <li>symbol - {@value #VARIABLE}</li>
     *   <li>vector - {@value #ARRAY}</li>
     *   <li>list headed by {@code values} - {@value #VALUES}</li>
     *   <li>any other list - {@value #DESTRUCTURE}</li>
     * </ul>
     */
    public String resolvedTag() {
        if (isTagged()) {
            return formTag;
        }
        if (pattern instanceof Symbol) {
            return VARIABLE;
        }
        if (pattern instanceof VectorForm) {
            return ARRAY;
        }
        if (pattern instanceof ListForm list && list.isHeaded("values")) {
            return VALUES;
        }
        return DESTRUCTURE;
    }

    /**
     * Returns the pattern handed to the generator: the elements after the tag
     * (or after {@code values}), otherwise the pattern itself.
     */
    public Form patternTail() {
        if (isTagged() || (pattern instanceof ListForm list && list.isHeaded("values"))) {
            return new ListForm(((ListForm) pattern).rest());
        }
        return pattern;
    }

    @Override
    public String toString() {
        List<Form> elements = new ArrayList<>(valueForms.size() + 1);
        elements.add(pattern);
        elements.addAll(valueForms);
        return new ListForm(elements).toString();
    }
}
