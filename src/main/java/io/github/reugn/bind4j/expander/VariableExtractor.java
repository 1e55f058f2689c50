package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.BadDefaultForKeywordOrOptionalException;
import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;
import io.github.reugn.bind4j.syntax.VectorForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Enumerates the variables of a binding pattern and replaces ignorable
 * placeholders with synthetic names.
 *
 * <p><b>Ignorable placeholders:</b> the symbols {@code _} and {@code nil} and
 * the empty list {@code ()}. Each occurrence becomes a distinct generated
 * symbol, reported in {@link ExtractedVariables#ignorables()} so that the
 * binding can declare it ignorable.
 *
 * <p><b>Lambda-list markers:</b> {@code &rest}, {@code &key}, {@code &optional},
 * {@code &body}, {@code &args} (and {@code &aux}, {@code &whole},
 * {@code &environment}, {@code &allow-other-keys}) delimit groups and are never
 * variables.
 *
 * <p><b>Two modes:</b>
 * <ul>
 *   <li>{@link #extract(Form)} walks the whole tree, including vectors, and
 *       treats every non-keyword leaf symbol as a variable</li>
 *   <li>{@link #extractDestructured(Form)} reads the pattern as a destructuring
 *       lambda list: default forms are not variables, supplied-p symbols are,
 *       and {@code &key} entries are enumerated but left as written</li>
 * </ul>
 * An ignorable placeholder is rejected inside a {@code &key} group: entries there
 * are never rewritten, so it would bind a real variable named {@code _}.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * extractDestructured((a _ &optional (b 10 b-p) &key ((:size s) 0)))
 *   pattern     = (a #:ignore1 &optional (b 10 b-p) &key ((:size s) 0))
 *   variables   = [a, b, b-p, s]
 *   ignorables  = [#:ignore1]
 * }</pre>
 */
public final class VariableExtractor {

    public static final Set<String> LAMBDA_LIST_MARKERS = Set.of(
            "&rest", "&key", "&optional", "&body", "&args",
            "&aux", "&whole", "&environment", "&allow-other-keys"
    );

    static final String IGNORE_PREFIX = "ignore";

    private final Function<String, Symbol> gensym;

    /**
     * @param gensym supplies a fresh generated symbol for a name prefix
     */
    public VariableExtractor(Function<String, Symbol> gensym) {
        this.gensym = gensym;
    }

    /**
     * Walks every leaf of the pattern.
     */
    public ExtractedVariables extract(Form pattern) {
        Walk walk = new Walk(pattern, true);
        Form rewritten = walk.tree(pattern);
        return walk.result(rewritten);
    }

    /**
     * Walks the pattern as a destructuring lambda list.
     *
     * @throws BadDefaultForKeywordOrOptionalException if an {@code &optional},
     *                                                 {@code &key} or {@code &aux} entry is malformed
     * @throws MalformedBindingException                if a {@code &key} entry names an ignorable placeholder
     */
    public ExtractedVariables extractDestructured(Form pattern) {
        Walk walk = new Walk(pattern, true);
        Form rewritten = walk.lambdaList(pattern);
        return walk.result(rewritten);
    }

    /**
     * Returns the user-written variable names of a lambda-list shaped pattern,
     * including nested destructuring, without rewriting anything.
     */
    public static List<Symbol> variableNames(Form pattern) {
        Walk walk = new VariableExtractor(prefix -> {
            throw new IllegalStateException("No names are generated while enumerating");
        }).new Walk(pattern, false);
        walk.lambdaList(pattern);
        return List.copyOf(walk.names);
    }

    public static boolean isIgnorable(Form form) {
        if (form instanceof Symbol symbol) {
            return symbol.is("_") || symbol.is("nil");
        }
        return form instanceof ListForm list && list.isEmpty();
    }

    public static boolean isLambdaListMarker(Form form) {
        return form instanceof Symbol symbol && !symbol.generated() && LAMBDA_LIST_MARKERS.contains(symbol.name());
    }

    // ==================== WALK ====================

    private enum Section {
        REQUIRED, OPTIONAL, REST, KEY, AUX;

        static Section after(Symbol marker, Section current) {
            return switch (marker.name()) {
                case "&optional" -> OPTIONAL;
                case "&key" -> KEY;
                case "&aux" -> AUX;
                case "&allow-other-keys" -> current;
                default -> REST;
            };
        }
    }

    private final class Walk {
        private final Form binding;
        private final boolean rewrite;
        private final List<Symbol> names = new ArrayList<>();
        private final List<Symbol> ignorables = new ArrayList<>();

        Walk(Form binding, boolean rewrite) {
            this.binding = binding;
            this.rewrite = rewrite;
        }

        ExtractedVariables result(Form rewritten) {
            return new ExtractedVariables(rewritten, names, ignorables);
        }

        Form tree(Form form) {
            if (isIgnorable(form)) {
                return placeholder(form);
            }
            if (form instanceof Symbol symbol) {
                return leaf(symbol);
            }
            if (form instanceof ListForm list) {
                List<Form> out = new ArrayList<>(list.size());
                for (Form element : list.elements()) {
                    out.add(tree(element));
                }
                return new ListForm(out);
            }
            if (form instanceof VectorForm vector) {
                List<Form> out = new ArrayList<>(vector.elements().size());
                for (Form element : vector.elements()) {
                    out.add(tree(element));
                }
                return new VectorForm(out);
            }
            return form;
        }

        Form lambdaList(Form pattern) {
            if (!(pattern instanceof ListForm list) || list.isEmpty()) {
                return tree(pattern);
            }
            Section section = Section.REQUIRED;
            List<Form> out = new ArrayList<>(list.size());
            for (Form element : list.elements()) {
                if (isLambdaListMarker(element)) {
                    section = Section.after((Symbol) element, section);
                    out.add(element);
                    continue;
                }
                out.add(switch (section) {
                    case REQUIRED, REST -> lambdaList(element);
                    case OPTIONAL -> optionalEntry(element, 3);
                    case AUX -> optionalEntry(element, 2);
                    case KEY -> keyEntry(element);
                });
            }
            return new ListForm(out);
        }

        // var | (var) | (var default) | (var default supplied-p)
        private Form optionalEntry(Form entry, int maxSize) {
            if (!(entry instanceof ListForm list) || list.isEmpty()) {
                return tree(entry);
            }
            if (list.size() > maxSize) {
                throw new BadDefaultForKeywordOrOptionalException(entry, binding);
            }
            List<Form> out = new ArrayList<>(list.elements());
            out.set(0, lambdaList(list.get(0)));
            if (list.size() == 3) {
                out.set(2, suppliedP(list.get(2), entry));
            }
            return new ListForm(out);
        }

        // var | (var default supplied-p) | ((keyword var) default supplied-p), enumerated only
        private Form keyEntry(Form entry) {
            if (!(entry instanceof ListForm list)) {
                keyVariable(entry, entry);
                return entry;
            }
            if (list.isEmpty() || list.size() > 3) {
                throw new BadDefaultForKeywordOrOptionalException(entry, binding);
            }
            Form var = list.get(0);
            if (var instanceof ListForm keyed) {
                if (keyed.size() != 2) {
                    throw new BadDefaultForKeywordOrOptionalException(entry, binding);
                }
                keyVariable(keyed.get(1), entry);
            } else {
                keyVariable(var, entry);
            }
            if (list.size() == 3) {
                if (!(list.get(2) instanceof Symbol)) {
                    throw new BadDefaultForKeywordOrOptionalException(entry, binding);
                }
                enumerate(list.get(2));
            }
            return entry;
        }

        private void keyVariable(Form var, Form entry) {
            if (isIgnorable(var)) {
                throw new MalformedBindingException(entry, "An ignorable placeholder cannot name a keyword argument");
            }
            enumerate(var);
        }

        private Form suppliedP(Form form, Form entry) {
            if (!(form instanceof Symbol symbol) || symbol.isKeyword()) {
                throw new BadDefaultForKeywordOrOptionalException(entry, binding);
            }
            return tree(symbol);
        }

        private void enumerate(Form pattern) {
            for (Symbol name : variableNames(pattern)) {
                names.add(name);
            }
        }

        private Form leaf(Symbol symbol) {
            if (isLambdaListMarker(symbol) || symbol.isKeyword()) {
                return symbol;
            }
            names.add(symbol);
            return symbol;
        }

        private Form placeholder(Form original) {
            if (!rewrite) {
                return original;
            }
            Symbol name = gensym.apply(IGNORE_PREFIX);
            ignorables.add(name);
            return name;
        }
    }
}
