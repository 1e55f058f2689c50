package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the expander: turns a binding list and a body into nested
 * binding forms.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Binder binder = Binder.create();
 * Form expansion = binder.expand(FormReader.read("""
 *         (bind ((a 2)
 *                ((:values q r) (floor a 3)))
 *           (declare (fixnum a))
 *           (list a q r))
 *         """));
 * // (let* ((a 2)) (declare (type fixnum a)) (multiple-value-bind (q r) (floor a 3) (list a q r)))
 * }</pre>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Declarations</b> - leading {@code (declare ...)} forms are split off the
 *       body and normalized to one specifier per variable</li>
 *   <li><b>Parsing</b> - each binding becomes a {@link BindingSpec}</li>
 *   <li><b>Expansion</b> - {@link ExpansionEngine} builds the tree, handing each
 *       declaration to the first binding that owns its variable</li>
 *   <li><b>Diagnostics</b> - unclaimed declarations are reported according to
 *       the {@link UnusedDeclarationPolicy}</li>
 * </ol>
 *
 * <p>A {@code Binder} is immutable and may be shared between threads as long as
 * its registry is no longer modified. Every call gets fresh expansion state.
 */
public final class Binder {

    private final BindingFormRegistry registry;
    private final UnusedDeclarationPolicy unusedDeclarations;
    private final DiagnosticReporter reporter;
    private final ExpansionEngine engine;

    private Binder(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : BindingFormRegistry.standard();
        this.unusedDeclarations = builder.unusedDeclarations != null
                ? builder.unusedDeclarations
                : UnusedDeclarationPolicy.fromSystemProperty();
        this.reporter = builder.reporter != null ? builder.reporter : DiagnosticReporter.standardError();
        this.engine = new ExpansionEngine(registry, reporter);
    }

    /**
     * Creates a binder with the standard binding forms and default settings.
     */
    public static Binder create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BindingFormRegistry registry() {
        return registry;
    }

    public UnusedDeclarationPolicy unusedDeclarations() {
        return unusedDeclarations;
    }

    /**
     * Expands a whole {@code (bind (binding...) body...)} form.
     *
     * @throws MalformedBindingException if the form is not a bind form
     */
    public Form expand(Form bindForm) {
        if (!(bindForm instanceof ListForm list) || list.size() < 2 || !list.isHeaded("bind")) {
            throw new MalformedBindingException(bindForm, "Expected (bind (bindings...) body...)");
        }
        return bind(list.get(1), list.elements().subList(2, list.size()));
    }

    /**
     * Expands a binding list given as a form.
     */
    public Form bind(Form bindings, List<Form> body) {
        return expand(BindingSpec.parseAll(bindings), body);
    }

    /**
     * Expands bindings given as individual forms.
     */
    public Form bind(List<Form> bindings, List<Form> body) {
        List<BindingSpec> specs = new ArrayList<>(bindings.size());
        for (Form binding : bindings) {
            specs.add(BindingSpec.parse(binding));
        }
        return expand(specs, body);
    }

    /**
     * Expands parsed bindings around a body that may start with declare forms.
     *
     * @throws io.github.reugn.bind4j.BindException on invalid input, or on unused
     *                                              declarations under {@link UnusedDeclarationPolicy#ERROR}
     */
    public Form expand(List<BindingSpec> bindings, List<Form> body) {
        int split = 0;
        while (split < body.size() && DeclarationPreprocessor.isDeclareForm(body.get(split))) {
            split++;
        }
        List<Declaration> declarations = DeclarationPreprocessor.normalize(body.subList(0, split));

        ExpansionContext context = new ExpansionContext(new PendingDeclarations(declarations));
        Form expansion = engine.expand(bindings, body.subList(split, body.size()), context);

        new UnusedDeclarationReporter(unusedDeclarations, reporter).check(context.pending());
        return expansion;
    }

    /**
     * Builder for {@link Binder}. Unset values fall back to
     * {@link BindingFormRegistry#standard()}, {@link UnusedDeclarationPolicy#fromSystemProperty()}
     * and {@link DiagnosticReporter#standardError()}.
     */
    public static final class Builder {
        private BindingFormRegistry registry;
        private UnusedDeclarationPolicy unusedDeclarations;
        private DiagnosticReporter reporter;

        private Builder() {
        }

        public Builder registry(BindingFormRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public Builder unusedDeclarations(UnusedDeclarationPolicy policy) {
            this.unusedDeclarations = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder reporter(DiagnosticReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        public Binder build() {
            return new Binder(this);
        }
    }
}
