package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.TooManyValueFormsException;
import io.github.reugn.bind4j.UnknownBindingFormException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Symbol;

import javax.tools.Diagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * The recursive core of the expander.
 *
 * <p><b>Per binding, left to right:</b>
 * <ol>
 *   <li>Resolve the binding form from the tag or the pattern shape</li>
 *   <li>Reject several value forms unless the binding form accepts them</li>
 *   <li>Warn about a compound or tagged pattern without a value, then bind {@code nil}</li>
 *   <li>Claim the pending declarations about the names the binding owns</li>
 *   <li>Generate the fragment</li>
 *   <li>Expand the remaining bindings into the continuation</li>
 *   <li>Combine fragment, declare clause and continuation
 *       ({@link FragmentCombiner})</li>
 * </ol>
 * With no bindings left the continuation is {@code (progn body...)}.
 *
 * <p>Declarations are claimed before the continuation is expanded, so when two
 * bindings own the same name the earlier one receives the declaration.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * (bind ((a 2)
 *        ((:values x y) (floor a 3)))
 *   (declare (type fixnum a))
 *   (list a x y))
 *
 * (let* ((a 2))
 *   (declare (type fixnum a))
 *   (multiple-value-bind (x y) (floor a 3)
 *     (list a x y)))
 * }</pre>
 */
final class ExpansionEngine {

    private final BindingFormRegistry registry;
    private final DiagnosticReporter reporter;

    ExpansionEngine(BindingFormRegistry registry, DiagnosticReporter reporter) {
        this.registry = registry;
        this.reporter = reporter;
    }

    /**
     * Expands {@code bindings} around {@code body}.
     *
     * @param bindings the parsed binding list
     * @param body     the body forms, declarations already removed
     * @param context  the per-call state; its pending declarations are consumed
     * @return the expansion
     * @throws io.github.reugn.bind4j.BindException if any binding is invalid; no tree is produced
     */
    Form expand(List<BindingSpec> bindings, List<Form> body, ExpansionContext context) {
        return expand(bindings, 0, body, context);
    }

    private Form expand(List<BindingSpec> bindings, int index, List<Form> body, ExpansionContext context) {
        if (index == bindings.size()) {
            return progn(body);
        }
        BindingSpec binding = bindings.get(index);
        String tag = binding.resolvedTag();
        HandlerEntry handler = registry.resolve(tag)
                .orElseThrow(() -> new UnknownBindingFormException(tag));

        List<Form> valueForms = binding.valueForms();
        if (valueForms.size() > 1 && !handler.acceptsMultipleValues()) {
            throw new TooManyValueFormsException(binding.pattern(), valueForms);
        }
        if (valueForms.isEmpty() && (!binding.isAtomic() || binding.isTagged())) {
            reporter.report(Diagnostic.Kind.WARNING,
                    "Missing value form for " + binding.pattern() + "; binding it to nil");
            valueForms = List.of(Symbol.NIL);
        }

        Form pattern = binding.patternTail();
        BindingFormGenerator generator = handler.generator();
        List<Declaration> claimed = DeclarationFilter.filter(context.pending(), generator.ownedVariables(pattern));
        SyntaxFragment fragment = generator.generate(pattern, valueForms, context);
        List<Symbol> ignorable = context.drainIgnorables();

        Form inner = expand(bindings, index + 1, body, context);
        return FragmentCombiner.combine(fragment, DeclarationFilter.declareForm(claimed, ignorable), inner);
    }

    private static ListForm progn(List<Form> body) {
        List<Form> elements = new ArrayList<>(body.size() + 1);
        elements.add(Symbol.of("progn"));
        elements.addAll(body);
        return new ListForm(elements);
    }
}
