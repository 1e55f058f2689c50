package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one top-level expansion: the pending declarations, the synthetic
 * name counter and the ignorable names of the binding being generated.
 * <p>
 * Created per call and never shared, so nested expansions stay independent.
 */
final class ExpansionContext implements GenerationContext {

    private final PendingDeclarations pending;
    private final VariableExtractor extractor;
    private final List<Symbol> ignorables = new ArrayList<>();
    private int counter;

    ExpansionContext(PendingDeclarations pending) {
        this.pending = pending;
        this.extractor = new VariableExtractor(this::gensym);
    }

    PendingDeclarations pending() {
        return pending;
    }

    @Override
    public Symbol gensym(String prefix) {
        return Symbol.generated(prefix + ++counter);
    }

    @Override
    public ExtractedVariables extract(Form pattern) {
        ExtractedVariables result = extractor.extract(pattern);
        ignorables.addAll(result.ignorables());
        return result;
    }

    @Override
    public ExtractedVariables extractDestructured(Form pattern) {
        ExtractedVariables result = extractor.extractDestructured(pattern);
        ignorables.addAll(result.ignorables());
        return result;
    }

    @Override
    public void markIgnorable(Symbol name) {
        ignorables.add(name);
    }

    /**
     * Returns and forgets the ignorable names collected for the current binding.
     */
    List<Symbol> drainIgnorables() {
        List<Symbol> drained = List.copyOf(ignorables);
        ignorables.clear();
        return drained;
    }
}
