/**
 * The binding expander.
 * <p>
 * This package turns a binding list and a body into nested binding forms,
 * distributing the body's declarations to the bindings that own them.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * Binder (entry point)
 *     ├── DeclarationPreprocessor - raw declare clauses to atomic declarations
 *     ├── BindingSpec             - binding syntax, tag resolution
 *     ├── ExpansionEngine         - recursion over the binding list
 *     │       ├── BindingFormRegistry ── BindingFormGenerator (per tag)
 *     │       ├── DeclarationFilter   - ownership of pending declarations
 *     │       └── FragmentCombiner    - substitution, trailing extension, merge, nesting
 *     └── UnusedDeclarationReporter   - unclaimed declarations per policy
 *
 * Support:
 *     ├── VariableExtractor  - variable names, ignorable placeholders
 *     ├── ExpansionContext   - per-call state behind GenerationContext
 *     └── DiagnosticReporter - warning and note output
 * </pre>
 *
 * <p>Standard binding forms live in {@link io.github.reugn.bind4j.forms}.
 */
package io.github.reugn.bind4j.expander;
