package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.UnusedDeclarationsException;

import javax.tools.Diagnostic;
import java.util.List;

/**
 * Reports declarations left pending after a top-level expansion.
 */
final class UnusedDeclarationReporter {

    private final UnusedDeclarationPolicy policy;
    private final DiagnosticReporter reporter;

    UnusedDeclarationReporter(UnusedDeclarationPolicy policy, DiagnosticReporter reporter) {
        this.policy = policy;
        this.reporter = reporter;
    }

    /**
     * Applies the policy to the leftovers of {@code pending}.
     *
     * @throws UnusedDeclarationsException when the policy is {@link UnusedDeclarationPolicy#ERROR}
     */
    void check(PendingDeclarations pending) {
        if (pending.isEmpty()) {
            return;
        }
        List<Declaration> unused = pending.remaining();
        switch (policy) {
            case PRINT_WARNING -> {
                for (Declaration declaration : unused) {
                    reporter.report(Diagnostic.Kind.NOTE, "Declaration " + declaration + " is not used by any binding");
                }
                reporter.report(Diagnostic.Kind.WARNING, summary(unused));
            }
            case WARN_ONLY -> reporter.report(Diagnostic.Kind.WARNING, summary(unused));
            case ERROR -> throw new UnusedDeclarationsException(unused);
        }
    }

    private static String summary(List<Declaration> unused) {
        return unused.size() == 1
                ? "1 unused declaration: " + unused.get(0)
                : unused.size() + " unused declarations: " + unused;
    }
}
