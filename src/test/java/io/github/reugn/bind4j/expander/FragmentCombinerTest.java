package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.FormReader;
import io.github.reugn.bind4j.syntax.ListForm;
import io.github.reugn.bind4j.syntax.Placeholder;
import io.github.reugn.bind4j.syntax.Symbol;
import io.github.reugn.bind4j.util.CollectingReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for completing fragments with declarations and a body.
 */
@DisplayName("Fragment Combiner")
class FragmentCombinerTest {

    private static final Optional<ListForm> NO_DECLARE = Optional.empty();

    private static Form read(String source) {
        return FormReader.read(source);
    }

    private static Optional<ListForm> declare(String source) {
        return Optional.of((ListForm) read(source));
    }

    private static String combine(SyntaxFragment fragment, Optional<ListForm> declare, String inner) {
        return FragmentCombiner.combine(fragment, declare, read(inner)).toString();
    }

    @Nested
    @DisplayName("Placeholders")
    class Placeholders {

        @Test
        @DisplayName("Body and declarations replace their placeholders")
        void substitutes() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("multiple-value-bind"), read("(a b)"),
                    read("(f)"), Placeholder.DECLARATIONS, Placeholder.BODY_FORMS);

            assertThat(combine(fragment, declare("(declare (fixnum a))"), "(progn (g a) (h b))"))
                    .isEqualTo("(multiple-value-bind (a b) (f) (declare (fixnum a)) (g a) (h b))");
        }

        @Test
        @DisplayName("Placeholders nested deep in the fragment")
        void nested() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("let"), read("((x 1))"),
                    ListForm.of(Symbol.of("locally"), Placeholder.DECLARATIONS, Placeholder.BODY_FORMS));

            assertThat(combine(fragment, declare("(declare (special x))"), "(use x)"))
                    .isEqualTo("(let ((x 1)) (locally (declare (special x)) (use x)))");
        }

        @Test
        @DisplayName("Declarations go before the body when they have no placeholder")
        void noDeclarationsPlaceholder() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("wrap"), Placeholder.BODY_FORMS);

            assertThat(combine(fragment, declare("(declare (ignore y))"), "(use y)"))
                    .isEqualTo("(wrap (declare (ignore y)) (use y))");
        }

        @Test
        @DisplayName("Body is appended when it has no placeholder")
        void noBodyPlaceholder() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("wrap"), Placeholder.DECLARATIONS);

            assertThat(combine(fragment, NO_DECLARE, "(use y)")).isEqualTo("(wrap (use y))");
        }
    }

    @Nested
    @DisplayName("Body In Expression Position")
    class ExpressionPosition {

        private final SyntaxFragment protect = SyntaxFragment.of(Symbol.of("let"), read("((x v))"),
                Placeholder.DECLARATIONS, ListForm.of(Symbol.of("unwind-protect"), Placeholder.BODY, read("(cleanup)")));

        @Test
        @DisplayName("Several body forms stay one protected form")
        void severalForms() {
            assertThat(combine(protect, NO_DECLARE, "(progn (a) (b))"))
                    .isEqualTo("(let ((x v)) (unwind-protect (progn (a) (b)) (cleanup)))");
        }

        @Test
        @DisplayName("An empty body keeps its place")
        void emptyBody() {
            assertThat(combine(protect, NO_DECLARE, "(progn)"))
                    .isEqualTo("(let ((x v)) (unwind-protect (progn) (cleanup)))");
        }

        @Test
        @DisplayName("A single body form is used as is")
        void singleForm() {
            assertThat(combine(protect, declare("(declare (fixnum x))"), "(progn (a))"))
                    .isEqualTo("(let ((x v)) (declare (fixnum x)) (unwind-protect (a) (cleanup)))");
        }

        @Test
        @DisplayName("Declarations without a placeholder are wrapped in locally")
        void declarationsWithoutPlaceholder() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("if"), read("(ready)"), Placeholder.BODY, read("(fail)"));

            assertThat(combine(fragment, declare("(declare (special y))"), "(progn (use y))"))
                    .isEqualTo("(if (ready) (locally (declare (special y)) (use y)) (fail))");
        }

        @Test
        @DisplayName("Custom handler registered with the body as the protected form")
        void throughExpansion() {
            BindingFormRegistry registry = BindingFormRegistry.standard();
            registry.register(":protect", List.of(), (pattern, valueForms, context) -> SyntaxFragment.of(
                    Symbol.of("let"), ListForm.of(ListForm.of(((ListForm) pattern).get(0), valueForms.get(0))),
                    Placeholder.DECLARATIONS,
                    ListForm.of(Symbol.of("unwind-protect"), Placeholder.BODY, read("(cleanup)"))), false);
            Binder binder = Binder.builder()
                    .registry(registry)
                    .reporter(new CollectingReporter())
                    .build();

            assertThat(binder.expand(read("(bind (((:protect x) 1)) (a) (b))")).toString())
                    .isEqualTo("(let ((x 1)) (unwind-protect (progn (a) (b)) (cleanup)))");
            assertThat(binder.expand(read("(bind (((:protect x) 1)))")).toString())
                    .isEqualTo("(let ((x 1)) (unwind-protect (progn) (cleanup)))");
        }
    }

    @Nested
    @DisplayName("Trailing Extension")
    class Trailing {

        @Test
        @DisplayName("Body goes inside the last element")
        void extendsLast() {
            SyntaxFragment fragment = SyntaxFragment.extendingTrailing(Symbol.of("let"), read("((i obj))"),
                    read("(with-slots (a) i)"));

            assertThat(combine(fragment, declare("(declare (fixnum a))"), "(print a)"))
                    .isEqualTo("(let ((i obj)) (with-slots (a) i (declare (fixnum a)) (print a)))");
        }

        @Test
        @DisplayName("Last element must be a list")
        void lastNotList() {
            SyntaxFragment fragment = SyntaxFragment.extendingTrailing(Symbol.of("let"), Symbol.of("x"));

            assertThatThrownBy(() -> combine(fragment, NO_DECLARE, "(print x)"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Adjacent let* forms merge")
        void merges() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("let*"), read("((a 1))"));

            assertThat(combine(fragment, declare("(declare (fixnum a))"), "(let* ((b 2)) (declare (fixnum b)) b)"))
                    .isEqualTo("(let* ((a 1) (b 2)) (declare (fixnum a)) (declare (fixnum b)) b)");
        }

        @Test
        @DisplayName("A rebound name prevents merging")
        void shadowing() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("let*"), read("((a 1))"));

            assertThat(combine(fragment, NO_DECLARE, "(let* ((a (1+ a))) a)"))
                    .isEqualTo("(let* ((a 1)) (let* ((a (1+ a))) a))");
        }

        @Test
        @DisplayName("Other constructs nest")
        void nests() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("let*"), read("((a 1))"));

            assertThat(combine(fragment, NO_DECLARE, "(let ((b 2)) b)"))
                    .isEqualTo("(let* ((a 1)) (let ((b 2)) b))");
        }

        @Test
        @DisplayName("progn body is spliced")
        void splicesProgn() {
            SyntaxFragment fragment = SyntaxFragment.of(Symbol.of("let"), read("((a 1))"));

            assertThat(combine(fragment, NO_DECLARE, "(progn (f a) (g a))"))
                    .isEqualTo("(let ((a 1)) (f a) (g a))");
        }
    }
}
