package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.UnknownBindingFormException;
import io.github.reugn.bind4j.UnusedDeclarationsException;
import io.github.reugn.bind4j.syntax.Form;
import io.github.reugn.bind4j.syntax.FormReader;
import io.github.reugn.bind4j.util.CollectingReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.reugn.bind4j.util.ExpandHelper.binder;
import static io.github.reugn.bind4j.util.ExpandHelper.expand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link Binder} with the standard binding forms.
 */
@DisplayName("Binder")
class BinderTest {

    @Nested
    @DisplayName("Expansion")
    class Expansion {

        @Test
        @DisplayName("Variable followed by multiple values")
        void variableThenValues() {
            assertThat(expand("(bind ((a 2) ((:values x y) (floor 7 2))) (use a x y))"))
                    .isEqualTo("(let* ((a 2)) (multiple-value-bind (x y) (floor 7 2) (use a x y)))");
        }

        @Test
        @DisplayName("Consecutive variables merge into one let*")
        void mergesVariables() {
            assertThat(expand("(bind ((a 1) (b 2) (c 3)) (declare (type integer a)) (+ a b c))"))
                    .isEqualTo("(let* ((a 1) (b 2) (c 3)) (declare (type integer a)) (+ a b c))");
        }

        @Test
        @DisplayName("A different construct stops the merge")
        void mergeInterrupted() {
            assertThat(expand("(bind ((a 1) ((:values p q) (f)) (b 2)) (list a p q b))"))
                    .isEqualTo("(let* ((a 1)) (multiple-value-bind (p q) (f) (let* ((b 2)) (list a p q b))))");
        }

        @Test
        @DisplayName("A rebinding keeps the declaration on the first binding")
        void shadowing() {
            assertThat(expand("(bind ((a 1) (a (+ a 1))) (declare (fixnum a)) a)"))
                    .isEqualTo("(let* ((a 1)) (declare (type fixnum a)) (let* ((a (+ a 1))) a))");
        }

        @Test
        @DisplayName("Ignorables get distinct names and an ignorable declaration")
        void ignorables() {
            assertThat(expand("(bind ((_ (f)) ((:values x _ _) (g))) x)"))
                    .isEqualTo("(let* ((#:ignore1 (f))) (declare (ignorable #:ignore1)) "
                            + "(multiple-value-bind (x #:ignore2 #:ignore3) (g) "
                            + "(declare (ignorable #:ignore2 #:ignore3)) x))");
        }

        @Test
        @DisplayName("Empty binding list")
        void noBindings() {
            assertThat(expand("(bind () (foo) (bar))")).isEqualTo("(progn (foo) (bar))");
        }

        @Test
        @DisplayName("Several body forms stay in order")
        void bodyOrder() {
            assertThat(expand("(bind ((a 1)) (foo a) (bar a))")).isEqualTo("(let* ((a 1)) (foo a) (bar a))");
        }

        @Test
        @DisplayName("Bare symbol binds without a value")
        void bareSymbol() {
            CollectingReporter reporter = new CollectingReporter();

            assertThat(expand("(bind (a (b 1)) (list a b))", reporter)).isEqualTo("(let* (a (b 1)) (list a b))");
            assertThat(reporter.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Same input, same output")
        void deterministic() {
            String source = "(bind (((a _ &optional (b 2)) xs) (#(c _) v)) (declare (fixnum a c)) (list a b c))";

            assertThat(expand(source)).isEqualTo(expand(source));
        }

        @Test
        @DisplayName("Expanding parsed bindings directly")
        void bindEntryPoint() {
            Binder binder = binder(new CollectingReporter(), UnusedDeclarationPolicy.ERROR);

            Form expansion = binder.bind(List.of(FormReader.read("(a 1)")), FormReader.readAll("(declare (fixnum a)) a"));

            assertThat(expansion.toString()).isEqualTo("(let* ((a 1)) (declare (type fixnum a)) a)");
        }
    }

    @Nested
    @DisplayName("Unused Declarations")
    class Unused {

        private static final String SOURCE = "(bind ((a 1)) (declare (type integer z) (special w)) a)";

        @Test
        @DisplayName("print-warning notes each declaration and warns once")
        void printWarning() {
            CollectingReporter reporter = new CollectingReporter();

            Form expansion = binder(reporter, UnusedDeclarationPolicy.PRINT_WARNING).expand(FormReader.read(SOURCE));

            assertThat(expansion.toString()).isEqualTo("(let* ((a 1)) a)");
            assertThat(reporter.notes()).containsExactly(
                    "Declaration (type integer z) is not used by any binding",
                    "Declaration (special w) is not used by any binding");
            assertThat(reporter.warnings()).containsExactly(
                    "2 unused declarations: [(type integer z), (special w)]");
        }

        @Test
        @DisplayName("warn reports only the summary")
        void warnOnly() {
            CollectingReporter reporter = new CollectingReporter();

            binder(reporter, UnusedDeclarationPolicy.WARN_ONLY)
                    .expand(FormReader.read("(bind ((a 1)) (declare (fixnum z)) a)"));

            assertThat(reporter.notes()).isEmpty();
            assertThat(reporter.warnings()).containsExactly("1 unused declaration: (type fixnum z)");
        }

        @Test
        @DisplayName("error fails the expansion")
        void error() {
            Binder binder = binder(new CollectingReporter(), UnusedDeclarationPolicy.ERROR);

            assertThatThrownBy(() -> binder.expand(FormReader.read(SOURCE)))
                    .isInstanceOfSatisfying(UnusedDeclarationsException.class, e ->
                            assertThat(e.getDeclarations()).extracting(Declaration::toString)
                                    .containsExactly("(type integer z)", "(special w)"));
        }

        @Test
        @DisplayName("Nothing is reported when every declaration is used")
        void allUsed() {
            CollectingReporter reporter = new CollectingReporter();

            expand("(bind ((a 1)) (declare (fixnum a)) a)", reporter);

            assertThat(reporter.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Each expansion starts with fresh state")
        void independentCalls() {
            Binder binder = binder(new CollectingReporter(), UnusedDeclarationPolicy.ERROR);
            Form first = binder.expand(FormReader.read("(bind ((_ (f))) 1)"));
            Form second = binder.expand(FormReader.read("(bind ((_ (f))) 1)"));

            assertThat(second).isEqualTo(first);
            assertThat(first.toString()).contains("#:ignore1");
        }
    }

    @Nested
    @DisplayName("Malformed Input")
    class Malformed {

        @Test
        @DisplayName("Not a bind form")
        void notBind() {
            assertThatThrownBy(() -> expand("(let ((a 1)) a)"))
                    .isInstanceOf(MalformedBindingException.class)
                    .hasMessageContaining("Expected (bind");
        }

        @Test
        @DisplayName("Literal patterns abort the whole expansion")
        void literalPatterns() {
            assertThatThrownBy(() -> expand("(bind ((42 x) (\"s\" y)) z)"))
                    .isInstanceOf(MalformedBindingException.class);
        }

        @Test
        @DisplayName("Binding list is not a list")
        void bindingListNotList() {
            assertThatThrownBy(() -> expand("(bind a a)")).isInstanceOf(MalformedBindingException.class);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Builder defaults")
        void defaults() {
            Binder binder = Binder.create();

            assertThat(binder.registry().isRegistered(":values")).isTrue();
            assertThat(binder.unusedDeclarations()).isNotNull();
        }

        @Test
        @DisplayName("Custom registry replaces the standard forms")
        void customRegistry() {
            Binder binder = Binder.builder()
                    .registry(new BindingFormRegistry())
                    .reporter(new CollectingReporter())
                    .build();

            assertThatThrownBy(() -> binder.expand(FormReader.read("(bind ((a 1)) a)")))
                    .isInstanceOf(UnknownBindingFormException.class);
        }
    }
}
