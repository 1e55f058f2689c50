package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.syntax.FormReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for parsing binding list entries.
 */
@DisplayName("Binding Spec")
class BindingSpecTest {

    private static BindingSpec parse(String binding) {
        return BindingSpec.parse(FormReader.read(binding));
    }

    @Nested
    @DisplayName("Shapes")
    class Shapes {

        @Test
        @DisplayName("Bare symbol")
        void bareSymbol() {
            BindingSpec spec = parse("a");

            assertThat(spec.isAtomic()).isTrue();
            assertThat(spec.valueForms()).isEmpty();
            assertThat(spec.resolvedTag()).isEqualTo(BindingSpec.VARIABLE);
        }

        @Test
        @DisplayName("Tagged pattern")
        void tagged() {
            BindingSpec spec = parse("((:values q r) (floor x 3))");

            assertThat(spec.formTag()).isEqualTo(":values");
            assertThat(spec.patternTail().toString()).isEqualTo("(q r)");
            assertThat(spec.valueForms()).extracting(Object::toString).containsExactly("(floor x 3)");
        }

        @Test
        @DisplayName("Untagged patterns resolve by shape")
        void untagged() {
            assertThat(parse("(a 1)").resolvedTag()).isEqualTo(BindingSpec.VARIABLE);
            assertThat(parse("(#(a b) v)").resolvedTag()).isEqualTo(BindingSpec.ARRAY);
            assertThat(parse("((values q r) v)").resolvedTag()).isEqualTo(BindingSpec.VALUES);
            assertThat(parse("((a &rest b) v)").resolvedTag()).isEqualTo(BindingSpec.DESTRUCTURE);
        }

        @Test
        @DisplayName("values head is stripped from the pattern")
        void valuesHead() {
            assertThat(parse("((values q r) v)").patternTail().toString()).isEqualTo("(q r)");
            assertThat(parse("((a b) v)").patternTail().toString()).isEqualTo("(a b)");
        }

        @Test
        @DisplayName("Prints back as written")
        void printing() {
            assertThat(parse("((:plist a b) props)").toString()).isEqualTo("((:plist a b) props)");
        }
    }

    @Nested
    @DisplayName("Malformed Bindings")
    class Malformed {

        @Test
        @DisplayName("Empty binding")
        void empty() {
            assertThatThrownBy(() -> parse("()")).isInstanceOf(MalformedBindingException.class);
        }

        @Test
        @DisplayName("Keyword pattern")
        void keyword() {
            assertThatThrownBy(() -> parse("(:a 1)"))
                    .isInstanceOf(MalformedBindingException.class)
                    .hasMessageContaining("keyword");
        }

        @Test
        @DisplayName("Literal binding")
        void literal() {
            assertThatThrownBy(() -> parse("42")).isInstanceOf(MalformedBindingException.class);
        }

        @Test
        @DisplayName("Literal pattern")
        void literalPattern() {
            assertThatThrownBy(() -> parse("(42 x)"))
                    .isInstanceOfSatisfying(MalformedBindingException.class,
                            e -> assertThat(e.getForm().toString()).isEqualTo("(42 x)"));
            assertThatThrownBy(() -> parse("(\"s\" y)"))
                    .isInstanceOf(MalformedBindingException.class)
                    .hasMessageContaining("symbol, a list or a vector");
        }

        @Test
        @DisplayName("Binding list must be a list")
        void bindingList() {
            assertThatThrownBy(() -> BindingSpec.parseAll(FormReader.read("a")))
                    .isInstanceOf(MalformedBindingException.class);
            assertThat(BindingSpec.parseAll(FormReader.read("(a (b 1))"))).hasSize(2);
            assertThat(BindingSpec.parseAll(FormReader.read("()"))).isEqualTo(List.of());
        }
    }
}
