package io.github.reugn.bind4j.forms;

import io.github.reugn.bind4j.BadDefaultForKeywordOrOptionalException;
import io.github.reugn.bind4j.MalformedBindingException;
import io.github.reugn.bind4j.TooManyValueFormsException;
import io.github.reugn.bind4j.util.CollectingReporter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.github.reugn.bind4j.util.ExpandHelper.expand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the standard binding forms.
 */
@DisplayName("Standard Binding Forms")
class StandardFormsTest {

    @Nested
    @DisplayName(":variable")
    class Variable {

        @Test
        @DisplayName("Tagged and synonym spellings")
        void tagged() {
            assertThat(expand("(bind (((:variable a) 1) ((:var b) 2)) (+ a b))"))
                    .isEqualTo("(let* ((a 1) (b 2)) (+ a b))");
        }

        @Test
        @DisplayName("Keyword is not a variable")
        void keyword() {
            assertThatThrownBy(() -> expand("(bind (((:var :x) 1)) 1)"))
                    .isInstanceOf(MalformedBindingException.class);
        }
    }

    @Nested
    @DisplayName(":destructure")
    class Destructure {

        @Test
        @DisplayName("Lambda list with optional default")
        void lambdaList() {
            assertThat(expand("(bind (((a &optional (b 2)) xs)) (declare (type integer b)) (list a b))"))
                    .isEqualTo("(destructuring-bind (a &optional (b 2)) xs (declare (type integer b)) (list a b))");
        }

        @Test
        @DisplayName("Ignorable positions are declared")
        void ignorable() {
            assertThat(expand("(bind (((:destructuring-bind _ (b c)) xs)) (list b c))"))
                    .isEqualTo("(destructuring-bind (#:ignore1 (b c)) xs (declare (ignorable #:ignore1)) (list b c))");
        }

        @Test
        @DisplayName("Missing value binds nil with a warning")
        void missingValue() {
            CollectingReporter reporter = new CollectingReporter();

            assertThat(expand("(bind (((a b))) (list a b))", reporter))
                    .isEqualTo("(destructuring-bind (a b) nil (list a b))");
            assertThat(reporter.warnings()).containsExactly("Missing value form for (a b); binding it to nil");
        }

        @Test
        @DisplayName("Bad optional entry")
        void badOptional() {
            assertThatThrownBy(() -> expand("(bind (((a &optional (b 1 b-p x)) xs)) a)"))
                    .isInstanceOf(BadDefaultForKeywordOrOptionalException.class);
        }
    }

    @Nested
    @DisplayName(":values")
    class Values {

        @Test
        @DisplayName("Untagged values pattern")
        void untagged() {
            assertThat(expand("(bind (((values q r) (floor 7 2))) (+ q r))"))
                    .isEqualTo("(multiple-value-bind (q r) (floor 7 2) (+ q r))");
        }

        @Test
        @DisplayName("Defaults are not allowed")
        void noDefaults() {
            assertThatThrownBy(() -> expand("(bind (((:values a (b 2)) (f))) a)"))
                    .isInstanceOfSatisfying(BadDefaultForKeywordOrOptionalException.class,
                            e -> assertThat(e.getSubPattern().toString()).isEqualTo("(b 2)"));
        }

        @Test
        @DisplayName("A single value form only")
        void tooManyValues() {
            assertThatThrownBy(() -> expand("(bind (((:values a b) (f) (g))) a)"))
                    .isInstanceOf(TooManyValueFormsException.class);
        }
    }

    @Nested
    @DisplayName(":array")
    class Array {

        @Test
        @DisplayName("Vector pattern binds by position")
        void vector() {
            assertThat(expand("(bind ((#(a _ c) v)) (list a c))"))
                    .isEqualTo("(let* ((#:array1 v) (a (aref #:array1 0)) (c (aref #:array1 2))) (list a c))");
        }

        @Test
        @DisplayName("Merges with a following variable")
        void merges() {
            assertThat(expand("(bind (((:vector a b) v) (c (+ a b))) (declare (fixnum a)) c)"))
                    .isEqualTo("(let* ((#:array1 v) (a (aref #:array1 0)) (b (aref #:array1 1)) (c (+ a b))) "
                            + "(declare (type fixnum a)) c)");
        }
    }

    @Nested
    @DisplayName(":plist")
    class Plist {

        @Test
        @DisplayName("Default keys, explicit keys and defaults")
        void entries() {
            assertThat(expand("(bind (((:plist a (b :bee) (c :c 3)) props)) (list a b c))"))
                    .isEqualTo("(let* ((#:plist1 props) (a (getf #:plist1 :a)) (b (getf #:plist1 :bee)) "
                            + "(c (getf #:plist1 :c 3))) (list a b c))");
        }

        @Test
        @DisplayName("Entry with too many elements")
        void tooLong() {
            assertThatThrownBy(() -> expand("(bind (((:property-list (a :a 1 2)) props)) a)"))
                    .isInstanceOf(BadDefaultForKeywordOrOptionalException.class);
        }
    }

    @Nested
    @DisplayName(":structure")
    class Structure {

        @Test
        @DisplayName("Accessor prefix and renamed slots")
        void accessors() {
            assertThat(expand("(bind (((:structure point- x (py y)) p)) (list x py))"))
                    .isEqualTo("(let* ((#:instance1 p) (x (point-x #:instance1)) (py (point-y #:instance1))) "
                            + "(list x py))");
        }

        @Test
        @DisplayName("Prefix is required")
        void missingPrefix() {
            assertThatThrownBy(() -> expand("(bind (((:struct) p)) 1)"))
                    .isInstanceOf(MalformedBindingException.class);
        }
    }

    @Nested
    @DisplayName(":slots and :accessors")
    class Slots {

        @Test
        @DisplayName("with-slots receives declarations and body")
        void slots() {
            assertThat(expand("(bind (((:slots a (b slot-b)) obj)) (declare (fixnum a)) (+ a b))"))
                    .isEqualTo("(let ((#:instance1 obj)) (with-slots (a (b slot-b)) #:instance1 "
                            + "(declare (type fixnum a)) (+ a b)))");
        }

        @Test
        @DisplayName("with-accessors pairs every variable with an accessor")
        void accessors() {
            assertThat(expand("(bind (((:with-accessors name (n2 nickname)) person)) (list name n2))"))
                    .isEqualTo("(let ((#:instance1 person)) (with-accessors ((name name) (n2 nickname)) #:instance1 "
                            + "(list name n2)))");
        }
    }

    @Nested
    @DisplayName(":flet and :labels")
    class LocalFunctions {

        @Test
        @DisplayName("Function declarations land in the flet body")
        void flet() {
            assertThat(expand("(bind (((:flet twice (x)) (* 2 x))) (declare (notinline twice)) (twice 3))"))
                    .isEqualTo("(flet ((twice (x) (* 2 x))) (declare (notinline twice)) (twice 3))");
        }

        @Test
        @DisplayName("Function designator in dynamic-extent")
        void dynamicExtent() {
            assertThat(expand("(bind (((:function f ()) 1)) (declare (dynamic-extent #'f)) (f))"))
                    .isEqualTo("(flet ((f () 1)) (declare (dynamic-extent (function f))) (f))");
        }

        @Test
        @DisplayName("Several value forms become the function body")
        void labels() {
            assertThat(expand("(bind (((:labels count-down (n)) (print n) (when (> n 0) (count-down (- n 1))))) "
                    + "(count-down 3))"))
                    .isEqualTo("(labels ((count-down (n) (print n) (when (> n 0) (count-down (- n 1))))) "
                            + "(count-down 3))");
        }

        @Test
        @DisplayName("Signature must be (name lambda-list)")
        void badSignature() {
            assertThatThrownBy(() -> expand("(bind (((:flet f) 1)) (f))"))
                    .isInstanceOf(MalformedBindingException.class);
        }
    }
}
