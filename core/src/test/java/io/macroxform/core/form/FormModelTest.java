package io.macroxform.core.form;

import static io.macroxform.core.testkit.FormReader.read;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the form model: structural equality, immutability and printing. */
@DisplayName("FormModelTest")
class FormModelTest {

    @Nested
    @DisplayName("Equality")
    class Equality {

        @Test
        @DisplayName("List equality ignores source location")
        void listEqualityIgnoresLocation() {
            ListForm a = new ListForm(List.of(Symbol.of("f"), Atom.of(1)), new SourceLocation("a.clj", 1, 1));
            ListForm b = new ListForm(List.of(Symbol.of("f"), Atom.of(1)), new SourceLocation("b.clj", 9, 4));

            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        }

        @Test
        @DisplayName("Marker symbol differs from the plain symbol of the same name")
        void markerIsNotPlainSymbol() {
            assertThat(Symbol.gensym("x")).isNotEqualTo(Symbol.of("x"));
        }

        @Test
        @DisplayName("List and vector with the same elements are different forms")
        void listIsNotVector() {
            assertThat(read("(1 2)")).isNotEqualTo(read("[1 2]"));
        }
    }

    @Nested
    @DisplayName("Immutability")
    class Immutability {

        @Test
        @DisplayName("Mutating the source list does not change the form")
        void elementsAreCopied() {
            List<Form> elements = new ArrayList<>(List.of(Atom.of(1)));
            ListForm list = new ListForm(elements);
            elements.add(Atom.of(2));

            assertThat(list.size()).isEqualTo(1);
            assertThatThrownBy(() -> list.elements().add(Atom.NIL)).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("cons and withElements return new lists")
        void consReturnsNewList() {
            ListForm list = ListForm.of(Atom.of(2));

            ListForm consed = list.cons(Atom.of(1));

            assertThat(consed).isEqualTo(read("(1 2)"));
            assertThat(list).isEqualTo(read("(2)"));
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Map needs an even number of keys and values")
        void oddMapRejected() {
            assertThatThrownBy(() -> MapForm.ofPairs(List.of(Atom.keyword("a"))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Atom kind and value must agree")
        void atomValidatesValue() {
            assertThatThrownBy(() -> new Atom(Atom.Kind.NUMBER, "1")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Atom(Atom.Kind.NIL, 1L)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Symbol.of("")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Only nil and false are falsey")
        void falsey() {
            assertThat(Atom.NIL.isFalsey()).isTrue();
            assertThat(Atom.FALSE.isFalsey()).isTrue();
            assertThat(Atom.of(0).isFalsey()).isFalse();
            assertThat(Atom.string("").isFalsey()).isFalse();
        }

        @Test
        @DisplayName("asSequence views lists, vectors, maps and nil")
        void asSequence() {
            assertThat(Forms.asSequence(read("[1 2]"))).contains(List.of(Atom.of(1), Atom.of(2)));
            assertThat(Forms.asSequence(Atom.NIL)).contains(List.of());
            assertThat(Forms.asSequence(read("{:a 1}")))
                    .contains(List.of(VectorForm.of(Atom.keyword("a"), Atom.of(1))));
            assertThat(Forms.asSequence(Atom.of(3))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Printing")
    class Printing {

        @Test
        @DisplayName("Prints reader syntax")
        void printsReaderSyntax() {
            String text = "(defn f [x & more] {:a \"s\\\"q\" :b nil} `(g ~x ~@more y#) 1.5 true)";

            assertThat(read(text).print()).isEqualTo(text);
        }

        @Test
        @DisplayName("Quote prints as a plain call")
        void quotePrintsAsCall() {
            assertThat(read("'x").print()).isEqualTo("(quote x)");
        }
    }
}
