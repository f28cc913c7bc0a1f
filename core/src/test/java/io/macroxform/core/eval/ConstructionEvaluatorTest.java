package io.macroxform.core.eval;

import static io.macroxform.core.testkit.FormReader.read;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroxform.core.error.EvaluationException;
import io.macroxform.core.error.IllegalSpliceException;
import io.macroxform.core.error.IllegalUnquoteException;
import io.macroxform.core.error.MacroUsedAsValueException;
import io.macroxform.core.error.UnboundSymbolException;
import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.macro.Bindings;
import io.macroxform.core.macro.MacroRegistry;
import io.macroxform.core.testkit.TestMacros;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConstructionEvaluatorTest")
class ConstructionEvaluatorTest {

    private MacroRegistry registry;
    private ConstructionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        registry = new MacroRegistry();
        registry.define(TestMacros.myWhen());
        evaluator = new ConstructionEvaluator(registry);
    }

    private Form eval(String text) {
        return evaluator.evaluate(read(text), Bindings.empty());
    }

    @Nested
    @DisplayName("Core evaluation")
    class Core {

        @Test
        @DisplayName("Quoting returns the form unevaluated")
        void quoteIsIdentity() {
            assertThat(eval("'(+ 1 2 3)")).isEqualTo(read("(+ 1 2 3)"));
            assertThat(eval("'my-when")).isEqualTo(Symbol.of("my-when"));
        }

        @Test
        @DisplayName("Unquote inserts a computed list, splice flattens it")
        void unquoteVersusSplice() {
            assertThat(eval("`(1 2 ~(list 3 4))")).isEqualTo(read("(1 2 (3 4))"));
            assertThat(eval("`(1 2 ~@(list 3 4))")).isEqualTo(read("(1 2 3 4)"));
        }

        @Test
        @DisplayName("Holes are evaluated left to right, depth first, in textual order")
        void holeEvaluationOrder() {
            List<Form> seen = new ArrayList<>();
            evaluator.definePrimitive("tick", args -> {
                seen.add(args.get(0));
                return args.get(0);
            });

            Form result = eval("`(~(tick 1) [~(tick 2) {:k ~(tick 3)}] ~@(list (tick 4)))");

            assertThat(result).isEqualTo(read("(1 [2 {:k 3}] 4)"));
            assertThat(seen).containsExactly(Atom.of(1), Atom.of(2), Atom.of(3), Atom.of(4));
        }

        @Test
        @DisplayName("Atoms and the empty list evaluate to themselves")
        void selfEvaluating() {
            assertThat(eval("\"s\"")).isEqualTo(Atom.string("s"));
            assertThat(eval(":k")).isEqualTo(Atom.keyword("k"));
            assertThat(eval("()")).isEqualTo(ListForm.EMPTY);
        }

        @Test
        @DisplayName("Symbols resolve through bindings")
        void bindings() {
            Form result = evaluator.evaluate(read("[x y]"), Bindings.of("x", Atom.of(1)).with("y", read("(a b)")));

            assertThat(result).isEqualTo(read("[1 (a b)]"));
        }

        @Test
        @DisplayName("quote takes exactly one argument")
        void quoteArity() {
            assertThatThrownBy(() -> eval("(quote a b)")).isInstanceOf(EvaluationException.class);
        }
    }

    @Nested
    @DisplayName("Primitives")
    class PrimitiveCalls {

        @Test
        @DisplayName("Sequence primitives")
        void sequencePrimitives() {
            assertThat(eval("(concat '(1 2) [3] nil '(4))")).isEqualTo(read("(1 2 3 4)"));
            assertThat(eval("(cons 0 '(1 2))")).isEqualTo(read("(0 1 2)"));
            assertThat(eval("(first '(1 2))")).isEqualTo(Atom.of(1));
            assertThat(eval("(first '())")).isEqualTo(Atom.NIL);
            assertThat(eval("(rest '(1 2))")).isEqualTo(read("(2)"));
            assertThat(eval("(count [1 2 3])")).isEqualTo(Atom.of(3));
            assertThat(eval("(seq [1 2])")).isEqualTo(read("(1 2)"));
            assertThat(eval("(hash-map :a 1)")).isEqualTo(read("{:a 1}"));
        }

        @Test
        @DisplayName("apply spreads its last argument")
        void apply() {
            assertThat(eval("(apply list 1 '(2 3))")).isEqualTo(read("(1 2 3)"));
            assertThat(eval("(apply vector '(a b))")).isEqualTo(read("[a b]"));
        }

        @Test
        @DisplayName("map applies a primitive to each element")
        void map() {
            assertThat(eval("(map first '((1 2) (3 4)))")).isEqualTo(read("(1 3)"));
        }

        @Test
        @DisplayName("gensym builds a plain fresh symbol")
        void gensym() {
            Form a = eval("(gensym \"tmp\")");
            Form b = eval("(gensym)");

            assertThat(a).isInstanceOf(Symbol.class);
            assertThat(((Symbol) a).name()).startsWith("tmp");
            assertThat(((Symbol) b).name()).startsWith("G__");
        }

        @Test
        @DisplayName("Primitive misuse is an EvaluationException")
        void badArguments() {
            assertThatThrownBy(() -> eval("(seq 5)")).isInstanceOf(EvaluationException.class);
            assertThatThrownBy(() -> eval("(hash-map :a)")).isInstanceOf(EvaluationException.class);
            assertThatThrownBy(() -> eval("(cons 1)")).isInstanceOf(EvaluationException.class);
            assertThatThrownBy(() -> eval("list")).isInstanceOf(EvaluationException.class);
        }

        @Test
        @DisplayName("A parameter named like a primitive does not shadow the call head")
        void primitivesWinInCallPosition() {
            Form result = evaluator.evaluate(read("`(a ~list)"), Bindings.of("list", Atom.of(5)));

            assertThat(result).isEqualTo(read("(a 5)"));
        }

        @Test
        @DisplayName("Custom primitives can be registered, reserved names cannot")
        void customPrimitive() {
            evaluator.definePrimitive("inc", args -> Atom.of((Long) ((Atom) args.get(0)).value() + 1));

            assertThat(evaluator.hasPrimitive("inc")).isTrue();
            assertThat(eval("(map inc '(1 2))")).isEqualTo(read("(2 3)"));
            assertThatThrownBy(() -> evaluator.definePrimitive("quote", args -> Atom.NIL))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unbound symbol")
        void unbound() {
            assertThatThrownBy(() -> eval("zzz"))
                    .isInstanceOf(UnboundSymbolException.class)
                    .hasMessageContaining("zzz");
            assertThatThrownBy(() -> eval("(zzz 1)")).isInstanceOf(UnboundSymbolException.class);
        }

        @Test
        @DisplayName("Macro passed as a function is rejected")
        void macroAsFunctionArgument() {
            assertThatThrownBy(() -> eval("(map my-when '(1 2))"))
                    .isInstanceOf(MacroUsedAsValueException.class)
                    .hasMessageContaining("Can't take value of a macro");
        }

        @Test
        @DisplayName("Macro referenced as a value is rejected")
        void macroAsValue() {
            assertThatThrownBy(() -> eval("[my-when]")).isInstanceOf(MacroUsedAsValueException.class);
        }

        @Test
        @DisplayName("Unexpanded macro call is rejected")
        void unexpandedMacroCall() {
            assertThatThrownBy(() -> eval("(my-when true 1)"))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessageContaining("must be expanded");
        }

        @Test
        @DisplayName("A bound value is not callable")
        void boundValueNotCallable() {
            assertThatThrownBy(() -> evaluator.evaluate(read("(f 1)"), Bindings.of("f", Atom.of(1))))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessageContaining("Not a function");
        }

        @Test
        @DisplayName("Stray unquote, splice and marker are rejected")
        void strayQuasiquoteSyntax() {
            assertThatThrownBy(() -> eval("~x")).isInstanceOf(IllegalUnquoteException.class);
            assertThatThrownBy(() -> eval("~@x")).isInstanceOf(IllegalSpliceException.class);
            assertThatThrownBy(() -> eval("x#")).isInstanceOf(IllegalUnquoteException.class);
        }

        @Test
        @DisplayName("Root splice in a syntax-quote is rejected")
        void rootSplice() {
            assertThatThrownBy(() -> evaluator.evaluate(read("`~@xs"), Bindings.of("xs", ListForm.EMPTY)))
                    .isInstanceOf(IllegalSpliceException.class);
        }
    }
}
