package io.macroxform.core.spi;

import io.macroxform.core.form.Form;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.macro.Bindings;
import io.macroxform.core.macro.MacroDefinition;

/** What a {@link MacroTransformer} can see and do during one expansion step. */
public interface ExpansionContext {

    /** The macro call being expanded. */
    ListForm call();

    /** The definition being applied. */
    MacroDefinition macro();

    /** Parameters bound to the call's unevaluated argument forms. */
    Bindings bindings();

    /**
     * The form bound to parameter {@code name}.
     *
     * @throws IllegalArgumentException if the pattern has no such parameter
     */
    default Form arg(String name) {
        return bindings().require(name);
    }

    /** A fresh, process-unique symbol starting with {@code prefix}. */
    Symbol gensym(String prefix);

    /**
     * Expands {@code template} as a syntax-quote and evaluates the result
     * against {@link #bindings()}. One call is one gensym scope.
     */
    Form syntaxQuote(Form template);

    /** Evaluates {@code form} against {@link #bindings()}. */
    Form evaluate(Form form);
}
