package io.macroxform.core.form;

/**
 * A node in the homoiconic tree representation of code-as-data.
 *
 * <p>
 * The variant set is closed. All implementations are immutable records with
 * structural equality; transformations build new forms rather than mutating
 * existing ones. Because every container copies its children into an
 * unmodifiable list at construction time, no form can contain itself.
 */
public sealed interface Form permits Atom, Symbol, ListForm, VectorForm, MapForm, SyntaxQuote, Unquote, UnquoteSplicing {

    /** Renders this form as Lisp text (see {@link FormPrinter}). */
    default String print() {
        return FormPrinter.print(this);
    }
}
