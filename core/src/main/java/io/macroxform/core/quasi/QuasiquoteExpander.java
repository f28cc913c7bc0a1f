package io.macroxform.core.quasi;

import io.macroxform.core.error.IllegalSpliceException;
import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.MapForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.form.SyntaxQuote;
import io.macroxform.core.form.Unquote;
import io.macroxform.core.form.UnquoteSplicing;
import io.macroxform.core.form.VectorForm;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a syntax-quote template into a construction expression: a form that,
 * once evaluated, rebuilds the template with unquoted holes substituted and
 * spliced sequences flattened.
 *
 * <p>
 * Output vocabulary:
 *
 * <ul>
 * <li>atoms stay as they are, since they evaluate to themselves;
 * <li>symbols become {@code (quote sym)}, auto-gensym markers resolved first;
 * <li>{@code ~u} becomes {@code u};
 * <li>lists become {@code (seq (concat part ...))}, the empty list
 * {@code (list)};
 * <li>vectors become {@code (apply vector (seq (concat part ...)))};
 * <li>maps become {@code (apply hash-map (seq (concat part ...)))} over keys
 * and values;
 * </ul>
 *
 * where each part is {@code (list e')} for an ordinary element and {@code s}
 * for {@code ~@s}. Children are visited left to right, which fixes the
 * evaluation order of the holes.
 *
 * <p>
 * Stateless and thread-safe. Each call to {@link #expand(Form)} opens its own
 * gensym scope.
 */
public final class QuasiquoteExpander {

    public static final Symbol SEQ = Symbol.of("seq");
    public static final Symbol CONCAT = Symbol.of("concat");
    public static final Symbol LIST = Symbol.of("list");
    public static final Symbol APPLY = Symbol.of("apply");
    public static final Symbol VECTOR = Symbol.of("vector");
    public static final Symbol HASH_MAP = Symbol.of("hash-map");

    /**
     * Expands {@code template} (the form inside a syntax-quote) into its
     * construction expression.
     *
     * @throws IllegalSpliceException if a splice appears as the root or inside
     *                                a map
     */
    public Form expand(Form template) {
        if (template instanceof UnquoteSplicing) {
            throw new IllegalSpliceException("Splice not in list: cannot splice as the template root", template);
        }
        return syntaxQuote(template, GensymRenamer.newScope());
    }

    private Form syntaxQuote(Form form, GensymRenamer.Scope scope) {
        if (form instanceof Atom) {
            return form;
        }
        if (form instanceof Symbol symbol) {
            return Forms.quote(symbol.autoGensym() ? scope.resolve(symbol) : symbol);
        }
        if (form instanceof Unquote unquote) {
            return unquote.form();
        }
        if (form instanceof UnquoteSplicing) {
            throw new IllegalSpliceException("Splice not in list: " + form.print(), form);
        }
        if (form instanceof SyntaxQuote nested) {
            // inner template first, with its own gensym scope, then quote what it produced
            return syntaxQuote(expand(nested.template()), scope);
        }
        if (form instanceof ListForm list) {
            if (list.isEmpty()) {
                return new ListForm(List.of(LIST), list.location());
            }
            return new ListForm(List.of(SEQ, concat(list.elements(), scope)), list.location());
        }
        if (form instanceof VectorForm vector) {
            return Forms.list(APPLY, VECTOR, Forms.list(SEQ, concat(vector.elements(), scope)));
        }
        if (form instanceof MapForm map) {
            for (MapForm.Entry entry : map.entries()) {
                if (entry.key() instanceof UnquoteSplicing || entry.value() instanceof UnquoteSplicing) {
                    throw new IllegalSpliceException(
                            "Splice not allowed in a map key or value position: " + map.print(), map);
                }
            }
            return Forms.list(APPLY, HASH_MAP, Forms.list(SEQ, concat(map.flatten(), scope)));
        }
        throw new IllegalStateException("Unknown form type: " + form.getClass().getName());
    }

    private ListForm concat(List<Form> elements, GensymRenamer.Scope scope) {
        List<Form> parts = new ArrayList<>(elements.size() + 1);
        parts.add(CONCAT);
        for (Form element : elements) {
            if (element instanceof UnquoteSplicing splice) {
                parts.add(splice.form());
            } else {
                parts.add(Forms.list(LIST, syntaxQuote(element, scope)));
            }
        }
        return new ListForm(parts);
    }
}
