package io.macroxform.core.spi;

import io.macroxform.core.form.Form;

/**
 * Produces the replacement form for a macro call. The transformer sees the
 * call's arguments unevaluated, bound per the macro's parameter pattern, and
 * returns a form that is itself not evaluated by the expander.
 *
 * <p>
 * Implementations MUST be thread-safe: a single transformer may serve
 * concurrent expansions.
 */
@FunctionalInterface
public interface MacroTransformer {

    /**
     * Builds the expansion of one call.
     *
     * @param context the call, its bindings and expansion-time services
     * @return the replacement form, never {@code null}
     */
    Form transform(ExpansionContext context);
}
