package io.macroxform.core.spi;

import io.macroxform.core.form.Form;
import io.macroxform.core.macro.Bindings;

/**
 * Evaluator used at expansion time to run construction expressions and template
 * macro bodies. Values are forms.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface FormEvaluator {

    /**
     * Evaluates {@code form}.
     *
     * @param form     the form to evaluate
     * @param bindings names visible to the form
     * @return the resulting value
     * @throws io.macroxform.core.error.MacroXformException if evaluation fails
     */
    Form evaluate(Form form, Bindings bindings);
}
