package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Abstract parent for errors raised while evaluating construction expressions
 * or macro bodies.
 */
public abstract class FormEvalException extends MacroXformException {

    private static final long serialVersionUID = 1L;

    protected FormEvalException(String message, Form form) {
        super(message, form, Phase.EVALUATION);
    }

    protected FormEvalException(String message, Throwable cause, Form form) {
        super(message, cause, form, Phase.EVALUATION);
    }
}
