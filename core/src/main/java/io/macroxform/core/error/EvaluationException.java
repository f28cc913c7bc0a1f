package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when a construction expression or macro body cannot be evaluated, e.g.
 * a primitive receives a non-sequence where it needs one. URN:
 * {@code urn:macro-xform:error:evaluation-failed}
 */
public final class EvaluationException extends FormEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:evaluation-failed";

    public EvaluationException(String message, Form form) {
        super(message, form);
    }

    public EvaluationException(String message, Throwable cause, Form form) {
        super(message, cause, form);
    }
}
