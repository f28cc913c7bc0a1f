package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Wraps an unexpected exception thrown by a macro transformer. URN:
 * {@code urn:macro-xform:error:transformer-failed}
 */
public final class TransformerFailedException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:transformer-failed";

    public TransformerFailedException(String message, Throwable cause, Form form, String macroName) {
        super(message, cause, form, macroName);
    }
}
