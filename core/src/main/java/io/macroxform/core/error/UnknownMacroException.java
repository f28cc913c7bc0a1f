package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown by diagnostic lookups when a symbol has no registered macro. Plain
 * expansion never raises it: a list whose head is not a macro is simply not a
 * macro call. URN: {@code urn:macro-xform:error:unknown-macro}
 */
public final class UnknownMacroException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:unknown-macro";

    public UnknownMacroException(String macroName, Form form) {
        super("No macro registered for: '" + macroName + "'", form, macroName);
    }
}
