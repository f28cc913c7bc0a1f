package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when a macro name is referenced in a value position instead of as the
 * head of a call. A macro has no function value. URN:
 * {@code urn:macro-xform:error:macro-used-as-value}
 */
public final class MacroUsedAsValueException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:macro-used-as-value";

    public MacroUsedAsValueException(String macroName, Form form) {
        super(
                "Can't take value of a macro: '" + macroName + "'"
                        + (form != null ? " in: " + form.print() : ""),
                form,
                macroName);
    }
}
