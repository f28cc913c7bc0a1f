package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when an unquote-splice appears outside a list or vector element
 * position: as a template root, as a map key or value, or outside any
 * syntax-quote. URN: {@code urn:macro-xform:error:illegal-splice}
 */
public final class IllegalSpliceException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:illegal-splice";

    public IllegalSpliceException(String message, Form form) {
        super(message, form, null);
    }
}
