package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when an unquote appears outside any syntax-quote, or an auto-gensym
 * marker is used where no syntax-quote scope can resolve it. URN:
 * {@code urn:macro-xform:error:illegal-unquote}
 */
public final class IllegalUnquoteException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:illegal-unquote";

    public IllegalUnquoteException(String message, Form form) {
        super(message, form, null);
    }
}
