package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when call-site argument forms do not fit the macro's parameter
 * pattern. URN: {@code urn:macro-xform:error:arity-mismatch}
 */
public final class ArityMismatchException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:arity-mismatch";

    private final String expected;
    private final int actual;

    public ArityMismatchException(String macroName, String expected, int actual, Form form) {
        this(
                "Wrong number of args (" + actual + ") passed to macro '" + macroName + "', expected " + expected
                        + " in: " + (form != null ? form.print() : "<unknown>"),
                macroName,
                expected,
                actual,
                form);
    }

    public ArityMismatchException(String message, String macroName, String expected, int actual, Form form) {
        super(message, form, macroName);
        this.expected = expected;
        this.actual = actual;
    }

    /** The expected shape, e.g. {@code [test & body]}. */
    public String expected() {
        return expected;
    }

    /**
     * Number of argument forms actually supplied at the failing pattern level.
     */
    public int actual() {
        return actual;
    }
}
