package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when expanding one top-level form takes more macro steps than the
 * configured budget allows. Usually the sign of a macro that expands into
 * itself. URN: {@code urn:macro-xform:error:expansion-depth-exceeded}
 */
public final class ExpansionDepthExceededException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:expansion-depth-exceeded";

    private final int steps;

    public ExpansionDepthExceededException(Form form, String macroName, int steps, int maxSteps) {
        super(
                "Expansion exceeded " + maxSteps + " steps (reached " + steps + ") while expanding '" + macroName
                        + "' in: " + form.print(),
                form,
                macroName);
        this.steps = steps;
    }

    /** Number of expansion steps taken when the budget tripped. */
    public int steps() {
        return steps;
    }
}
