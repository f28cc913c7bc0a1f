package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Abstract parent for errors raised while turning macro calls into ordinary
 * forms. Carries the name of the macro being expanded when one is known.
 */
public abstract class MacroExpansionException extends MacroXformException {

    private static final long serialVersionUID = 1L;

    private final String macroName;

    protected MacroExpansionException(String message, Form form, String macroName) {
        super(message, form, Phase.EXPANSION);
        this.macroName = macroName;
    }

    protected MacroExpansionException(String message, Throwable cause, Form form, String macroName) {
        super(message, cause, form, Phase.EXPANSION);
        this.macroName = macroName;
    }

    /**
     * The macro being expanded, or {@code null} if the error is not tied to
     * one.
     */
    public String macroName() {
        return macroName;
    }
}
