package io.macroxform.core.error;

import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.SourceLocation;

/**
 * Abstract base for all macro-xform exceptions. Never thrown directly: use the
 * concrete subclasses under {@link MacroLoadException},
 * {@link MacroExpansionException} or {@link FormEvalException}.
 *
 * <p>
 * Nothing in the engine recovers from these internally. A failure anywhere
 * inside a top-level form aborts the expansion of that whole form.
 */
public abstract class MacroXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXPANSION,
        EVALUATION
    }

    private final transient Form form;
    private final Phase phase;

    protected MacroXformException(String message, Form form, Phase phase) {
        super(message);
        this.form = form;
        this.phase = phase;
    }

    protected MacroXformException(String message, Throwable cause, Form form, Phase phase) {
        super(message, cause);
        this.form = form;
        this.phase = phase;
    }

    /** The offending form, or {@code null} if the error is not tied to one. */
    public Form form() {
        return form;
    }

    /** Source location of the offending form, if the reader supplied one. */
    public SourceLocation location() {
        return form != null ? Forms.locationOf(form) : null;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
