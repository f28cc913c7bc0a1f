package io.macroxform.core.error;

/**
 * Abstract parent for definition-time errors: macro libraries, macro
 * definitions and engine configuration. Carries a {@code source} field
 * identifying the file or resource at fault.
 */
public abstract class MacroLoadException extends MacroXformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected MacroLoadException(String message, String source) {
        super(message, null, Phase.LOAD);
        this.source = source;
    }

    protected MacroLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
    }

    /**
     * The file path or resource identifier that caused the error, or
     * {@code null}.
     */
    public String source() {
        return source;
    }
}
