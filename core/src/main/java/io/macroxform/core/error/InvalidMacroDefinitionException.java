package io.macroxform.core.error;

/**
 * Thrown when a macro definition is malformed, e.g. a parameter pattern with a
 * misplaced {@code &} or a duplicated name. URN:
 * {@code urn:macro-xform:error:invalid-macro-definition}
 */
public final class InvalidMacroDefinitionException extends MacroLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:invalid-macro-definition";

    private final String macroName;

    public InvalidMacroDefinitionException(String message, String macroName, String source) {
        super(message, source);
        this.macroName = macroName;
    }

    /**
     * The macro whose definition was rejected, or {@code null} if not yet
     * known.
     */
    public String macroName() {
        return macroName;
    }
}
