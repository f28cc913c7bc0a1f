package io.macroxform.core.error;

/**
 * Thrown when a macro library file has invalid YAML, fails schema validation or
 * holds a form that cannot be decoded. URN:
 * {@code urn:macro-xform:error:library-parse-failed}
 */
public final class MacroLibraryParseException extends MacroLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:library-parse-failed";

    public MacroLibraryParseException(String message, String source) {
        super(message, source);
    }

    public MacroLibraryParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
