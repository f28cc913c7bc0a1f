package io.macroxform.core.error;

/**
 * Thrown when the expander configuration file is missing, unreadable or holds
 * invalid values. URN: {@code urn:macro-xform:error:config-load-failed}
 */
public final class ConfigLoadException extends MacroLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:config-load-failed";

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
