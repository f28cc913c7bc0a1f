package io.macroxform.core.error;

import io.macroxform.core.form.Form;

/**
 * Thrown when evaluation meets a symbol with no binding and no primitive. URN:
 * {@code urn:macro-xform:error:unbound-symbol}
 */
public final class UnboundSymbolException extends FormEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:macro-xform:error:unbound-symbol";

    private final String symbol;

    public UnboundSymbolException(String symbol, Form form) {
        super("Unable to resolve symbol: '" + symbol + "'", form);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
