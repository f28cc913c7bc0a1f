package io.macroxform.core.form;

import java.util.Objects;

/**
 * A splice hole inside a syntax-quote template, written {@code ~@form}. The
 * wrapped form must evaluate to a sequence; its elements are flattened into the
 * surrounding list or vector.
 */
public record UnquoteSplicing(Form form) implements Form {

    public UnquoteSplicing {
        Objects.requireNonNull(form, "form must not be null");
    }

    @Override
    public String toString() {
        return print();
    }
}
