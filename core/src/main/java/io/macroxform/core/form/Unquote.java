package io.macroxform.core.form;

import java.util.Objects;

/**
 * An unquoted hole inside a syntax-quote template, written {@code ~form}. The
 * wrapped form is evaluated when the construction expression runs and
 * substituted as a single element.
 */
public record Unquote(Form form) implements Form {

    public Unquote {
        Objects.requireNonNull(form, "form must not be null");
    }

    @Override
    public String toString() {
        return print();
    }
}
