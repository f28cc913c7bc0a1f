package io.macroxform.core.form;

import java.util.Objects;

/** A syntax-quoted template, written {@code `form} by the reader. */
public record SyntaxQuote(Form template) implements Form {

    public SyntaxQuote {
        Objects.requireNonNull(template, "template must not be null");
    }

    @Override
    public String toString() {
        return print();
    }
}
