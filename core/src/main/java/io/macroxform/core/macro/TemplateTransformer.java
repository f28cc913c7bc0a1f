package io.macroxform.core.macro;

import io.macroxform.core.form.Form;
import io.macroxform.core.spi.ExpansionContext;
import io.macroxform.core.spi.MacroTransformer;
import java.util.Objects;

/**
 * Transformer whose body is a form, usually a syntax-quote template, evaluated
 * against the bound parameters. Each invocation evaluates the body afresh, so
 * auto-gensym markers in it resolve to new symbols on every expansion.
 */
public final class TemplateTransformer implements MacroTransformer {

    private final Form body;

    public TemplateTransformer(Form body) {
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public Form body() {
        return body;
    }

    @Override
    public Form transform(ExpansionContext context) {
        return context.evaluate(body);
    }
}
