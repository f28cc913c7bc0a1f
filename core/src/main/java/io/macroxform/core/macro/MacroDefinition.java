package io.macroxform.core.macro;

import io.macroxform.core.form.Symbol;
import io.macroxform.core.spi.MacroTransformer;
import java.util.Objects;

/**
 * A registered macro. Immutable; redefining a macro replaces the whole registry
 * entry.
 *
 * @param name        the macro name, never an auto-gensym marker
 * @param params      how call-site arguments bind to names
 * @param transformer produces the replacement form
 * @param doc         documentation string, may be {@code null}
 * @param source      the library file or other origin, may be {@code null}
 */
public record MacroDefinition(
        Symbol name, ParameterPattern params, MacroTransformer transformer, String doc, String source) {

    public MacroDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(transformer, "transformer must not be null");
        if (name.autoGensym()) {
            throw new IllegalArgumentException("macro name must not be an auto-gensym marker: " + name.print());
        }
    }

    public MacroDefinition(Symbol name, ParameterPattern params, MacroTransformer transformer) {
        this(name, params, transformer, null, null);
    }
}
