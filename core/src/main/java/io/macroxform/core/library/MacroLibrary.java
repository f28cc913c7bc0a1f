package io.macroxform.core.library;

import io.macroxform.core.macro.MacroDefinition;
import java.util.List;

/**
 * A parsed macro library file.
 *
 * @param name        library name
 * @param version     library version, may be {@code null}
 * @param description free text, may be {@code null}
 * @param macros      definitions in file order
 * @param source      the file the library came from
 */
public record MacroLibrary(
        String name, String version, String description, List<MacroDefinition> macros, String source) {

    public MacroLibrary {
        macros = List.copyOf(macros);
    }
}
