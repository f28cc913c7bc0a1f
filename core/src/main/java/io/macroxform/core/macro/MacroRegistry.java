package io.macroxform.core.macro;

import io.macroxform.core.error.UnknownMacroException;
import io.macroxform.core.form.Symbol;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps macro names to their definitions. Thread-safe: lookups may run
 * concurrently with {@link #define}. There is no removal; redefinition replaces
 * the entry (last-write-wins).
 */
public final class MacroRegistry {

    private final Map<String, MacroDefinition> macros = new ConcurrentHashMap<>();

    /**
     * Installs or replaces a definition under its name. Call sites expanded
     * earlier are not affected.
     *
     * @param definition the macro definition
     * @return {@code true} if an existing definition was replaced
     * @throws NullPointerException if definition is null
     */
    public boolean define(MacroDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        return macros.put(definition.name().name(), definition) != null;
    }

    /**
     * Looks up a macro by symbol. Auto-gensym markers never name a macro.
     *
     * @return the definition, or empty if none is registered
     */
    public Optional<MacroDefinition> lookup(Symbol name) {
        if (name == null || name.autoGensym()) {
            return Optional.empty();
        }
        return Optional.ofNullable(macros.get(name.name()));
    }

    /**
     * Looks up a macro by symbol, throwing if not found.
     *
     * @throws UnknownMacroException if no macro is registered under that name
     */
    public MacroDefinition require(Symbol name) {
        return lookup(name).orElseThrow(() -> new UnknownMacroException(name.name(), name));
    }

    /** Returns {@code true} if {@code name} has a registered definition. */
    public boolean isMacro(Symbol name) {
        return lookup(name).isPresent();
    }

    /** Sorted snapshot of all registered macro names. */
    public Set<String> names() {
        return new TreeSet<>(macros.keySet());
    }

    /** Returns the number of registered macros. */
    public int size() {
        return macros.size();
    }
}
