package io.macroxform.core.macro;

import io.macroxform.core.form.Form;
import io.macroxform.core.form.Symbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable name-to-form bindings: the macro's parameters bound to the call's
 * unevaluated argument forms, and the environment construction expressions are
 * evaluated against.
 *
 * @param values bindings in declaration order
 */
public record Bindings(Map<String, Form> values) {

    private static final Bindings EMPTY = new Bindings(Map.of());

    public Bindings {
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(String name, Form value) {
        return empty().with(name, value);
    }

    /**
     * Returns a copy with {@code name} bound to {@code value}, replacing any
     * previous binding.
     */
    public Bindings with(String name, Form value) {
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Form> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new Bindings(copy);
    }

    public Optional<Form> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<Form> lookup(Symbol symbol) {
        return symbol.autoGensym() ? Optional.empty() : lookup(symbol.name());
    }

    /**
     * Returns the form bound to {@code name}.
     *
     * @throws IllegalArgumentException if nothing is bound under that name
     */
    public Form require(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("No binding for: '" + name + "'"));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }
}
