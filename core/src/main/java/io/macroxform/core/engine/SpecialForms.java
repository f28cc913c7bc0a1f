package io.macroxform.core.engine;

import io.macroxform.core.form.Symbol;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Head symbols reserved by the evaluator. A list headed by one of these is
 * never a macro call, even when a macro of the same name is registered.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class SpecialForms {

    /** The evaluator's binding, conditional, quoting and control forms. */
    public static final SpecialForms DEFAULT = new SpecialForms(Set.of(
            "quote", "def", "if", "do", "let*", "letfn*", "fn*", "loop*", "recur", "var", "throw", "try",
            "catch", "finally", "set!", "new", ".", "case*"));

    private final Set<String> names;

    private SpecialForms(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    /** Returns a copy that also reserves {@code extra}. */
    public SpecialForms with(Collection<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(names);
        merged.addAll(extra);
        return new SpecialForms(merged);
    }

    public boolean isSpecial(Symbol symbol) {
        return !symbol.autoGensym() && names.contains(symbol.name());
    }

    public Set<String> names() {
        return names;
    }
}
