package io.macroxform.core.form;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Static helpers for building and inspecting forms. */
public final class Forms {

    public static final Symbol QUOTE = Symbol.of("quote");

    private Forms() {
        // utility class
    }

    public static Symbol sym(String name) {
        return Symbol.of(name);
    }

    public static ListForm list(Form... elements) {
        return ListForm.of(elements);
    }

    /** Builds {@code (quote form)}. */
    public static ListForm quote(Form form) {
        return ListForm.of(QUOTE, form);
    }

    /**
     * Returns {@code true} if {@code form} is a list whose head is the plain
     * symbol {@code name}.
     */
    public static boolean isCallTo(Form form, String name) {
        return form instanceof ListForm list
                && list.headSymbol()
                        .filter(s -> !s.autoGensym() && s.name().equals(name))
                        .isPresent();
    }

    /** Returns {@code true} for {@code (quote x)}. */
    public static boolean isQuote(Form form) {
        return isCallTo(form, QUOTE.name()) && ((ListForm) form).size() == 2;
    }

    /**
     * Views a form as a sequence of elements. Lists and vectors yield their
     * elements, maps their entries as two-element vectors, and nil the empty
     * sequence.
     *
     * @return the elements, or empty if the form is not sequential
     */
    public static Optional<List<Form>> asSequence(Form form) {
        if (form instanceof ListForm list) {
            return Optional.of(list.elements());
        }
        if (form instanceof VectorForm vector) {
            return Optional.of(vector.elements());
        }
        if (form instanceof MapForm map) {
            List<Form> pairs = new ArrayList<>(map.size());
            for (MapForm.Entry entry : map.entries()) {
                pairs.add(VectorForm.of(entry.key(), entry.value()));
            }
            return Optional.of(pairs);
        }
        if (form instanceof Atom atom && atom.kind() == Atom.Kind.NIL) {
            return Optional.of(List.of());
        }
        return Optional.empty();
    }

    /** The nearest source location carried by {@code form}, if any. */
    public static SourceLocation locationOf(Form form) {
        return form instanceof ListForm list ? list.location() : null;
    }
}
