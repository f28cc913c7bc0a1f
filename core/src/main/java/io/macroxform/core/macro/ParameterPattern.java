package io.macroxform.core.macro;

import io.macroxform.core.error.ArityMismatchException;
import io.macroxform.core.error.InvalidMacroDefinitionException;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.form.VectorForm;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes how call-site argument forms bind to names visible in a transformer
 * body.
 *
 * <p>
 * A pattern is a vector (or list) of positional slots, optionally followed by
 * {@code &} and a single rest name. A slot is either a symbol or a nested
 * pattern that destructures a list or vector argument form, e.g.
 * {@code [[name value] & body]}. The rest name binds a list of the remaining
 * argument forms, empty when none remain.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class ParameterPattern {

    private static final String REST_MARKER = "&";

    /**
     * A positional slot: exactly one of {@code name} and {@code nested} is set.
     */
    private record Slot(String name, ParameterPattern nested) {
        @Override
        public String toString() {
            return name != null ? name : nested.shape();
        }
    }

    private final List<Slot> required;
    private final String rest;

    private ParameterPattern(List<Slot> required, String rest) {
        this.required = List.copyOf(required);
        this.rest = rest;
    }

    /** A pattern that accepts no arguments. */
    public static ParameterPattern none() {
        return new ParameterPattern(List.of(), null);
    }

    /**
     * Parses a pattern form.
     *
     * @param params     a vector or list of symbols, {@code &} and nested
     *                   patterns
     * @param macroName  the macro being defined, for error messages
     * @param source     where the definition came from, may be {@code null}
     * @throws InvalidMacroDefinitionException if the pattern is malformed
     */
    public static ParameterPattern parse(Form params, String macroName, String source) {
        ParameterPattern pattern = parseLevel(params, macroName, source);
        pattern.checkDuplicates(new HashSet<>(), macroName, source);
        return pattern;
    }

    private static ParameterPattern parseLevel(Form params, String macroName, String source) {
        List<Form> elements;
        if (params instanceof VectorForm vector) {
            elements = vector.elements();
        } else if (params instanceof ListForm list) {
            elements = list.elements();
        } else {
            throw new InvalidMacroDefinitionException(
                    "Parameter pattern must be a vector or list, got: " + params.print(), macroName, source);
        }

        List<Slot> slots = new ArrayList<>();
        String rest = null;
        for (int i = 0; i < elements.size(); i++) {
            Form element = elements.get(i);
            if (element instanceof Symbol symbol && !symbol.autoGensym() && symbol.name().equals(REST_MARKER)) {
                if (i != elements.size() - 2) {
                    throw new InvalidMacroDefinitionException(
                            "'&' must be followed by exactly one rest parameter in: " + params.print(),
                            macroName,
                            source);
                }
                rest = requireName(elements.get(i + 1), params, macroName, source);
                break;
            }
            if (element instanceof VectorForm || element instanceof ListForm) {
                slots.add(new Slot(null, parseLevel(element, macroName, source)));
            } else {
                slots.add(new Slot(requireName(element, params, macroName, source), null));
            }
        }
        return new ParameterPattern(slots, rest);
    }

    private static String requireName(Form element, Form params, String macroName, String source) {
        if (!(element instanceof Symbol symbol) || symbol.autoGensym() || symbol.name().equals(REST_MARKER)) {
            throw new InvalidMacroDefinitionException(
                    "Invalid parameter " + element.print() + " in: " + params.print(), macroName, source);
        }
        return symbol.name();
    }

    private void checkDuplicates(Set<String> seen, String macroName, String source) {
        for (Slot slot : required) {
            if (slot.nested() != null) {
                slot.nested().checkDuplicates(seen, macroName, source);
            } else if (!seen.add(slot.name())) {
                throw new InvalidMacroDefinitionException(
                        "Duplicate parameter '" + slot.name() + "' in: " + shape(), macroName, source);
            }
        }
        if (rest != null && !seen.add(rest)) {
            throw new InvalidMacroDefinitionException(
                    "Duplicate parameter '" + rest + "' in: " + shape(), macroName, source);
        }
    }

    /**
     * Binds argument forms to this pattern.
     *
     * @param args      the call's argument forms, unevaluated
     * @param macroName the macro being expanded
     * @param call      the whole call form, for error reporting
     * @throws ArityMismatchException if the arguments do not fit
     */
    public Bindings bind(List<Form> args, String macroName, Form call) {
        Map<String, Form> values = new LinkedHashMap<>();
        bindInto(args, values, macroName, call);
        return new Bindings(values);
    }

    private void bindInto(List<Form> args, Map<String, Form> values, String macroName, Form call) {
        if (args.size() < required.size() || (rest == null && args.size() > required.size())) {
            throw new ArityMismatchException(macroName, shape(), args.size(), call);
        }
        for (int i = 0; i < required.size(); i++) {
            Slot slot = required.get(i);
            Form arg = args.get(i);
            if (slot.name() != null) {
                values.put(slot.name(), arg);
            } else if (arg instanceof ListForm list) {
                slot.nested().bindInto(list.elements(), values, macroName, call);
            } else if (arg instanceof VectorForm vector) {
                slot.nested().bindInto(vector.elements(), values, macroName, call);
            } else {
                throw new ArityMismatchException(
                        "Macro '" + macroName + "' expects a list or vector matching " + slot.nested().shape()
                                + " but got " + arg.print() + " in: " + call.print(),
                        macroName,
                        slot.nested().shape(),
                        1,
                        call);
            }
        }
        if (rest != null) {
            values.put(rest, new ListForm(args.subList(required.size(), args.size())));
        }
    }

    /** Minimum number of arguments at the top level. */
    public int minArity() {
        return required.size();
    }

    /** Whether the pattern accepts any number of trailing arguments. */
    public boolean isVariadic() {
        return rest != null;
    }

    /** Every name this pattern binds, depth first. */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Slot slot : required) {
            if (slot.nested() != null) {
                names.addAll(slot.nested().names());
            } else {
                names.add(slot.name());
            }
        }
        if (rest != null) {
            names.add(rest);
        }
        return names;
    }

    /** The pattern in reader syntax, e.g. {@code [test & body]}. */
    public String shape() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < required.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(required.get(i));
        }
        if (rest != null) {
            if (!required.isEmpty()) {
                sb.append(' ');
            }
            sb.append("& ").append(rest);
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return shape();
    }
}
