package io.macroxform.core.eval;

import io.macroxform.core.error.EvaluationException;
import io.macroxform.core.error.IllegalSpliceException;
import io.macroxform.core.error.IllegalUnquoteException;
import io.macroxform.core.error.MacroUsedAsValueException;
import io.macroxform.core.error.UnboundSymbolException;
import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.MapForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.form.SyntaxQuote;
import io.macroxform.core.form.Unquote;
import io.macroxform.core.form.UnquoteSplicing;
import io.macroxform.core.form.VectorForm;
import io.macroxform.core.macro.Bindings;
import io.macroxform.core.macro.MacroRegistry;
import io.macroxform.core.quasi.QuasiquoteExpander;
import io.macroxform.core.spi.FormEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference {@link FormEvaluator} for expansion time. It understands exactly
 * what construction expressions and template macro bodies need, not a general
 * language:
 *
 * <ul>
 * <li>atoms evaluate to themselves; vectors and maps evaluate their elements;
 * <li>symbols resolve through the bindings;
 * <li>{@code (quote x)}, {@code (apply f arg... seq)} and {@code (map f seq)}
 * are special;
 * <li>any other call must name a {@link Primitive}:
 * {@code list concat seq vector hash-map cons first rest count gensym}, plus
 * whatever is registered with {@link #definePrimitive};
 * <li>a syntax-quote is expanded (one fresh gensym scope) and its construction
 * expression evaluated.
 * </ul>
 *
 * <p>
 * Call heads resolve to primitives before bindings, so a macro parameter named
 * {@code list} does not break the construction vocabulary. A macro name used
 * where a value or function is needed fails with
 * {@link MacroUsedAsValueException}: macros have no function value.
 *
 * <p>
 * Thread-safe.
 */
public final class ConstructionEvaluator implements FormEvaluator {

    private static final String QUOTE = "quote";
    private static final String APPLY = "apply";
    private static final String MAP = "map";

    private final MacroRegistry registry;
    private final QuasiquoteExpander quasiquote = new QuasiquoteExpander();
    private final Map<String, Primitive> primitives = new ConcurrentHashMap<>(Primitives.builtins());

    /**
     * @param registry consulted to report macros used as values
     */
    public ConstructionEvaluator(MacroRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Registers or replaces a primitive.
     *
     * @throws IllegalArgumentException if {@code name} is one of the special
     *                                  forms
     */
    public void definePrimitive(String name, Primitive primitive) {
        Objects.requireNonNull(primitive, "primitive must not be null");
        if (name == null || name.isEmpty() || name.equals(QUOTE) || name.equals(APPLY) || name.equals(MAP)) {
            throw new IllegalArgumentException("invalid primitive name: '" + name + "'");
        }
        primitives.put(name, primitive);
    }

    public boolean hasPrimitive(String name) {
        return primitives.containsKey(name);
    }

    @Override
    public Form evaluate(Form form, Bindings bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        if (form instanceof Atom) {
            return form;
        }
        if (form instanceof Symbol symbol) {
            return resolveValue(symbol, bindings);
        }
        if (form instanceof VectorForm vector) {
            return new VectorForm(evaluateAll(vector.elements(), bindings));
        }
        if (form instanceof MapForm map) {
            List<MapForm.Entry> entries = new ArrayList<>(map.size());
            for (MapForm.Entry entry : map.entries()) {
                entries.add(new MapForm.Entry(evaluate(entry.key(), bindings), evaluate(entry.value(), bindings)));
            }
            return new MapForm(entries);
        }
        if (form instanceof SyntaxQuote syntaxQuote) {
            return evaluate(quasiquote.expand(syntaxQuote.template()), bindings);
        }
        if (form instanceof Unquote) {
            throw new IllegalUnquoteException("Unquote outside syntax-quote: " + form.print(), form);
        }
        if (form instanceof UnquoteSplicing) {
            throw new IllegalSpliceException("Splice outside syntax-quote: " + form.print(), form);
        }
        if (form instanceof ListForm list) {
            return list.isEmpty() ? list : evaluateCall(list, bindings);
        }
        throw new IllegalStateException("Unknown form type: " + form.getClass().getName());
    }

    private Form evaluateCall(ListForm call, Bindings bindings) {
        if (!(call.get(0) instanceof Symbol head) || head.autoGensym()) {
            throw new EvaluationException("Cannot call " + call.get(0).print() + " in: " + call.print(), call);
        }
        switch (head.name()) {
            case QUOTE -> {
                if (call.size() != 2) {
                    throw new EvaluationException("quote expects exactly 1 argument in: " + call.print(), call);
                }
                return call.get(1);
            }
            case APPLY -> {
                return evaluateApply(call, bindings);
            }
            case MAP -> {
                return evaluateMap(call, bindings);
            }
            default -> {
                Primitive primitive = resolveFunction(head, call, bindings);
                return invoke(primitive, head.name(), evaluateAll(call.tail(), bindings), call);
            }
        }
    }

    /** {@code (apply f a b seq)}: calls f with a, b and the elements of seq. */
    private Form evaluateApply(ListForm call, Bindings bindings) {
        if (call.size() < 3) {
            throw new EvaluationException("apply expects a function and a sequence in: " + call.print(), call);
        }
        Primitive function = resolveFunctionArgument(call.get(1), call, bindings);
        List<Form> args = new ArrayList<>(evaluateAll(call.elements().subList(2, call.size() - 1), bindings));
        args.addAll(sequence(evaluate(call.get(call.size() - 1), bindings), APPLY, call));
        return invoke(function, call.get(1).print(), args, call);
    }

    /** {@code (map f seq)}: a list of f applied to each element. */
    private Form evaluateMap(ListForm call, Bindings bindings) {
        if (call.size() != 3) {
            throw new EvaluationException("map expects a function and a sequence in: " + call.print(), call);
        }
        Primitive function = resolveFunctionArgument(call.get(1), call, bindings);
        List<Form> result = new ArrayList<>();
        for (Form element : sequence(evaluate(call.get(2), bindings), MAP, call)) {
            result.add(invoke(function, call.get(1).print(), List.of(element), call));
        }
        return new ListForm(result);
    }

    private Primitive resolveFunctionArgument(Form function, ListForm call, Bindings bindings) {
        if (function instanceof Symbol symbol && !symbol.autoGensym()) {
            return resolveFunction(symbol, call, bindings);
        }
        throw new EvaluationException("Not a function: " + function.print() + " in: " + call.print(), call);
    }

    private Primitive resolveFunction(Symbol symbol, ListForm call, Bindings bindings) {
        Primitive primitive = primitives.get(symbol.name());
        if (primitive != null) {
            return primitive;
        }
        if (bindings.contains(symbol.name())) {
            throw new EvaluationException(
                    "Not a function: '" + symbol.name() + "' is bound to "
                            + bindings.require(symbol.name()).print() + " in: " + call.print(),
                    call);
        }
        if (registry.isMacro(symbol)) {
            if (call.get(0).equals(symbol)) {
                throw new EvaluationException(
                        "Macro call must be expanded before evaluation: " + call.print(), call);
            }
            throw new MacroUsedAsValueException(symbol.name(), call);
        }
        throw new UnboundSymbolException(symbol.name(), call);
    }

    private Form resolveValue(Symbol symbol, Bindings bindings) {
        if (symbol.autoGensym()) {
            throw new IllegalUnquoteException("Auto-gensym marker outside syntax-quote: " + symbol.print(), symbol);
        }
        Optional<Form> bound = bindings.lookup(symbol);
        if (bound.isPresent()) {
            return bound.get();
        }
        if (registry.isMacro(symbol)) {
            throw new MacroUsedAsValueException(symbol.name(), symbol);
        }
        if (primitives.containsKey(symbol.name())) {
            throw new EvaluationException(
                    "Primitive '" + symbol.name() + "' can only be called, or passed to apply or map", symbol);
        }
        throw new UnboundSymbolException(symbol.name(), symbol);
    }

    private List<Form> evaluateAll(List<Form> forms, Bindings bindings) {
        List<Form> values = new ArrayList<>(forms.size());
        for (Form form : forms) {
            values.add(evaluate(form, bindings));
        }
        return values;
    }

    private static List<Form> sequence(Form value, String caller, ListForm call) {
        try {
            return Primitives.toSequence(value, caller);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(e.getMessage() + " in: " + call.print(), e, call);
        }
    }

    private static Form invoke(Primitive primitive, String name, List<Form> args, ListForm call) {
        try {
            return primitive.apply(args);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException(name + ": " + e.getMessage() + " in: " + call.print(), e, call);
        }
    }
}
