package io.macroxform.core.engine;

import io.macroxform.core.error.ExpansionDepthExceededException;
import io.macroxform.core.error.IllegalSpliceException;
import io.macroxform.core.error.IllegalUnquoteException;
import io.macroxform.core.error.MacroUsedAsValueException;
import io.macroxform.core.error.MacroXformException;
import io.macroxform.core.error.TransformerFailedException;
import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.MapForm;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.form.SyntaxQuote;
import io.macroxform.core.form.Unquote;
import io.macroxform.core.form.UnquoteSplicing;
import io.macroxform.core.form.VectorForm;
import io.macroxform.core.macro.Bindings;
import io.macroxform.core.macro.MacroDefinition;
import io.macroxform.core.macro.MacroRegistry;
import io.macroxform.core.quasi.GensymRenamer;
import io.macroxform.core.quasi.QuasiquoteExpander;
import io.macroxform.core.spi.ExpansionContext;
import io.macroxform.core.spi.FormEvaluator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns macro calls into ordinary forms.
 *
 * <p>
 * {@link #expandOnce(Form)} applies one transformer to the form itself, if it
 * is a macro call. {@link #expandFull(Form)} first expands the root until it
 * stops being a macro call, then walks the children depth first, left to right.
 * Quoted data is left alone. A syntax-quote met in the tree has the contents of
 * its holes expanded and is then rewritten to its construction expression,
 * which is not walked again, so macros named like the construction primitives
 * cannot capture it. All steps taken for one top-level form count against a
 * single {@link ExpansionBudget}.
 *
 * <p>
 * Thread-safe: the only shared state is the registry, which is only read here,
 * and the gensym counter. Expansions of independent top-level forms may run in
 * parallel.
 */
public final class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private final MacroRegistry registry;
    private final FormEvaluator evaluator;
    private final QuasiquoteExpander quasiquote;
    private final ExpansionBudget budget;
    private final SpecialForms specialForms;
    private final boolean rejectMacroValues;

    /**
     * Creates an expander with the default budget and special forms, rejecting
     * macro values.
     *
     * @param registry  macro definitions to consult
     * @param evaluator runs template macro bodies
     */
    public MacroExpander(MacroRegistry registry, FormEvaluator evaluator) {
        this(registry, evaluator, ExpansionBudget.DEFAULT, SpecialForms.DEFAULT, true);
    }

    /**
     * Creates an expander with all options.
     *
     * @param registry          macro definitions to consult
     * @param evaluator         runs template macro bodies
     * @param budget            step limit per top-level form
     * @param specialForms      head symbols that are never macro calls
     * @param rejectMacroValues whether a macro name in a value position is an
     *                          error
     */
    public MacroExpander(
            MacroRegistry registry,
            FormEvaluator evaluator,
            ExpansionBudget budget,
            SpecialForms specialForms,
            boolean rejectMacroValues) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.specialForms = Objects.requireNonNull(specialForms, "specialForms must not be null");
        this.rejectMacroValues = rejectMacroValues;
        this.quasiquote = new QuasiquoteExpander();
    }

    /**
     * Returns the definition {@code form} calls, if it is a macro call: a
     * non-empty list whose head is a plain symbol with a registered macro and
     * not a special form.
     */
    public Optional<MacroDefinition> macroFor(Form form) {
        if (!(form instanceof ListForm list)) {
            return Optional.empty();
        }
        return list.headSymbol().filter(head -> !specialForms.isSpecial(head)).flatMap(registry::lookup);
    }

    public boolean isMacroCall(Form form) {
        return macroFor(form).isPresent();
    }

    /**
     * Expands {@code form} by one step. Returns the transformer's result
     * unevaluated, or {@code form} itself when it is not a macro call.
     *
     * @throws io.macroxform.core.error.ArityMismatchException if the arguments
     *                                                         do not fit the
     *                                                         pattern
     * @throws TransformerFailedException if the transformer throws or returns
     *                                    {@code null}
     */
    public Form expandOnce(Form form) {
        Optional<MacroDefinition> macro = macroFor(form);
        if (macro.isEmpty()) {
            return form;
        }
        return applyTransformer((ListForm) form, macro.get());
    }

    /**
     * Expands {@code form} until it contains no macro calls.
     *
     * @throws ExpansionDepthExceededException if the step budget runs out
     * @throws MacroXformException on any other expansion failure; no partial
     *                             result is returned
     */
    public Form expandFull(Form form) {
        return expandTracked(form).form();
    }

    /**
     * Like {@link #expandFull(Form)}, also reporting how many steps were taken.
     */
    public ExpansionResult expandTracked(Form form) {
        Objects.requireNonNull(form, "form must not be null");
        StepCounter steps = new StepCounter();
        Form expanded = expand(form, steps);
        return new ExpansionResult(expanded, steps.count);
    }

    private Form expand(Form form, StepCounter steps) {
        Form current = form;
        Optional<MacroDefinition> macro = macroFor(current);
        while (macro.isPresent()) {
            steps.count++;
            if (steps.count > budget.maxSteps()) {
                throw new ExpansionDepthExceededException(
                        current, macro.get().name().name(), steps.count, budget.maxSteps());
            }
            current = applyTransformer((ListForm) current, macro.get());
            macro = macroFor(current);
        }
        return expandChildren(current, steps);
    }

    private Form expandChildren(Form form, StepCounter steps) {
        if (form instanceof Atom) {
            return form;
        }
        if (form instanceof Symbol symbol) {
            checkValueSymbol(symbol);
            return symbol;
        }
        if (form instanceof ListForm list) {
            if (list.isEmpty() || Forms.isQuote(list)) {
                return list;
            }
            List<Form> expanded = new ArrayList<>(list.size());
            Form head = list.get(0);
            if (head instanceof Symbol headSymbol) {
                if (headSymbol.autoGensym()) {
                    checkValueSymbol(headSymbol);
                }
                expanded.add(headSymbol);
            } else {
                expanded.add(expand(head, steps));
            }
            for (Form element : list.tail()) {
                expanded.add(expand(element, steps));
            }
            return list.withElements(expanded);
        }
        if (form instanceof VectorForm vector) {
            List<Form> expanded = new ArrayList<>(vector.size());
            for (Form element : vector.elements()) {
                expanded.add(expand(element, steps));
            }
            return new VectorForm(expanded);
        }
        if (form instanceof MapForm map) {
            List<MapForm.Entry> expanded = new ArrayList<>(map.size());
            for (MapForm.Entry entry : map.entries()) {
                expanded.add(new MapForm.Entry(expand(entry.key(), steps), expand(entry.value(), steps)));
            }
            return new MapForm(expanded);
        }
        if (form instanceof SyntaxQuote syntaxQuote) {
            // holes first; the construction scaffolding is engine output and never walked
            return quasiquote.expand(expandHoles(syntaxQuote.template(), steps));
        }
        if (form instanceof Unquote) {
            throw new IllegalUnquoteException("Unquote outside syntax-quote: " + form.print(), form);
        }
        if (form instanceof UnquoteSplicing) {
            throw new IllegalSpliceException("Splice outside syntax-quote: " + form.print(), form);
        }
        throw new IllegalStateException("Unknown form type: " + form.getClass().getName());
    }

    /**
     * Expands the forms inside the unquote and splice holes of
     * {@code template}, leaving the quoted parts as they are. A nested
     * syntax-quote belongs to the inner level and is left alone.
     */
    private Form expandHoles(Form template, StepCounter steps) {
        if (template instanceof Unquote unquote) {
            return new Unquote(expand(unquote.form(), steps));
        }
        if (template instanceof UnquoteSplicing splice) {
            return new UnquoteSplicing(expand(splice.form(), steps));
        }
        if (template instanceof ListForm list) {
            List<Form> expanded = new ArrayList<>(list.size());
            for (Form element : list.elements()) {
                expanded.add(expandHoles(element, steps));
            }
            return list.withElements(expanded);
        }
        if (template instanceof VectorForm vector) {
            List<Form> expanded = new ArrayList<>(vector.size());
            for (Form element : vector.elements()) {
                expanded.add(expandHoles(element, steps));
            }
            return new VectorForm(expanded);
        }
        if (template instanceof MapForm map) {
            List<MapForm.Entry> expanded = new ArrayList<>(map.size());
            for (MapForm.Entry entry : map.entries()) {
                expanded.add(new MapForm.Entry(expandHoles(entry.key(), steps), expandHoles(entry.value(), steps)));
            }
            return new MapForm(expanded);
        }
        return template;
    }

    private void checkValueSymbol(Symbol symbol) {
        if (symbol.autoGensym()) {
            throw new IllegalUnquoteException("Auto-gensym marker outside syntax-quote: " + symbol.print(), symbol);
        }
        if (rejectMacroValues && registry.isMacro(symbol)) {
            throw new MacroUsedAsValueException(symbol.name(), symbol);
        }
    }

    private Form applyTransformer(ListForm call, MacroDefinition macro) {
        String name = macro.name().name();
        Bindings bindings = macro.params().bind(call.tail(), name, call);
        Form result;
        try {
            result = macro.transformer().transform(new Context(call, macro, bindings));
        } catch (MacroXformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformerFailedException(
                    "Transformer of macro '" + name + "' failed: " + e.getMessage(), e, call, name);
        }
        if (result == null) {
            throw new TransformerFailedException(
                    "Transformer of macro '" + name + "' returned null", null, call, name);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("macro.expanded name={} location={} result={}", name, call.location(), result.print());
        }
        return result;
    }

    private static final class StepCounter {
        private int count;
    }

    /** Expansion context of one transformer invocation. */
    private final class Context implements ExpansionContext {

        private final ListForm call;
        private final MacroDefinition macro;
        private final Bindings bindings;

        Context(ListForm call, MacroDefinition macro, Bindings bindings) {
            this.call = call;
            this.macro = macro;
            this.bindings = bindings;
        }

        @Override
        public ListForm call() {
            return call;
        }

        @Override
        public MacroDefinition macro() {
            return macro;
        }

        @Override
        public Bindings bindings() {
            return bindings;
        }

        @Override
        public Symbol gensym(String prefix) {
            return GensymRenamer.gensym(prefix);
        }

        @Override
        public Form syntaxQuote(Form template) {
            return evaluator.evaluate(quasiquote.expand(template), bindings);
        }

        @Override
        public Form evaluate(Form form) {
            return evaluator.evaluate(form, bindings);
        }
    }
}
