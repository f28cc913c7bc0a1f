package io.macroxform.core.engine;

import io.macroxform.core.config.ConfigLoader;
import io.macroxform.core.config.ExpanderConfig;
import io.macroxform.core.error.MacroXformException;
import io.macroxform.core.eval.ConstructionEvaluator;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.library.MacroLibrary;
import io.macroxform.core.library.MacroLibraryParser;
import io.macroxform.core.macro.Bindings;
import io.macroxform.core.macro.MacroDefinition;
import io.macroxform.core.macro.MacroRegistry;
import io.macroxform.core.macro.ParameterPattern;
import io.macroxform.core.macro.TemplateTransformer;
import io.macroxform.core.spi.ExpansionListener;
import io.macroxform.core.spi.MacroTransformer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the macro engine. Holds the registry, the expansion-time
 * evaluator and the expander, and exposes the inspection pair
 * {@link #macroexpand1(Form)} / {@link #macroexpandAll(Form)}.
 *
 * <p>
 * Expansion and evaluation stay separate calls: {@link #macroexpandAll(Form)}
 * produces a tree free of macro calls, and only then may an evaluator run it.
 * {@link #evaluate(Form)} is the reference evaluator for construction
 * expressions.
 *
 * <p>
 * Thread-safe: definitions may be added while other threads expand. Each
 * top-level form is expanded on the calling thread.
 */
public final class MacroEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MacroEngine.class);

    private final ExpanderConfig config;
    private final MacroRegistry registry;
    private final ConstructionEvaluator evaluator;
    private final MacroExpander expander;
    private final MacroLibraryParser libraryParser;
    private final ExpansionListener listener;

    /** Creates an engine with the default configuration and no listener. */
    public MacroEngine() {
        this(ExpanderConfig.DEFAULT, null);
    }

    /**
     * Creates an engine with the given configuration and no listener.
     *
     * @param config expansion settings and libraries to preload
     */
    public MacroEngine(ExpanderConfig config) {
        this(config, null);
    }

    /**
     * Creates an engine and loads every library the configuration names.
     *
     * @param config   expansion settings and libraries to preload
     * @param listener observability hooks, or {@code null}
     * @throws io.macroxform.core.error.MacroLoadException if a configured
     *                                                     library cannot be
     *                                                     loaded
     */
    public MacroEngine(ExpanderConfig config, ExpansionListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener;
        this.registry = new MacroRegistry();
        this.evaluator = new ConstructionEvaluator(registry);
        this.expander = new MacroExpander(
                registry,
                evaluator,
                new ExpansionBudget(config.maxSteps()),
                SpecialForms.DEFAULT.with(config.specialForms()),
                config.rejectMacroValues());
        this.libraryParser = new MacroLibraryParser();
        for (String library : config.libraries()) {
            loadLibrary(Path.of(library));
        }
    }

    /**
     * Creates an engine from a YAML configuration file (with environment
     * overlay).
     *
     * @throws io.macroxform.core.error.ConfigLoadException if the configuration
     *                                                      is invalid
     */
    public static MacroEngine fromConfig(Path configPath, ExpansionListener listener) {
        return new MacroEngine(ConfigLoader.load(configPath), listener);
    }

    // --- Definition ---

    /**
     * Installs or replaces a macro. Call sites expanded earlier keep their old
     * expansion.
     *
     * @return the definition, for chaining
     */
    public MacroDefinition define(MacroDefinition definition) {
        boolean replaced = registry.define(definition);
        LOG.info(
                "macro.defined name={} params={} source={} replaced={}",
                definition.name().name(),
                definition.params().shape(),
                definition.source(),
                replaced);
        notifyMacroDefined(definition, replaced);
        return definition;
    }

    /**
     * Defines a macro with Java transformer logic.
     *
     * @param name        macro name
     * @param params      parameter pattern, e.g. {@code [test & body]}
     * @param transformer builds the expansion
     */
    public MacroDefinition define(String name, Form params, MacroTransformer transformer) {
        return define(new MacroDefinition(Symbol.of(name), ParameterPattern.parse(params, name, null), transformer));
    }

    /**
     * Defines a macro whose body is a form, typically a syntax-quote template,
     * evaluated against the bound parameters on each expansion.
     */
    public MacroDefinition defineTemplate(String name, Form params, Form body) {
        return define(name, params, new TemplateTransformer(body));
    }

    /**
     * Loads a YAML macro library and registers all of its macros.
     *
     * @return the registered definitions, in file order
     * @throws io.macroxform.core.error.MacroLoadException if the library is
     *                                                     invalid; nothing from
     *                                                     it is registered in
     *                                                     that case
     */
    public List<MacroDefinition> loadLibrary(Path path) {
        MacroLibrary library = libraryParser.parse(path);
        for (MacroDefinition definition : library.macros()) {
            define(definition);
        }
        LOG.info(
                "library.loaded name={} version={} macros={} source={}",
                library.name(),
                library.version(),
                library.macros().size(),
                library.source());
        return library.macros();
    }

    // --- Inspection ---

    /**
     * Expands {@code form} one step if it is a macro call, otherwise returns it
     * unchanged.
     *
     * @throws MacroXformException if the expansion fails
     */
    public Form macroexpand1(Form form) {
        try {
            return expander.expandOnce(form);
        } catch (MacroXformException e) {
            notifyExpansionFailed(form, e);
            throw e;
        }
    }

    /**
     * Expands {@code form} until no macro calls remain.
     *
     * @throws MacroXformException if any sub-form fails; the whole form is
     *                             abandoned
     */
    public Form macroexpandAll(Form form) {
        long start = System.nanoTime();
        try {
            ExpansionResult result = expander.expandTracked(form);
            notifyFormExpanded(form, result.steps(), System.nanoTime() - start);
            return result.form();
        } catch (MacroXformException e) {
            LOG.warn(
                    "expansion.failed error={} location={} detail={}",
                    e.getClass().getSimpleName(),
                    e.location(),
                    e.getMessage());
            notifyExpansionFailed(form, e);
            throw e;
        }
    }

    /**
     * Expands a compilation unit form by form, in order. Stops at the first
     * failure.
     *
     * @throws MacroXformException from the first form that fails
     */
    public List<Form> macroexpandAll(List<Form> forms) {
        List<Form> expanded = new ArrayList<>(forms.size());
        for (Form form : forms) {
            expanded.add(macroexpandAll(form));
        }
        return expanded;
    }

    /** Returns {@code true} if {@code form} is a call to a registered macro. */
    public boolean isMacroCall(Form form) {
        return expander.isMacroCall(form);
    }

    // --- Evaluation ---

    /**
     * Evaluates an expanded form with the reference construction evaluator. A
     * syntax-quote at the root is expanded and its construction expression
     * evaluated, and {@code (quote x)} yields {@code x}.
     */
    public Form evaluate(Form form) {
        return evaluate(form, Bindings.empty());
    }

    public Form evaluate(Form form, Bindings bindings) {
        return evaluator.evaluate(form, bindings);
    }

    public ExpanderConfig config() {
        return config;
    }

    public MacroRegistry registry() {
        return registry;
    }

    public ConstructionEvaluator evaluator() {
        return evaluator;
    }

    public MacroExpander expander() {
        return expander;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect expansion.

    private void notifyMacroDefined(MacroDefinition definition, boolean replaced) {
        if (listener == null) return;
        try {
            listener.onMacroDefined(new ExpansionListener.MacroDefinedEvent(
                    definition.name().name(), definition.source(), replaced));
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onMacroDefined failed", e);
        }
    }

    private void notifyFormExpanded(Form form, int steps, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onFormExpanded(new ExpansionListener.FormExpandedEvent(form.print(), steps, durationNanos));
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onFormExpanded failed", e);
        }
    }

    private void notifyExpansionFailed(Form form, MacroXformException error) {
        if (listener == null) return;
        try {
            listener.onExpansionFailed(new ExpansionListener.ExpansionFailedEvent(
                    form.print(),
                    error.location() != null ? error.location() : Forms.locationOf(form),
                    error.getClass().getSimpleName(),
                    error.getMessage()));
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onExpansionFailed failed", e);
        }
    }
}
