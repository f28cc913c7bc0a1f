package io.macroxform.core.testkit;

import static io.macroxform.core.testkit.FormReader.read;

import io.macroxform.core.engine.MacroExpander;
import io.macroxform.core.eval.ConstructionEvaluator;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.macro.MacroDefinition;
import io.macroxform.core.macro.MacroRegistry;
import io.macroxform.core.macro.ParameterPattern;
import io.macroxform.core.macro.TemplateTransformer;

/** Shared macro definitions used across tests. */
public final class TestMacros {

    private TestMacros() {}

    /**
     * Defines a template macro from reader text, e.g.
     * {@code template("my-when", "[test & body]", "`(...)")}.
     */
    public static MacroDefinition template(String name, String params, String body) {
        return new MacroDefinition(
                Symbol.of(name), ParameterPattern.parse(read(params), name, null), new TemplateTransformer(read(body)));
    }

    /** {@code (my-when test & body)} → {@code (if test (do body...) nil)} */
    public static MacroDefinition myWhen() {
        return template("my-when", "[test & body]", "`(if ~test (do ~@body) nil)");
    }

    /**
     * {@code (my-unless test & body)} → {@code (my-when (not test) body...)}
     */
    public static MacroDefinition myUnless() {
        return template("my-unless", "[test & body]", "`(my-when (not ~test) ~@body)");
    }

    /**
     * {@code (with-temp value & body)} binds value to an auto-gensym and
     * returns it after body.
     */
    public static MacroDefinition withTemp() {
        return template("with-temp", "[value & body]", "`(let* [tmp# ~value] (do ~@body tmp#))");
    }

    /**
     * {@code (forever x)} → {@code (forever x)}: never reaches a fixed point.
     */
    public static MacroDefinition forever() {
        return template("forever", "[x]", "`(forever ~x)");
    }

    /** A registry holding all of the above. */
    public static MacroRegistry standardRegistry() {
        MacroRegistry registry = new MacroRegistry();
        registry.define(myWhen());
        registry.define(myUnless());
        registry.define(withTemp());
        registry.define(forever());
        return registry;
    }

    /** An expander with default settings over {@code registry}. */
    public static MacroExpander expander(MacroRegistry registry) {
        return new MacroExpander(registry, new ConstructionEvaluator(registry));
    }

    public static Form form(String text) {
        return read(text);
    }
}
