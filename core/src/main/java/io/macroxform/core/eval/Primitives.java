package io.macroxform.core.eval;

import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.MapForm;
import io.macroxform.core.form.VectorForm;
import io.macroxform.core.quasi.GensymRenamer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The built-in sequence primitives construction expressions are written in. */
final class Primitives {

    private Primitives() {
        // utility class
    }

    static Map<String, Primitive> builtins() {
        Map<String, Primitive> builtins = new LinkedHashMap<>();
        builtins.put("list", ListForm::new);
        builtins.put("concat", Primitives::concat);
        builtins.put("seq", args -> new ListForm(toSequence(single(args, "seq"), "seq")));
        builtins.put("vector", VectorForm::new);
        builtins.put("hash-map", MapForm::ofPairs);
        builtins.put("cons", Primitives::cons);
        builtins.put("first", args -> {
            List<Form> items = toSequence(single(args, "first"), "first");
            return items.isEmpty() ? Atom.NIL : items.get(0);
        });
        builtins.put("rest", args -> {
            List<Form> items = toSequence(single(args, "rest"), "rest");
            return items.isEmpty() ? ListForm.EMPTY : new ListForm(items.subList(1, items.size()));
        });
        builtins.put("count", args -> Atom.of((long) toSequence(single(args, "count"), "count").size()));
        builtins.put("gensym", Primitives::gensym);
        return builtins;
    }

    private static Form concat(List<Form> args) {
        List<Form> result = new ArrayList<>();
        for (Form arg : args) {
            result.addAll(toSequence(arg, "concat"));
        }
        return new ListForm(result);
    }

    private static Form cons(List<Form> args) {
        if (args.size() != 2) {
            throw new IllegalArgumentException("cons expects 2 arguments, got " + args.size());
        }
        List<Form> result = new ArrayList<>();
        result.add(args.get(0));
        result.addAll(toSequence(args.get(1), "cons"));
        return new ListForm(result);
    }

    private static Form gensym(List<Form> args) {
        if (args.isEmpty()) {
            return GensymRenamer.gensym("G__");
        }
        Form prefix = single(args, "gensym");
        if (prefix instanceof Atom atom && atom.kind() == Atom.Kind.STRING) {
            return GensymRenamer.gensym((String) atom.value());
        }
        throw new IllegalArgumentException("gensym prefix must be a string, got: " + prefix.print());
    }

    private static Form single(List<Form> args, String name) {
        if (args.size() != 1) {
            throw new IllegalArgumentException(name + " expects 1 argument, got " + args.size());
        }
        return args.get(0);
    }

    static List<Form> toSequence(Form form, String caller) {
        return Forms.asSequence(form)
                .orElseThrow(() -> new IllegalArgumentException(
                        caller + ": don't know how to create a sequence from: " + form.print()));
    }
}
