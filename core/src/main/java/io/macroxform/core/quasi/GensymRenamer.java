package io.macroxform.core.quasi;

import io.macroxform.core.form.Symbol;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates hygienic symbols.
 *
 * <p>
 * A single process-wide counter provides unique suffixes, so two generated
 * names can never collide, whichever thread produced them. A {@link Scope}
 * covers one syntax-quote expansion: every occurrence of the same auto-gensym
 * marker inside it resolves to the same generated symbol, while a new scope
 * resolves the same marker to a new one.
 */
public final class GensymRenamer {

    private static final AtomicLong COUNTER = new AtomicLong();

    private GensymRenamer() {
        // utility class
    }

    /** Next value of the process-wide counter. */
    public static long nextId() {
        return COUNTER.incrementAndGet();
    }

    /**
     * A fresh plain symbol {@code prefix<n>}, for transformers that build code
     * by hand.
     */
    public static Symbol gensym(String prefix) {
        return Symbol.of(prefix + nextId());
    }

    /** Opens a new, empty resolution scope for one syntax-quote expansion. */
    public static Scope newScope() {
        return new Scope();
    }

    /**
     * Marker-to-symbol cache of one expansion instance. Confined to the thread
     * running that expansion.
     */
    public static final class Scope {

        private final Map<String, Symbol> resolved = new HashMap<>();

        private Scope() {}

        /**
         * Resolves an auto-gensym marker to its generated symbol
         * {@code name__<n>__auto__}.
         *
         * @throws IllegalArgumentException if {@code marker} is not an
         *                                  auto-gensym symbol
         */
        public Symbol resolve(Symbol marker) {
            if (!marker.autoGensym()) {
                throw new IllegalArgumentException("not an auto-gensym marker: " + marker.name());
            }
            return resolved.computeIfAbsent(
                    marker.name(), name -> Symbol.of(name + "__" + nextId() + "__auto__"));
        }

        /** Number of distinct markers resolved so far. */
        public int size() {
            return resolved.size();
        }
    }
}
