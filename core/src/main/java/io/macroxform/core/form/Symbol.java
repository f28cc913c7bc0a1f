package io.macroxform.core.form;

/**
 * A symbol. When {@code autoGensym} is set the symbol is an auto-gensym marker
 * (written {@code name#} by the reader): inside a syntax-quote it is replaced
 * by a fresh, expansion-unique symbol.
 *
 * @param name       the symbol name, without the trailing marker
 * @param autoGensym whether this symbol requests a hygienic replacement
 */
public record Symbol(String name, boolean autoGensym) implements Form {

    public Symbol {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("symbol name must not be null or empty");
        }
    }

    /** Creates a plain symbol. */
    public static Symbol of(String name) {
        return new Symbol(name, false);
    }

    /** Creates an auto-gensym marker symbol. */
    public static Symbol gensym(String name) {
        return new Symbol(name, true);
    }

    @Override
    public String toString() {
        return print();
    }
}
