package io.macroxform.core.form;

import java.util.Objects;

/**
 * A self-evaluating leaf: nil, boolean, number, string or keyword.
 *
 * @param kind  the atom kind
 * @param value the Java value ({@code null} for nil, {@link Boolean},
 *              {@link Long} or {@link Double}, {@link String} for strings and
 *              keyword names)
 */
public record Atom(Kind kind, Object value) implements Form {

    /** The kind of a self-evaluating atom. */
    public enum Kind {
        NIL,
        BOOLEAN,
        NUMBER,
        STRING,
        KEYWORD
    }

    public static final Atom NIL = new Atom(Kind.NIL, null);
    public static final Atom TRUE = new Atom(Kind.BOOLEAN, Boolean.TRUE);
    public static final Atom FALSE = new Atom(Kind.BOOLEAN, Boolean.FALSE);

    public Atom {
        Objects.requireNonNull(kind, "kind must not be null");
        switch (kind) {
            case NIL -> {
                if (value != null) {
                    throw new IllegalArgumentException("nil atom must not carry a value");
                }
            }
            case BOOLEAN -> requireType(value, Boolean.class, kind);
            case NUMBER -> {
                if (!(value instanceof Long) && !(value instanceof Double)) {
                    throw new IllegalArgumentException("number atom must hold a Long or Double, got: " + value);
                }
            }
            case STRING -> requireType(value, String.class, kind);
            case KEYWORD -> {
                requireType(value, String.class, kind);
                if (((String) value).isEmpty()) {
                    throw new IllegalArgumentException("keyword name must not be empty");
                }
            }
        }
    }

    private static void requireType(Object value, Class<?> type, Kind kind) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(kind + " atom must hold a " + type.getSimpleName() + ", got: " + value);
        }
    }

    public static Atom of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Atom of(long value) {
        return new Atom(Kind.NUMBER, value);
    }

    public static Atom of(double value) {
        return new Atom(Kind.NUMBER, value);
    }

    public static Atom string(String value) {
        return new Atom(Kind.STRING, value);
    }

    public static Atom keyword(String name) {
        return new Atom(Kind.KEYWORD, name);
    }

    /**
     * Returns {@code true} for nil and {@code false}, the two falsey values.
     */
    public boolean isFalsey() {
        return kind == Kind.NIL || Boolean.FALSE.equals(value);
    }

    @Override
    public String toString() {
        return print();
    }
}
