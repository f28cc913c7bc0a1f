package io.macroxform.core.form;

import java.util.List;

/** Renders forms as Lisp text for diagnostics, logs and test assertions. */
public final class FormPrinter {

    private FormPrinter() {
        // utility class
    }

    public static String print(Form form) {
        StringBuilder out = new StringBuilder();
        print(form, out);
        return out.toString();
    }

    private static void print(Form form, StringBuilder out) {
        if (form instanceof Atom atom) {
            printAtom(atom, out);
        } else if (form instanceof Symbol symbol) {
            out.append(symbol.name());
            if (symbol.autoGensym()) {
                out.append('#');
            }
        } else if (form instanceof ListForm list) {
            printSequence(list.elements(), '(', ')', out);
        } else if (form instanceof VectorForm vector) {
            printSequence(vector.elements(), '[', ']', out);
        } else if (form instanceof MapForm map) {
            printSequence(map.flatten(), '{', '}', out);
        } else if (form instanceof SyntaxQuote quote) {
            out.append('`');
            print(quote.template(), out);
        } else if (form instanceof Unquote unquote) {
            out.append('~');
            print(unquote.form(), out);
        } else if (form instanceof UnquoteSplicing splice) {
            out.append("~@");
            print(splice.form(), out);
        }
    }

    private static void printAtom(Atom atom, StringBuilder out) {
        switch (atom.kind()) {
            case NIL -> out.append("nil");
            case BOOLEAN, NUMBER -> out.append(atom.value());
            case KEYWORD -> out.append(':').append(atom.value());
            case STRING -> printString((String) atom.value(), out);
        }
    }

    private static void printString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        out.append('"');
    }

    private static void printSequence(List<Form> elements, char open, char close, StringBuilder out) {
        out.append(open);
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append(' ');
            }
            print(elements.get(i), out);
        }
        out.append(close);
    }
}
