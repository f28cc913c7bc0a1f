package io.macroxform.core.testkit;

import io.macroxform.core.form.Atom;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Forms;
import io.macroxform.core.form.ListForm;
import io.macroxform.core.form.MapForm;
import io.macroxform.core.form.SourceLocation;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.form.SyntaxQuote;
import io.macroxform.core.form.Unquote;
import io.macroxform.core.form.UnquoteSplicing;
import io.macroxform.core.form.VectorForm;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Minimal Lisp reader for tests, standing in for the external reader. Supports
 * lists, vectors, maps, {@code 'x}, {@code `x}, {@code ~x}, {@code ~@x},
 * {@code x#}, strings, keywords, integers, decimals, {@code nil}, {@code true},
 * {@code false} and {@code ;} comments. Commas are whitespace. Lists carry
 * their source location.
 */
public final class FormReader {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+\\.\\d+");
    private static final String DELIMITERS = "()[]{}\";`~'";

    private final String text;
    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private FormReader(String text, String source) {
        this.text = text;
        this.source = source;
    }

    /** Reads exactly one form. */
    public static Form read(String text) {
        return read(text, "test");
    }

    /** Reads exactly one form, tagging lists with {@code source}. */
    public static Form read(String text, String source) {
        List<Form> forms = readAll(text, source);
        if (forms.size() != 1) {
            throw new IllegalArgumentException("expected exactly one form, got " + forms.size() + " in: " + text);
        }
        return forms.get(0);
    }

    /** Reads every form in {@code text}. */
    public static List<Form> readAll(String text, String source) {
        FormReader reader = new FormReader(text, source);
        List<Form> forms = new ArrayList<>();
        reader.skipWhitespace();
        while (!reader.atEnd()) {
            forms.add(reader.readForm());
            reader.skipWhitespace();
        }
        return forms;
    }

    private Form readForm() {
        skipWhitespace();
        if (atEnd()) {
            throw error("unexpected end of input");
        }
        SourceLocation location = new SourceLocation(source, line, column);
        char c = next();
        switch (c) {
            case '(':
                return new ListForm(readUntil(')'), location);
            case '[':
                return new VectorForm(readUntil(']'));
            case '{':
                return MapForm.ofPairs(readUntil('}'));
            case ')':
            case ']':
            case '}':
                throw error("unmatched '" + c + "'");
            case '\'':
                return Forms.quote(readForm());
            case '`':
                return new SyntaxQuote(readForm());
            case '~':
                if (!atEnd() && peek() == '@') {
                    next();
                    return new UnquoteSplicing(readForm());
                }
                return new Unquote(readForm());
            case '"':
                return readString();
            default:
                return readToken(c);
        }
    }

    private List<Form> readUntil(char close) {
        List<Form> forms = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw error("missing '" + close + "'");
            }
            if (peek() == close) {
                next();
                return forms;
            }
            forms.add(readForm());
        }
    }

    private Form readString() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw error("unterminated string");
            }
            char c = next();
            if (c == '"') {
                return Atom.string(sb.toString());
            }
            if (c == '\\') {
                char escaped = next();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private Form readToken(char first) {
        StringBuilder sb = new StringBuilder().append(first);
        while (!atEnd() && !isWhitespace(peek()) && DELIMITERS.indexOf(peek()) < 0) {
            sb.append(next());
        }
        String token = sb.toString();
        if (INTEGER.matcher(token).matches()) {
            return Atom.of(Long.parseLong(token));
        }
        if (DECIMAL.matcher(token).matches()) {
            return Atom.of(Double.parseDouble(token));
        }
        switch (token) {
            case "nil":
                return Atom.NIL;
            case "true":
                return Atom.TRUE;
            case "false":
                return Atom.FALSE;
            default:
                break;
        }
        if (token.startsWith(":") && token.length() > 1) {
            return Atom.keyword(token.substring(1));
        }
        if (token.endsWith("#") && token.length() > 1) {
            return Symbol.gensym(token.substring(0, token.length() - 1));
        }
        return Symbol.of(token);
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            char c = peek();
            if (c == ';') {
                while (!atEnd() && peek() != '\n') {
                    next();
                }
            } else if (isWhitespace(c)) {
                next();
            } else {
                return;
            }
        }
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == ',';
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private char next() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at " + source + ":" + line + ":" + column);
    }
}
