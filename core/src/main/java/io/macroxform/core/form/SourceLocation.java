package io.macroxform.core.form;

/**
 * Position of a form in its source text, as reported by the reader.
 *
 * @param source file path or resource identifier, may be {@code null}
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record SourceLocation(String source, int line, int column) {

    @Override
    public String toString() {
        return (source != null ? source : "<unknown>") + ":" + line + ":" + column;
    }
}
