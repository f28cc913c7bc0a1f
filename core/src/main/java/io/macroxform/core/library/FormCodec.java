package io.macroxform.core.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps forms to and from JSON trees, so forms can be written in YAML macro
 * libraries.
 *
 * <table>
 * <caption>Encoding</caption>
 * <tr><th>JSON</th><th>Form</th></tr>
 * <tr><td>{@code null}, boolean, number</td><td>nil, boolean and number atoms</td></tr>
 * <tr><td>string</td><td>symbol</td></tr>
 * <tr><td>array</td><td>list</td></tr>
 * <tr><td>{@code {str: s}}, {@code {keyword: k}}</td><td>string and keyword atoms</td></tr>
 * <tr><td>{@code {gensym: x}}</td><td>auto-gensym marker {@code x#}</td></tr>
 * <tr><td>{@code {vector: [...]}}, {@code {map: [[k, v], ...]}}</td><td>vector, map</td></tr>
 * <tr><td>{@code {quote: f}}</td><td>{@code (quote f)}</td></tr>
 * <tr><td>{@code {syntax-quote: f}}, {@code {unquote: f}}, {@code {unquote-splicing: f}}</td>
 * <td>quasiquote annotations</td></tr>
 * </table>
 */
public final class FormCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FormCodec() {
        // utility class
    }

    /**
     * Decodes a JSON tree into a form.
     *
     * @throws IllegalArgumentException if the tree does not follow the encoding
     */
    public static Form decode(JsonNode node) {
        return decode(node, "$");
    }

    private static Form decode(JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Atom.NIL;
        }
        if (node.isBoolean()) {
            return Atom.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new IllegalArgumentException(path + ": integer out of range: " + node);
            }
            return Atom.of(node.longValue());
        }
        if (node.isNumber()) {
            return Atom.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Symbol.of(requireText(node, path));
        }
        if (node.isArray()) {
            return new ListForm(decodeAll(node, path));
        }
        if (node.isObject()) {
            return decodeTagged(node, path);
        }
        throw new IllegalArgumentException(path + ": unsupported JSON node type " + node.getNodeType());
    }

    private static Form decodeTagged(JsonNode node, String path) {
        if (node.size() != 1) {
            throw new IllegalArgumentException(path + ": tagged form must have exactly one key, got " + node.size());
        }
        Map.Entry<String, JsonNode> tag = node.fields().next();
        JsonNode value = tag.getValue();
        String inner = path + "." + tag.getKey();
        return switch (tag.getKey()) {
            case "str" -> {
                if (!value.isTextual()) {
                    throw new IllegalArgumentException(inner + ": expected a string");
                }
                yield Atom.string(value.asText());
            }
            case "keyword" -> Atom.keyword(requireText(value, inner));
            case "gensym" -> Symbol.gensym(requireText(value, inner));
            case "vector" -> new VectorForm(decodeAll(requireArray(value, inner), inner));
            case "map" -> decodeMap(requireArray(value, inner), inner);
            case "quote" -> Forms.quote(decode(value, inner));
            case "syntax-quote" -> new SyntaxQuote(decode(value, inner));
            case "unquote" -> new Unquote(decode(value, inner));
            case "unquote-splicing" -> new UnquoteSplicing(decode(value, inner));
            default -> throw new IllegalArgumentException(path + ": unknown form tag '" + tag.getKey() + "'");
        };
    }

    private static Form decodeMap(JsonNode pairs, String path) {
        List<MapForm.Entry> entries = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            JsonNode pair = pairs.get(i);
            String at = path + "[" + i + "]";
            if (!pair.isArray() || pair.size() != 2) {
                throw new IllegalArgumentException(at + ": map entry must be a [key, value] pair");
            }
            entries.add(new MapForm.Entry(decode(pair.get(0), at + "[0]"), decode(pair.get(1), at + "[1]")));
        }
        return new MapForm(entries);
    }

    private static List<Form> decodeAll(JsonNode array, String path) {
        List<Form> forms = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            forms.add(decode(array.get(i), path + "[" + i + "]"));
        }
        return forms;
    }

    private static String requireText(JsonNode node, String path) {
        if (!node.isTextual() || node.asText().isEmpty()) {
            throw new IllegalArgumentException(path + ": expected a non-empty string");
        }
        return node.asText();
    }

    private static JsonNode requireArray(JsonNode node, String path) {
        if (!node.isArray()) {
            throw new IllegalArgumentException(path + ": expected an array");
        }
        return node;
    }

    /**
     * Encodes a form as a JSON tree; the inverse of {@link #decode(JsonNode)}.
     */
    public static JsonNode encode(Form form) {
        if (form instanceof Atom atom) {
            return switch (atom.kind()) {
                case NIL -> NODES.nullNode();
                case BOOLEAN -> NODES.booleanNode((Boolean) atom.value());
                case NUMBER -> atom.value() instanceof Long l
                        ? NODES.numberNode(l)
                        : NODES.numberNode((Double) atom.value());
                case STRING -> tagged("str", NODES.textNode((String) atom.value()));
                case KEYWORD -> tagged("keyword", NODES.textNode((String) atom.value()));
            };
        }
        if (form instanceof Symbol symbol) {
            return symbol.autoGensym()
                    ? tagged("gensym", NODES.textNode(symbol.name()))
                    : NODES.textNode(symbol.name());
        }
        if (form instanceof ListForm list) {
            return encodeAll(list.elements());
        }
        if (form instanceof VectorForm vector) {
            return tagged("vector", encodeAll(vector.elements()));
        }
        if (form instanceof MapForm map) {
            ArrayNode pairs = NODES.arrayNode();
            for (MapForm.Entry entry : map.entries()) {
                pairs.add(NODES.arrayNode().add(encode(entry.key())).add(encode(entry.value())));
            }
            return tagged("map", pairs);
        }
        if (form instanceof SyntaxQuote syntaxQuote) {
            return tagged("syntax-quote", encode(syntaxQuote.template()));
        }
        if (form instanceof Unquote unquote) {
            return tagged("unquote", encode(unquote.form()));
        }
        if (form instanceof UnquoteSplicing splice) {
            return tagged("unquote-splicing", encode(splice.form()));
        }
        throw new IllegalStateException("Unknown form type: " + form.getClass().getName());
    }

    private static ArrayNode encodeAll(List<Form> forms) {
        ArrayNode array = NODES.arrayNode();
        for (Form form : forms) {
            array.add(encode(form));
        }
        return array;
    }

    private static ObjectNode tagged(String tag, JsonNode value) {
        ObjectNode node = NODES.objectNode();
        node.set(tag, value);
        return node;
    }
}
