package io.macroxform.core.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.macroxform.core.error.MacroLibraryParseException;
import io.macroxform.core.form.Form;
import io.macroxform.core.form.Symbol;
import io.macroxform.core.macro.MacroDefinition;
import io.macroxform.core.macro.ParameterPattern;
import io.macroxform.core.macro.TemplateTransformer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML macro library files into template {@link MacroDefinition}s.
 *
 * <pre>
 * library: control
 * version: "1.0.0"
 * macros:
 *   - name: unless
 *     doc: Evaluates body when test is falsey.
 *     params: [test, "&amp;", body]
 *     body:
 *       syntax-quote: [if, {unquote: test}, null, [do, {unquote-splicing: body}]]
 * </pre>
 *
 * <p>
 * The document is validated against the bundled JSON Schema before any form is
 * decoded, so unknown keys and missing fields are reported at load time. Forms
 * use the {@link FormCodec} encoding.
 *
 * <p>
 * Thread-safe.
 */
public final class MacroLibraryParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String SCHEMA_RESOURCE = "/schema/macro-library.schema.json";
    private static final JsonSchema LIBRARY_SCHEMA = loadSchema();

    private static JsonSchema loadSchema() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        try (InputStream in = MacroLibraryParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled schema resource: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled schema resource: " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Parses the library file at {@code path}.
     *
     * @throws MacroLibraryParseException if the file cannot be read, fails
     *                                    validation or holds an undecodable
     *                                    form
     * @throws io.macroxform.core.error.InvalidMacroDefinitionException if a
     *                                                                  parameter
     *                                                                  pattern
     *                                                                  is
     *                                                                  malformed
     */
    public MacroLibrary parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (IOException e) {
            throw new MacroLibraryParseException("Failed to read macro library: " + e.getMessage(), e, source);
        }
        return parse(yaml, source);
    }

    /**
     * Parses library YAML held in memory.
     *
     * @param yaml   the document text
     * @param source identifies the document in error messages
     */
    public MacroLibrary parse(String yaml, String source) {
        JsonNode root = readYaml(yaml, source);
        validate(root, source);

        String name = root.get("library").asText();
        String version = optionalString(root, "version");
        String description = optionalString(root, "description");

        List<MacroDefinition> macros = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode macroNode : root.get("macros")) {
            MacroDefinition definition = parseMacro(macroNode, source);
            if (!seen.add(definition.name().name())) {
                throw new MacroLibraryParseException(
                        "Duplicate macro '" + definition.name().name() + "' in library '" + name + "'", source);
            }
            macros.add(definition);
        }
        return new MacroLibrary(name, version, description, macros, source);
    }

    private MacroDefinition parseMacro(JsonNode macroNode, String source) {
        String name = macroNode.get("name").asText();
        Form params = decode(macroNode.get("params"), name, "params", source);
        Form body = decode(macroNode.get("body"), name, "body", source);
        ParameterPattern pattern = ParameterPattern.parse(params, name, source);
        return new MacroDefinition(
                Symbol.of(name), pattern, new TemplateTransformer(body), optionalString(macroNode, "doc"), source);
    }

    private static Form decode(JsonNode node, String macroName, String field, String source) {
        try {
            return FormCodec.decode(node);
        } catch (IllegalArgumentException e) {
            throw new MacroLibraryParseException(
                    "Invalid " + field + " of macro '" + macroName + "': " + e.getMessage(), e, source);
        }
    }

    private static JsonNode readYaml(String yaml, String source) {
        try {
            JsonNode root = YAML_MAPPER.readTree(yaml);
            if (root == null || !root.isObject()) {
                throw new MacroLibraryParseException("Macro library must be a YAML mapping", source);
            }
            return root;
        } catch (IOException e) {
            throw new MacroLibraryParseException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
    }

    private static void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = LIBRARY_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new MacroLibraryParseException("Macro library failed schema validation: " + detail, source);
        }
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
