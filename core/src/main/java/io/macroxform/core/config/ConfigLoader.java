package io.macroxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.macroxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads {@link ExpanderConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <pre>
 * expansion:
 *   max-steps: 500
 *   reject-macro-values: true
 *   special-forms: [defmacro, ns]
 * libraries:
 *   - macros/control.yaml
 * </pre>
 *
 * <p>
 * Relative library paths resolve against the directory of the config file.
 * Every key can be overridden by an environment variable, which takes
 * precedence over the YAML value. An env var is "set" if and only if it is
 * defined AND its trimmed value is non-empty:
 *
 * <ul>
 * <li>{@code MACROXFORM_MAX_STEPS}
 * <li>{@code MACROXFORM_REJECT_MACRO_VALUES}
 * <li>{@code MACROXFORM_SPECIAL_FORMS} (comma separated)
 * <li>{@code MACROXFORM_LIBRARIES} (comma separated)
 * </ul>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("expansion", "libraries");
    private static final Set<String> KNOWN_EXPANSION_KEYS = Set.of("max-steps", "reject-macro-values", "special-forms");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a config from YAML, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ExpanderConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a config from YAML, applying overrides from the supplied lookup.
     * Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static ExpanderConfig load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, source);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            return mapToConfig(root, configPath.toAbsolutePath().getParent(), envLookup, source);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e, source);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e, source);
        }
    }

    private static ExpanderConfig mapToConfig(
            JsonNode root, Path baseDir, Function<String, String> envLookup, String source) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping", source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "root", source);
        ExpanderConfig.Builder builder = ExpanderConfig.builder();

        JsonNode expansion = root.path("expansion");
        if (!expansion.isMissingNode()) {
            rejectUnknownKeys(expansion, KNOWN_EXPANSION_KEYS, "expansion", source);
        }
        if (expansion.has("max-steps")) {
            JsonNode maxSteps = expansion.get("max-steps");
            if (!maxSteps.canConvertToInt() || !maxSteps.isIntegralNumber()) {
                throw new ConfigLoadException("expansion.max-steps must be an integer, got: " + maxSteps, source);
            }
            builder.maxSteps(maxSteps.asInt());
        }
        if (expansion.has("reject-macro-values")) {
            builder.rejectMacroValues(expansion.get("reject-macro-values").asBoolean());
        }
        if (expansion.has("special-forms")) {
            builder.specialForms(textList(expansion.get("special-forms"), "expansion.special-forms", source));
        }
        if (root.has("libraries")) {
            List<String> libraries = new ArrayList<>();
            for (String library : textList(root.get("libraries"), "libraries", source)) {
                libraries.add(resolve(baseDir, library));
            }
            builder.libraries(libraries);
        }

        // --- Environment variable overlay ---
        envMaxSteps(envLookup, builder, source);
        if (isSet(envLookup, "MACROXFORM_REJECT_MACRO_VALUES")) {
            builder.rejectMacroValues(Boolean.parseBoolean(envLookup.apply("MACROXFORM_REJECT_MACRO_VALUES").trim()));
        }
        if (isSet(envLookup, "MACROXFORM_SPECIAL_FORMS")) {
            builder.specialForms(splitList(envLookup.apply("MACROXFORM_SPECIAL_FORMS")));
        }
        if (isSet(envLookup, "MACROXFORM_LIBRARIES")) {
            List<String> libraries = new ArrayList<>();
            for (String library : splitList(envLookup.apply("MACROXFORM_LIBRARIES"))) {
                libraries.add(resolve(baseDir, library));
            }
            builder.libraries(libraries);
        }
        return builder.build();
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String block, String source) {
        if (!node.isObject()) {
            throw new ConfigLoadException("'" + block + "' must be a mapping", source);
        }
        node.fieldNames().forEachRemaining(key -> {
            if (!known.contains(key)) {
                throw new ConfigLoadException(
                        "Unknown key '" + key + "' in " + block + " block; expected one of " + known, source);
            }
        });
    }

    private static List<String> textList(JsonNode node, String field, String source) {
        if (!node.isArray()) {
            throw new ConfigLoadException("'" + field + "' must be a list of strings", source);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new ConfigLoadException("'" + field + "' entries must be non-empty strings", source);
            }
            values.add(item.asText().trim());
        }
        return values;
    }

    private static String resolve(Path baseDir, String library) {
        Path path = Path.of(library);
        return path.isAbsolute() || baseDir == null ? path.toString() : baseDir.resolve(path).toString();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is defined and non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies the max-steps env var override if set. */
    private static void envMaxSteps(
            Function<String, String> envLookup, ExpanderConfig.Builder builder, String source) {
        String envVar = "MACROXFORM_MAX_STEPS";
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                builder.maxSteps(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + value + "'", e, source);
            }
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
