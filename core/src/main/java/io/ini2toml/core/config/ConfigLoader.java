package io.ini2toml.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.ini2toml.core.engine.toml.RenderOptions;
import io.ini2toml.core.parser.ParserOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link TranslatorConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Recognised keys:
 *
 * <pre>
 * default-profile: best_effort
 * render:
 *   inline-table-max-entries: 4
 *   top-level-tables-as-blocks: true
 *   indent: "    "
 *   plain: false
 * parser:
 *   comment-prefixes: ["#", ";"]
 *   delimiters: ["=", ":"]
 *   allow-interpolation-syntax: false
 * augmentations:
 *   normalise-newlines: true
 * </pre>
 *
 * <p>
 * Missing keys keep their defaults. Environment variables take precedence over YAML values:
 * {@code INI2TOML_DEFAULT_PROFILE}, {@code INI2TOML_INLINE_TABLE_MAX_ENTRIES},
 * {@code INI2TOML_TOP_LEVEL_TABLES_AS_BLOCKS} and {@code INI2TOML_COMMENT_PREFIXES}
 * (comma-separated). An env var is "set" only if it is defined and its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_DEFAULT_PROFILE = "INI2TOML_DEFAULT_PROFILE";
    static final String ENV_INLINE_TABLE_MAX_ENTRIES = "INI2TOML_INLINE_TABLE_MAX_ENTRIES";
    static final String ENV_TOP_LEVEL_TABLES_AS_BLOCKS = "INI2TOML_TOP_LEVEL_TABLES_AS_BLOCKS";
    static final String ENV_COMMENT_PREFIXES = "INI2TOML_COMMENT_PREFIXES";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static TranslatorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, applying overrides from {@code envLookup}
     * (returning {@code null} means the variable is not defined).
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static TranslatorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            TranslatorConfig config = mapToConfig(root, envLookup);
            LOG.info(
                    "config.loaded path={} default_profile={} augmentation_overrides={}",
                    configPath,
                    config.defaultProfile(),
                    config.augmentations().size());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults plus environment overrides, for callers without a configuration file. */
    public static TranslatorConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(null, envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static TranslatorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        TranslatorConfig.Builder builder = TranslatorConfig.builder();
        RenderOptions render = RenderOptions.DEFAULT;
        ParserOptions parser = ParserOptions.DEFAULT;

        // --- YAML mapping ---

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping");
            }
            if (root.has("default-profile")) builder.defaultProfile(text(root, "default-profile"));

            JsonNode renderNode = root.path("render");
            if (renderNode.has("inline-table-max-entries"))
                render = render.withInlineTableMaxEntries(integer(renderNode, "render.inline-table-max-entries"));
            if (renderNode.has("top-level-tables-as-blocks"))
                render = render.withTopLevelTablesAsBlocks(bool(renderNode, "render.top-level-tables-as-blocks"));
            if (renderNode.has("indent")) render = render.withIndent(text(renderNode, "indent"));
            if (renderNode.has("plain")) render = render.withPlain(bool(renderNode, "render.plain"));

            JsonNode parserNode = root.path("parser");
            if (parserNode.has("comment-prefixes"))
                parser = parser.withCommentPrefixes(textList(parserNode.get("comment-prefixes"), "parser.comment-prefixes"));
            if (parserNode.has("delimiters"))
                parser = parser.withDelimiters(textList(parserNode.get("delimiters"), "parser.delimiters"));
            if (parserNode.has("allow-interpolation-syntax"))
                parser = parser.withAllowInterpolationSyntax(
                        bool(parserNode, "parser.allow-interpolation-syntax"));

            JsonNode augmentations = root.path("augmentations");
            if (!augmentations.isMissingNode() && !augmentations.isObject()) {
                throw new ConfigLoadException("augmentations must be a mapping of name to boolean");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = augmentations.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isBoolean()) {
                    throw new ConfigLoadException(
                            "augmentations." + field.getKey() + " must be a boolean, got: " + field.getValue());
                }
                builder.augmentation(field.getKey(), field.getValue().booleanValue());
            }
        }

        // --- Environment variable overlay ---

        if (isSet(envLookup, ENV_DEFAULT_PROFILE)) {
            builder.defaultProfile(envLookup.apply(ENV_DEFAULT_PROFILE).trim());
        }
        if (isSet(envLookup, ENV_INLINE_TABLE_MAX_ENTRIES)) {
            String raw = envLookup.apply(ENV_INLINE_TABLE_MAX_ENTRIES).trim();
            try {
                render = render.withInlineTableMaxEntries(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_INLINE_TABLE_MAX_ENTRIES + " must be an integer, got: " + raw, e);
            }
        }
        if (isSet(envLookup, ENV_TOP_LEVEL_TABLES_AS_BLOCKS)) {
            render = render.withTopLevelTablesAsBlocks(
                    Boolean.parseBoolean(envLookup.apply(ENV_TOP_LEVEL_TABLES_AS_BLOCKS).trim()));
        }
        if (isSet(envLookup, ENV_COMMENT_PREFIXES)) {
            List<String> prefixes = Arrays.stream(envLookup.apply(ENV_COMMENT_PREFIXES).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            parser = parser.withCommentPrefixes(prefixes);
        }

        return builder.render(render).parser(parser).build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    // --- YAML helpers ---

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isTextual()) {
            throw new ConfigLoadException(field + " must be a string, got: " + value);
        }
        return value.asText();
    }

    private static int integer(JsonNode node, String key) {
        JsonNode value = node.get(key.substring(key.lastIndexOf('.') + 1));
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static boolean bool(JsonNode node, String key) {
        JsonNode value = node.get(key.substring(key.lastIndexOf('.') + 1));
        if (!value.isBoolean()) {
            throw new ConfigLoadException(key + " must be a boolean, got: " + value);
        }
        return value.booleanValue();
    }

    private static List<String> textList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of strings, got: " + node);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ConfigLoadException(key + " must be a list of strings, got item: " + item);
            }
            values.add(item.asText());
        }
        return values;
    }
}
