package io.ini2toml.core.config;

import io.ini2toml.core.engine.toml.RenderOptions;
import io.ini2toml.core.parser.ParserOptions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings applied to a translator when it is built.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances, or
 * {@link ConfigLoader} to read them from YAML.
 *
 * @param defaultProfile name of the profile used when the requested one is not registered
 * @param render         serializer thresholds
 * @param parser         built-in INI parser options
 * @param augmentations  per-augmentation overrides of {@code activeByDefault}, by name
 */
public record TranslatorConfig(
        String defaultProfile, RenderOptions render, ParserOptions parser, Map<String, Boolean> augmentations) {

    /** All defaults. */
    public static final TranslatorConfig DEFAULT = builder().build();

    public TranslatorConfig {
        Objects.requireNonNull(defaultProfile, "defaultProfile must not be null");
        Objects.requireNonNull(render, "render must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        augmentations = augmentations != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(augmentations))
                : Map.of();
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link TranslatorConfig}. */
    public static final class Builder {
        private String defaultProfile = "best_effort";
        private RenderOptions render = RenderOptions.DEFAULT;
        private ParserOptions parser = ParserOptions.DEFAULT;
        private final Map<String, Boolean> augmentations = new LinkedHashMap<>();

        Builder() {}

        public Builder defaultProfile(String defaultProfile) {
            this.defaultProfile = defaultProfile;
            return this;
        }

        public Builder render(RenderOptions render) {
            this.render = render;
            return this;
        }

        public Builder parser(ParserOptions parser) {
            this.parser = parser;
            return this;
        }

        public Builder augmentation(String name, boolean active) {
            augmentations.put(name, active);
            return this;
        }

        public TranslatorConfig build() {
            return new TranslatorConfig(defaultProfile, render, parser, augmentations);
        }
    }
}
