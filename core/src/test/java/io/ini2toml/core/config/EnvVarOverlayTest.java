package io.ini2toml.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ini2toml.core.engine.Translator;
import io.ini2toml.core.extension.BuiltinExtensions;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay of {@link ConfigLoader}.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is "set" only if it is defined and
 * its trimmed value is non-empty; blank values leave the YAML value in place.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    private Path fullConfigPath;

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("INI2TOML_DEFAULT_PROFILE overrides default-profile")
        void defaultProfile() {
            envVars.put(ConfigLoader.ENV_DEFAULT_PROFILE, " setup.cfg ");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).defaultProfile()).isEqualTo("setup.cfg");
        }

        @Test
        @DisplayName("INI2TOML_INLINE_TABLE_MAX_ENTRIES overrides the YAML threshold")
        void inlineTableMaxEntries() {
            envVars.put(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES, "7");

            TranslatorConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.render().inlineTableMaxEntries()).isEqualTo(7);
            assertThat(config.render().indent()).isEqualTo("  ");
        }

        @Test
        @DisplayName("INI2TOML_TOP_LEVEL_TABLES_AS_BLOCKS overrides the YAML flag")
        void topLevelTablesAsBlocks() {
            envVars.put(ConfigLoader.ENV_TOP_LEVEL_TABLES_AS_BLOCKS, "true");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).render().topLevelTablesAsBlocks())
                    .isTrue();
        }

        @Test
        @DisplayName("INI2TOML_COMMENT_PREFIXES is split on commas")
        void commentPrefixes() {
            envVars.put(ConfigLoader.ENV_COMMENT_PREFIXES, "#, ;, //");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).parser().commentPrefixes())
                    .containsExactly("#", ";", "//");
        }
    }

    @Nested
    @DisplayName("Unset and invalid values")
    class UnsetAndInvalid {

        @Test
        @DisplayName("Blank values keep the YAML value")
        void blankIsUnset() {
            envVars.put(ConfigLoader.ENV_DEFAULT_PROFILE, "   ");
            envVars.put(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES, "");

            TranslatorConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.defaultProfile()).isEqualTo("best_effort");
            assertThat(config.render().inlineTableMaxEntries()).isEqualTo(2);
        }

        @Test
        @DisplayName("A non-numeric threshold fails with the variable name")
        void nonNumeric() {
            envVars.put(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES, "lots");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES);
        }
    }

    @Nested
    @DisplayName("Without a file")
    class WithoutFile {

        @Test
        @DisplayName("fromEnvironment → defaults plus overrides")
        void fromEnvironment() {
            envVars.put(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES, "1");

            TranslatorConfig config = ConfigLoader.fromEnvironment(envLookup());

            assertThat(config.defaultProfile()).isEqualTo(Translator.DEFAULT_PROFILE);
            assertThat(config.render().inlineTableMaxEntries()).isEqualTo(1);
            assertThat(config.parser().commentPrefixes()).isEqualTo(List.of("#", ";"));
        }

        @Test
        @DisplayName("A negative threshold is rejected")
        void negative() {
            envVars.put(ConfigLoader.ENV_INLINE_TABLE_MAX_ENTRIES, "-3");

            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(envLookup()))
                    .isInstanceOf(ConfigLoadException.class);
        }

        @Test
        @DisplayName("The loaded configuration drives the translator")
        void drivesTranslator() {
            envVars.put(ConfigLoader.ENV_TOP_LEVEL_TABLES_AS_BLOCKS, "false");
            Translator translator = BuiltinExtensions.translator(ConfigLoader.fromEnvironment(envLookup()));

            assertThat(translator.renderOptions().topLevelTablesAsBlocks()).isFalse();
            assertThat(translator.translate("[s]\nk = 1\n", "best_effort")).isEqualTo("s = {k = 1}\n");
        }
    }
}
