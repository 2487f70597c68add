package io.ini2toml.core.extension;

import io.ini2toml.core.config.TranslatorConfig;
import io.ini2toml.core.engine.Translator;
import io.ini2toml.core.engine.TranslatorBuilder;

/** Registration names and wiring of the extensions shipped with the core. */
public final class BuiltinExtensions {

    public static final String BEST_EFFORT = "best_effort";
    public static final String PROFILE_INDEPENDENT_TASKS = "profile_independent_tasks";
    public static final String TOML_INCOMPATIBILITIES = "toml_incompatibilities";

    private BuiltinExtensions() {
        // utility class
    }

    /** Registers every built-in extension on {@code builder}. */
    public static TranslatorBuilder registerAll(TranslatorBuilder builder) {
        return builder.register(BEST_EFFORT, new BestEffort())
                .register(PROFILE_INDEPENDENT_TASKS, new ProfileIndependentTasks())
                .register(TOML_INCOMPATIBILITIES, new TomlIncompatibilities());
    }

    /** A translator with the built-in extensions and default configuration. */
    public static Translator translator() {
        return translator(TranslatorConfig.DEFAULT);
    }

    public static Translator translator(TranslatorConfig config) {
        return registerAll(Translator.builder().config(config)).build();
    }
}
