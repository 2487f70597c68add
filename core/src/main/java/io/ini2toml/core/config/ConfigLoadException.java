package io.ini2toml.core.config;

import io.ini2toml.core.error.TranslationException;

/**
 * Thrown when translator configuration cannot be loaded: missing file, invalid YAML, or a
 * value of the wrong type. The message names the offending file or key.
 */
public final class ConfigLoadException extends TranslationException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
