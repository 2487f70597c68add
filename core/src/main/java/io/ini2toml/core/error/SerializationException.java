package io.ini2toml.core.error;

/**
 * Thrown when a value of the intermediate representation has no legal TOML rendering. The
 * {@link #keyPath()} locates the offending value (dotted, e.g. {@code tool.pytest.markers}).
 */
public final class SerializationException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String keyPath;

    public SerializationException(String message, String keyPath) {
        super(message + " (at '" + keyPath + "')");
        this.keyPath = keyPath;
    }

    /** Dotted path of the value that could not be rendered. */
    public String keyPath() {
        return keyPath;
    }
}
