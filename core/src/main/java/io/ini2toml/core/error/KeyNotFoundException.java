package io.ini2toml.core.error;

/** Thrown when a container operation references a key that is not present. */
public final class KeyNotFoundException extends ReprException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key not found: '" + key + "'");
        this.key = key;
    }

    /** The missing key. */
    public String key() {
        return key;
    }
}
