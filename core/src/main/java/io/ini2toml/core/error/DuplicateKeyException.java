package io.ini2toml.core.error;

/** Thrown when a key would appear twice within one container level. */
public final class DuplicateKeyException extends ReprException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public DuplicateKeyException(String key) {
        super("Key already exists: '" + key + "'");
        this.key = key;
    }

    /** The duplicated key. */
    public String key() {
        return key;
    }
}
