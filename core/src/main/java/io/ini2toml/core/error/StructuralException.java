package io.ini2toml.core.error;

/**
 * Thrown when a structural value cannot be constructed, e.g. a grouped table whose groups
 * repeat a key (the cause is then a {@link DuplicateKeyException}) or a scalar wrapping an
 * unsupported runtime type.
 */
public final class StructuralException extends ReprException {

    private static final long serialVersionUID = 1L;

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
