package io.ini2toml.core.error;

/**
 * Abstract parent for misuse of the intermediate representation: container operations on
 * missing or duplicated keys, out-of-range positions, and malformed structural values.
 */
public abstract class ReprException extends TranslationException {

    private static final long serialVersionUID = 1L;

    protected ReprException(String message) {
        super(message);
    }

    protected ReprException(String message, Throwable cause) {
        super(message, cause);
    }
}
