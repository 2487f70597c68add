package io.ini2toml.core.error;

/**
 * Abstract base for all ini2toml exceptions. Never thrown directly; use the concrete
 * subclasses. Failures raised by the translator itself are subclasses of this type; no partial
 * output is ever returned alongside them.
 */
public abstract class TranslationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected TranslationException(String message) {
        super(message);
    }

    protected TranslationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
