package io.ini2toml.core.error;

/** Thrown when the source document is malformed or uses an unsupported feature. */
public final class SourceParseException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public SourceParseException(String message, int line) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    /** One-based line number in the source text, or 0 when unknown. */
    public int line() {
        return line;
    }
}
