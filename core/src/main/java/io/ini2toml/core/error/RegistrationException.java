package io.ini2toml.core.error;

/**
 * Thrown during translator initialization when an augmentation or extension cannot be
 * registered: invalid names, or two different functions competing for one augmentation name.
 */
public final class RegistrationException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public RegistrationException(String message, String name) {
        super(message);
        this.name = name;
    }

    /** The name under which registration was attempted. */
    public String name() {
        return name;
    }
}
