package io.ini2toml.core.error;

import java.util.List;

/**
 * Thrown when the requested profile is not registered and the configured default profile is
 * not registered either. Usually means the extension that provides the profile was never
 * registered with the translator.
 */
public final class ProfileNotFoundException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String profile;
    private final List<String> available;

    public ProfileNotFoundException(String profile, String defaultProfile, List<String> available) {
        super(String.format(
                "Profile '%s' is not registered and neither is the default profile '%s' (available: %s)",
                profile, defaultProfile, available));
        this.profile = profile;
        this.available = List.copyOf(available);
    }

    /** The requested profile name. */
    public String profile() {
        return profile;
    }

    /** Names of the registered profiles, in registration order. */
    public List<String> available() {
        return available;
    }
}
