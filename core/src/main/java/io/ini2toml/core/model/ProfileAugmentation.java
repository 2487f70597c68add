package io.ini2toml.core.model;

import io.ini2toml.core.spi.Augmentation;
import java.util.Objects;

/**
 * A profile-independent processor registration. After a profile is selected, every active
 * augmentation gets to modify the per-call {@link ProfileDraft}.
 *
 * @param name            unique registration name
 * @param helpText        description shown by front ends
 * @param activeByDefault whether the augmentation runs when the caller does not decide
 * @param function        the augmentation
 */
public record ProfileAugmentation(String name, String helpText, boolean activeByDefault, Augmentation function) {

    public ProfileAugmentation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        helpText = helpText != null ? helpText : "";
    }

    /**
     * Resolves the enabled state.
     *
     * @param explicitlyActive {@code TRUE} if the caller asked for the augmentation,
     *                         {@code FALSE} if the caller refused it, {@code null} if the
     *                         caller expressed no preference
     */
    public boolean isActive(Boolean explicitlyActive) {
        return explicitlyActive != null ? explicitlyActive : activeByDefault;
    }
}
