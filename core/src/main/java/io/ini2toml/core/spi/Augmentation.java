package io.ini2toml.core.spi;

import io.ini2toml.core.model.ProfileDraft;

/**
 * Profile-independent hook run after profile selection. Receives the private per-call copy
 * of the selected profile and may append or prepend functions to any of its chains.
 */
@FunctionalInterface
public interface Augmentation {

    void augment(ProfileDraft profile);
}
