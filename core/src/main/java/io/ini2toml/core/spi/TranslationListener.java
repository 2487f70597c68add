package io.ini2toml.core.spi;

import io.ini2toml.core.model.ChainStage;

/**
 * Observability hooks for translation calls.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the translator and logged;
 * they do NOT affect the translation result.
 */
public interface TranslationListener {

    /**
     * Called once per call after the profile has been resolved.
     *
     * @param event contains requested name, selected profile name, fallback flag
     */
    default void onProfileSelected(ProfileSelectedEvent event) {}

    /**
     * Called when a translation completes successfully.
     *
     * @param event contains profile, input/output sizes and duration
     */
    default void onTranslationCompleted(TranslationCompletedEvent event) {}

    /**
     * Called when a translation fails.
     *
     * @param event contains profile, failing stage (null outside chains), error detail
     */
    default void onTranslationFailed(TranslationFailedEvent event) {}

    // --- Event records ---

    /** Emitted when the profile for a call has been resolved. */
    record ProfileSelectedEvent(String requestedProfile, String selectedProfile, boolean fallback) {}

    /** Emitted when a translation succeeds. */
    record TranslationCompletedEvent(String profile, int inputLength, int outputLength, long durationMs) {}

    /** Emitted when a translation fails. */
    record TranslationFailedEvent(String profile, ChainStage stage, long durationMs, String errorDetail) {}
}
