package io.ini2toml.core.engine;

import io.ini2toml.core.engine.toml.RenderOptions;
import io.ini2toml.core.engine.toml.TomlSerializer;
import io.ini2toml.core.error.ProcessorException;
import io.ini2toml.core.error.ProfileNotFoundException;
import io.ini2toml.core.model.ChainFunction;
import io.ini2toml.core.model.ChainStage;
import io.ini2toml.core.model.IrNode;
import io.ini2toml.core.model.Profile;
import io.ini2toml.core.model.ProfileAugmentation;
import io.ini2toml.core.model.ProfileDraft;
import io.ini2toml.core.spi.IntermediateProcessor;
import io.ini2toml.core.spi.SourceParser;
import io.ini2toml.core.spi.TextProcessor;
import io.ini2toml.core.spi.TranslationListener;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Converts INI text to TOML text through a named profile.
 *
 * <p>
 * A call runs: profile selection (exact name, then the default profile) → private copy of
 * the profile → active augmentations, in registration order → pre-processors → parser →
 * intermediate processors → serializer → post-processors. Any failure aborts the call;
 * nothing is returned for it.
 *
 * <p>
 * Thread-safe: the registry is frozen when {@link TranslatorBuilder#build()} returns, and
 * every call works on its own profile copy and IR tree.
 */
public final class Translator {

    private static final Logger LOG = LoggerFactory.getLogger(Translator.class);

    /** Name of the profile used when the requested one is not registered. */
    public static final String DEFAULT_PROFILE = "best_effort";

    /** MDC key holding the selected profile during a call. */
    public static final String MDC_PROFILE = "ini2toml.profile";

    private final Map<String, Profile> profiles;
    private final List<ProfileAugmentation> augmentations;
    private final SourceParser parser;
    private final TomlSerializer serializer;
    private final String defaultProfile;
    private final List<TranslationListener> listeners;

    Translator(
            Map<String, Profile> profiles,
            List<ProfileAugmentation> augmentations,
            SourceParser parser,
            TomlSerializer serializer,
            String defaultProfile,
            List<TranslationListener> listeners) {
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        this.augmentations = List.copyOf(augmentations);
        this.parser = parser;
        this.serializer = serializer;
        this.defaultProfile = defaultProfile;
        this.listeners = List.copyOf(listeners);
    }

    /** Returns a new, empty registration handle. */
    public static TranslatorBuilder builder() {
        return new TranslatorBuilder();
    }

    /** Translates with the augmentations' default activation. */
    public String translate(String text, String profileName) {
        return translate(text, profileName, Map.of());
    }

    /**
     * Translates {@code text} using the profile named {@code profileName}.
     *
     * @param text                   INI source
     * @param profileName            requested profile; {@code null} selects the default profile
     * @param explicitAugmentations  activation overrides by augmentation name; absent names
     *                               use the augmentation's default
     * @return the TOML document
     * @throws ProfileNotFoundException neither the requested nor the default profile exists
     * @throws ProcessorException       a chain function failed
     */
    public String translate(String text, String profileName, Map<String, Boolean> explicitAugmentations) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(explicitAugmentations, "explicitAugmentations must not be null");
        long start = System.nanoTime();
        String previousMdc = MDC.get(MDC_PROFILE);
        String profileForEvents = profileName;
        try {
            Profile profile = select(profileName);
            profileForEvents = profile.name();
            MDC.put(MDC_PROFILE, profile.name());

            ProfileDraft draft = ProfileDraft.from(profile);
            for (ProfileAugmentation aug : augmentations) {
                if (aug.isActive(explicitAugmentations.get(aug.name()))) {
                    aug.function().augment(draft);
                    LOG.debug("augmentation.applied name={}", aug.name());
                }
            }
            Profile effective = draft.toProfile();

            String ini = runText(effective, ChainStage.PRE, effective.preProcessors(), text);
            IrNode tree = parser.parse(ini);
            tree = runIntermediate(effective, tree);
            String toml = serializer.serialize(tree);
            String result = runText(effective, ChainStage.POST, effective.postProcessors(), toml);

            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "translation.completed profile={} input_length={} output_length={} duration_ms={}",
                    profile.name(),
                    text.length(),
                    result.length(),
                    durationMs);
            notifyCompleted(new TranslationListener.TranslationCompletedEvent(
                    profile.name(), text.length(), result.length(), durationMs));
            return result;
        } catch (RuntimeException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            ChainStage stage = e instanceof ProcessorException pe ? pe.stage() : null;
            LOG.warn("translation.failed profile={} stage={} error={}",
                    profileForEvents, stage != null ? stage.label() : "-", e.getMessage());
            notifyFailed(new TranslationListener.TranslationFailedEvent(
                    profileForEvents, stage, durationMs, e.getMessage()));
            throw e;
        } finally {
            if (previousMdc != null) {
                MDC.put(MDC_PROFILE, previousMdc);
            } else {
                MDC.remove(MDC_PROFILE);
            }
        }
    }

    // --- Introspection ---

    /** Registered profiles, in registration order. */
    public List<Profile> profiles() {
        return List.copyOf(profiles.values());
    }

    public Optional<Profile> profile(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /** Registered augmentations, in registration order, with configured defaults applied. */
    public List<ProfileAugmentation> augmentations() {
        return augmentations;
    }

    public String defaultProfileName() {
        return defaultProfile;
    }

    public RenderOptions renderOptions() {
        return serializer.options();
    }

    // --- Internals ---

    private Profile select(String requested) {
        Profile exact = requested != null ? profiles.get(requested) : null;
        if (exact != null) {
            notifySelected(new TranslationListener.ProfileSelectedEvent(requested, exact.name(), false));
            return exact;
        }
        Profile fallback = profiles.get(defaultProfile);
        if (fallback == null) {
            throw new ProfileNotFoundException(requested, defaultProfile, List.copyOf(profiles.keySet()));
        }
        if (requested != null) {
            LOG.info("profile.fallback requested={} selected={}", requested, fallback.name());
        }
        notifySelected(new TranslationListener.ProfileSelectedEvent(requested, fallback.name(), requested != null));
        return fallback;
    }

    private String runText(Profile profile, ChainStage stage, List<ChainFunction<TextProcessor>> chain, String text) {
        String current = text;
        for (int i = 0; i < chain.size(); i++) {
            ChainFunction<TextProcessor> fn = chain.get(i);
            LOG.debug("chain.step stage={} index={} function={}", stage.label(), i, fn.name());
            try {
                current = fn.function().apply(current);
            } catch (RuntimeException e) {
                throw new ProcessorException(profile.name(), stage, i, fn.name(), e);
            }
            if (current == null) {
                throw new ProcessorException(
                        profile.name(), stage, i, fn.name(), new IllegalStateException("processor returned null"));
            }
        }
        return current;
    }

    private IrNode runIntermediate(Profile profile, IrNode tree) {
        List<ChainFunction<IntermediateProcessor>> chain = profile.intermediateProcessors();
        IrNode current = tree;
        for (int i = 0; i < chain.size(); i++) {
            ChainFunction<IntermediateProcessor> fn = chain.get(i);
            LOG.debug("chain.step stage={} index={} function={}", ChainStage.INTERMEDIATE.label(), i, fn.name());
            try {
                current = fn.function().apply(current);
            } catch (RuntimeException e) {
                throw new ProcessorException(profile.name(), ChainStage.INTERMEDIATE, i, fn.name(), e);
            }
            if (current == null) {
                throw new ProcessorException(
                        profile.name(),
                        ChainStage.INTERMEDIATE,
                        i,
                        fn.name(),
                        new IllegalStateException("processor returned null"));
            }
        }
        return current;
    }

    // --- Listener notifications (failures are logged, never propagated) ---

    private void notifySelected(TranslationListener.ProfileSelectedEvent event) {
        for (TranslationListener listener : listeners) {
            try {
                listener.onProfileSelected(event);
            } catch (Exception e) {
                LOG.warn("TranslationListener.onProfileSelected failed", e);
            }
        }
    }

    private void notifyCompleted(TranslationListener.TranslationCompletedEvent event) {
        for (TranslationListener listener : listeners) {
            try {
                listener.onTranslationCompleted(event);
            } catch (Exception e) {
                LOG.warn("TranslationListener.onTranslationCompleted failed", e);
            }
        }
    }

    private void notifyFailed(TranslationListener.TranslationFailedEvent event) {
        for (TranslationListener listener : listeners) {
            try {
                listener.onTranslationFailed(event);
            } catch (Exception e) {
                LOG.warn("TranslationListener.onTranslationFailed failed", e);
            }
        }
    }
}
