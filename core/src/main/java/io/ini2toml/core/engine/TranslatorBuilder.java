package io.ini2toml.core.engine;

import io.ini2toml.core.config.TranslatorConfig;
import io.ini2toml.core.engine.toml.RenderOptions;
import io.ini2toml.core.engine.toml.TomlSerializer;
import io.ini2toml.core.error.RegistrationException;
import io.ini2toml.core.model.Profile;
import io.ini2toml.core.model.ProfileAugmentation;
import io.ini2toml.core.model.ProfileDraft;
import io.ini2toml.core.parser.IniParser;
import io.ini2toml.core.spi.Augmentation;
import io.ini2toml.core.spi.Extension;
import io.ini2toml.core.spi.SourceParser;
import io.ini2toml.core.spi.TranslationListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration handle used while a {@link Translator} is assembled.
 *
 * <p>
 * Extensions registered with {@link #register(String, Extension)} are activated once each,
 * in lexical order of their registration names, when {@link #build()} is called. They receive
 * this builder and use {@link #profile(String)} and
 * {@link #augmentProfiles(Augmentation, boolean, String, String)} to contribute processors.
 * After {@code build()} the registry is frozen; the builder cannot be reused. If an extension
 * fails during activation, the builder is unusable too, since the extensions activated before
 * it have already changed the drafts.
 *
 * <p>
 * Not thread-safe. Assembly happens on one thread before the translator is shared.
 */
public final class TranslatorBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TranslatorBuilder.class);
    private static final Pattern AUGMENTATION_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Map<String, ProfileDraft> profiles = new LinkedHashMap<>();
    private final Map<String, ProfileAugmentation> augmentations = new LinkedHashMap<>();
    private final Map<String, Extension> extensions = new TreeMap<>();
    private final List<TranslationListener> listeners = new ArrayList<>();
    private TranslatorConfig config = TranslatorConfig.DEFAULT;
    private SourceParser parser;
    private RenderOptions renderOptions;
    private String defaultProfile;
    private boolean activating;
    private boolean built;
    private boolean failed;

    TranslatorBuilder() {}

    /**
     * Returns the draft registered under {@code name}, creating an empty one on first access.
     * Repeated calls with the same name return the same draft.
     */
    public ProfileDraft profile(String name) {
        ensureOpen();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("profile name must not be blank");
        }
        return profiles.computeIfAbsent(name, n -> {
            LOG.debug("profile.created name={}", n);
            return new ProfileDraft(n);
        });
    }

    /** Returns {@code true} if a profile named {@code name} has been created. */
    public boolean hasProfile(String name) {
        return profiles.containsKey(name);
    }

    /**
     * Registers a profile-independent augmentation, run on the per-call copy of whichever
     * profile is selected.
     *
     * @param fn              the augmentation
     * @param activeByDefault whether it runs when the caller expresses no preference
     * @param name            registration name, matching {@code [A-Za-z0-9_.-]+}
     * @param helpText        description for front ends, may be empty
     * @throws RegistrationException if the name is invalid, or already taken by a different
     *                               function
     */
    public TranslatorBuilder augmentProfiles(Augmentation fn, boolean activeByDefault, String name, String helpText) {
        ensureOpen();
        Objects.requireNonNull(fn, "augmentation must not be null");
        String trimmed = name != null ? name.strip() : "";
        if (!AUGMENTATION_NAME.matcher(trimmed).matches()) {
            throw new RegistrationException(
                    "Invalid augmentation name '" + trimmed + "': only letters, digits, '_', '.' and '-' are allowed",
                    trimmed);
        }
        ProfileAugmentation existing = augmentations.get(trimmed);
        if (existing != null) {
            if (existing.function() == fn) {
                LOG.debug("augmentation.reregistered name={}", trimmed);
                return this;
            }
            throw new RegistrationException(
                    "Augmentation '" + trimmed + "' is already registered with a different function", trimmed);
        }
        augmentations.put(trimmed, new ProfileAugmentation(trimmed, helpText, activeByDefault, fn));
        LOG.debug("augmentation.registered name={} active_by_default={}", trimmed, activeByDefault);
        return this;
    }

    /**
     * Registers an extension under {@code name}. The first registration of a name wins; later
     * ones are logged and ignored.
     */
    public TranslatorBuilder register(String name, Extension extension) {
        ensureOpen();
        if (activating) {
            throw new IllegalStateException("extensions cannot be registered while extensions are being activated");
        }
        if (name == null || name.isBlank()) {
            throw new RegistrationException("Extension name must not be blank", String.valueOf(name));
        }
        Objects.requireNonNull(extension, "extension must not be null");
        if (extensions.containsKey(name)) {
            LOG.warn("extension.duplicate name={} action=ignored", name);
            return this;
        }
        extensions.put(name, extension);
        return this;
    }

    /** Replaces the source parser (default: {@link IniParser} with the configured options). */
    public TranslatorBuilder parser(SourceParser parser) {
        ensureOpen();
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        return this;
    }

    /** Overrides the configured serializer thresholds. */
    public TranslatorBuilder renderOptions(RenderOptions renderOptions) {
        ensureOpen();
        this.renderOptions = Objects.requireNonNull(renderOptions, "renderOptions must not be null");
        return this;
    }

    /** Overrides the configured fallback profile name. */
    public TranslatorBuilder defaultProfile(String name) {
        ensureOpen();
        this.defaultProfile = Objects.requireNonNull(name, "default profile must not be null");
        return this;
    }

    /** Adds a listener notified of every translation call. */
    public TranslatorBuilder listener(TranslationListener listener) {
        ensureOpen();
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    /**
     * Applies a configuration. Explicit {@link #parser}, {@link #renderOptions} and
     * {@link #defaultProfile} calls take precedence over it.
     */
    public TranslatorBuilder config(TranslatorConfig config) {
        ensureOpen();
        this.config = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    /**
     * Activates the registered extensions and freezes everything into a {@link Translator}.
     *
     * @throws IllegalStateException if called twice, or after a failed activation
     */
    public Translator build() {
        ensureOpen();
        activating = true;
        try {
            for (Map.Entry<String, Extension> entry : extensions.entrySet()) {
                try {
                    entry.getValue().activate(this);
                } catch (RuntimeException e) {
                    failed = true;
                    LOG.error("extension.activation_failed name={} error={}", entry.getKey(), e.toString());
                    throw e;
                }
                LOG.debug("extension.activated name={}", entry.getKey());
            }
        } finally {
            activating = false;
        }
        built = true;

        Map<String, Profile> frozen = new LinkedHashMap<>();
        profiles.forEach((name, draft) -> frozen.put(name, draft.toProfile()));

        List<ProfileAugmentation> resolved = new ArrayList<>();
        for (ProfileAugmentation aug : augmentations.values()) {
            Boolean override = config.augmentations().get(aug.name());
            resolved.add(override == null
                    ? aug
                    : new ProfileAugmentation(aug.name(), aug.helpText(), override, aug.function()));
        }
        for (String name : config.augmentations().keySet()) {
            if (!augmentations.containsKey(name)) {
                LOG.warn("config.augmentation_unknown name={} action=ignored", name);
            }
        }

        SourceParser effectiveParser = parser != null ? parser : new IniParser(config.parser());
        RenderOptions effectiveRender = renderOptions != null ? renderOptions : config.render();
        String effectiveDefault = defaultProfile != null ? defaultProfile : config.defaultProfile();

        LOG.info(
                "translator.built profiles={} augmentations={} extensions={} default_profile={}",
                frozen.size(),
                resolved.size(),
                extensions.size(),
                effectiveDefault);
        return new Translator(
                frozen,
                resolved,
                effectiveParser,
                new TomlSerializer(effectiveRender),
                effectiveDefault,
                listeners);
    }

    private void ensureOpen() {
        if (failed) {
            throw new IllegalStateException("extension activation failed; create a new builder");
        }
        if (built) {
            throw new IllegalStateException("translator has already been built");
        }
    }
}
