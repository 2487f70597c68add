package io.ini2toml.core.model;

import io.ini2toml.core.spi.IntermediateProcessor;
import io.ini2toml.core.spi.TextProcessor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable working copy of a {@link Profile}. Extensions receive drafts through the
 * translator builder while the registry is being assembled; augmentations receive a fresh
 * draft per translation call, so nothing they do leaks into the registry.
 *
 * <p>
 * Functions registered without an explicit name are named after their chain and a sequence
 * number that only grows, e.g. {@code post#2}. Prepending never renames existing functions.
 *
 * <p>
 * Not thread-safe.
 */
public final class ProfileDraft {

    private final String name;
    private String description = "";
    private String helpText = "";
    private boolean activeByDefault;
    private final List<ChainFunction<TextProcessor>> pre = new ArrayList<>();
    private final List<ChainFunction<IntermediateProcessor>> intermediate = new ArrayList<>();
    private final List<ChainFunction<TextProcessor>> post = new ArrayList<>();
    private final Map<ChainStage, Integer> unnamed = new EnumMap<>(ChainStage.class);

    public ProfileDraft(String name) {
        this.name = Objects.requireNonNull(name, "profile name must not be null");
    }

    /** Creates a draft holding the same chains as {@code profile}. */
    public static ProfileDraft from(Profile profile) {
        ProfileDraft draft = new ProfileDraft(profile.name());
        draft.description = profile.description();
        draft.helpText = profile.helpText();
        draft.activeByDefault = profile.activeByDefault();
        draft.pre.addAll(profile.preProcessors());
        draft.intermediate.addAll(profile.intermediateProcessors());
        draft.post.addAll(profile.postProcessors());
        // sequence numbers continue past every function the profile already holds
        draft.unnamed.put(ChainStage.PRE, draft.pre.size());
        draft.unnamed.put(ChainStage.INTERMEDIATE, draft.intermediate.size());
        draft.unnamed.put(ChainStage.POST, draft.post.size());
        return draft;
    }

    public String name() {
        return name;
    }

    public ProfileDraft description(String description) {
        this.description = description != null ? description : "";
        return this;
    }

    public String description() {
        return description;
    }

    public ProfileDraft helpText(String helpText) {
        this.helpText = helpText != null ? helpText : "";
        return this;
    }

    public String helpText() {
        return helpText;
    }

    public ProfileDraft activeByDefault(boolean activeByDefault) {
        this.activeByDefault = activeByDefault;
        return this;
    }

    // --- pre ---

    public ProfileDraft appendPre(TextProcessor fn) {
        return appendPre(defaultName(ChainStage.PRE), fn);
    }

    public ProfileDraft appendPre(String fnName, TextProcessor fn) {
        pre.add(new ChainFunction<>(fnName, fn));
        return this;
    }

    public ProfileDraft prependPre(String fnName, TextProcessor fn) {
        pre.add(0, new ChainFunction<>(fnName, fn));
        return this;
    }

    // --- intermediate ---

    public ProfileDraft appendIntermediate(IntermediateProcessor fn) {
        return appendIntermediate(defaultName(ChainStage.INTERMEDIATE), fn);
    }

    public ProfileDraft appendIntermediate(String fnName, IntermediateProcessor fn) {
        intermediate.add(new ChainFunction<>(fnName, fn));
        return this;
    }

    public ProfileDraft prependIntermediate(String fnName, IntermediateProcessor fn) {
        intermediate.add(0, new ChainFunction<>(fnName, fn));
        return this;
    }

    // --- post ---

    public ProfileDraft appendPost(TextProcessor fn) {
        return appendPost(defaultName(ChainStage.POST), fn);
    }

    public ProfileDraft appendPost(String fnName, TextProcessor fn) {
        post.add(new ChainFunction<>(fnName, fn));
        return this;
    }

    public ProfileDraft prependPost(String fnName, TextProcessor fn) {
        post.add(0, new ChainFunction<>(fnName, fn));
        return this;
    }

    /** Read-only view of a chain's function names, in execution order. */
    public List<String> functionNames(ChainStage stage) {
        List<? extends ChainFunction<?>> chain =
                switch (stage) {
                    case PRE -> pre;
                    case INTERMEDIATE -> intermediate;
                    case POST -> post;
                };
        return chain.stream().map(ChainFunction::name).toList();
    }

    /** Freezes the draft into an immutable {@link Profile}. */
    public Profile toProfile() {
        return new Profile(name, description, helpText, activeByDefault, pre, intermediate, post);
    }

    private String defaultName(ChainStage stage) {
        int index = unnamed.merge(stage, 1, Integer::sum) - 1;
        return stage.label() + "#" + index;
    }
}
