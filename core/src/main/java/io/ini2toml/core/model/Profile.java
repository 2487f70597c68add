package io.ini2toml.core.model;

import io.ini2toml.core.spi.IntermediateProcessor;
import io.ini2toml.core.spi.TextProcessor;
import java.util.List;
import java.util.Objects;

/**
 * Named bundle of processing chains applied to one class of source documents (e.g.
 * {@code setup.cfg}).
 *
 * <p>
 * Immutable and thread-safe, built once when the translator is frozen. Per-call changes made
 * by augmentations go to a {@link ProfileDraft} copy, never to the stored profile.
 *
 * @param name            profile identifier
 * @param description     one-line human-readable description
 * @param helpText        longer help text, may be empty
 * @param activeByDefault whether front ends should offer the profile as active by default
 * @param preProcessors   text functions applied before parsing, in order
 * @param intermediateProcessors IR functions applied after parsing, in order
 * @param postProcessors  text functions applied after serialization, in order
 */
public record Profile(
        String name,
        String description,
        String helpText,
        boolean activeByDefault,
        List<ChainFunction<TextProcessor>> preProcessors,
        List<ChainFunction<IntermediateProcessor>> intermediateProcessors,
        List<ChainFunction<TextProcessor>> postProcessors) {

    public Profile {
        Objects.requireNonNull(name, "profile name must not be null");
        description = description != null ? description : "";
        helpText = helpText != null ? helpText : "";
        preProcessors = preProcessors != null ? List.copyOf(preProcessors) : List.of();
        intermediateProcessors = intermediateProcessors != null ? List.copyOf(intermediateProcessors) : List.of();
        postProcessors = postProcessors != null ? List.copyOf(postProcessors) : List.of();
    }

    /** An empty profile with no processors. */
    public static Profile empty(String name) {
        return new Profile(name, "", "", false, List.of(), List.of(), List.of());
    }

    /** Total number of registered processors across the three chains. */
    public int processorCount() {
        return preProcessors.size() + intermediateProcessors.size() + postProcessors.size();
    }
}
