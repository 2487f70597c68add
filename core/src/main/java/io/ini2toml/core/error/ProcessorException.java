package io.ini2toml.core.error;

import io.ini2toml.core.model.ChainStage;

/**
 * Thrown when a function registered in one of a profile's chains fails. Carries the profile,
 * the chain stage, and the position and name of the offending function; the original failure
 * is available as {@link #getCause()}.
 */
public final class ProcessorException extends TranslationException {

    private static final long serialVersionUID = 1L;

    private final String profile;
    private final ChainStage stage;
    private final int functionIndex;
    private final String functionName;

    public ProcessorException(String profile, ChainStage stage, int functionIndex, String functionName, Throwable cause) {
        super(
                String.format(
                        "Processor '%s' (%s chain, index %d) of profile '%s' failed: %s",
                        functionName, stage.label(), functionIndex, profile, cause.getMessage()),
                cause);
        this.profile = profile;
        this.stage = stage;
        this.functionIndex = functionIndex;
        this.functionName = functionName;
    }

    /** Name of the profile selected for the failed translation. */
    public String profile() {
        return profile;
    }

    /** The chain the failing function belongs to. */
    public ChainStage stage() {
        return stage;
    }

    /** Zero-based position of the failing function within its chain. */
    public int functionIndex() {
        return functionIndex;
    }

    /** Registered name of the failing function. */
    public String functionName() {
        return functionName;
    }
}
