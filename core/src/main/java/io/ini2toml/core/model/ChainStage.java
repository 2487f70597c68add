package io.ini2toml.core.model;

/** The three processing chains of a {@link Profile}, in execution order. */
public enum ChainStage {
    /** Text-to-text functions applied to the source document before parsing. */
    PRE("pre"),
    /** IR-to-IR functions applied between parsing and serialization. */
    INTERMEDIATE("intermediate"),
    /** Text-to-text functions applied to the rendered TOML. */
    POST("post");

    private final String label;

    ChainStage(String label) {
        this.label = label;
    }

    /** Lowercase chain name used in error messages and logs. */
    public String label() {
        return label;
    }
}
