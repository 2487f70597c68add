package io.ini2toml.core.model;

import java.util.Objects;

/**
 * Pseudo-entry of an {@link IrNode} that keeps a standalone comment line or a blank line at
 * its position. Hidden markers have no key and may repeat freely.
 */
public sealed interface HiddenMarker {

    static HiddenMarker comment(String text) {
        return new Comment(text);
    }

    static HiddenMarker blank() {
        return Blank.INSTANCE;
    }

    /** A comment line; {@code text} excludes the comment prefix. */
    record Comment(String text) implements HiddenMarker {
        public Comment {
            Objects.requireNonNull(text, "comment text must not be null");
        }
    }

    /** An empty line. */
    record Blank() implements HiddenMarker {
        static final Blank INSTANCE = new Blank();
    }
}
