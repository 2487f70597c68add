package io.ini2toml.core.spi;

import io.ini2toml.core.model.IrNode;

/**
 * Turns source text into a fresh intermediate representation. The only coupling point
 * between the translator and a concrete source-format parser.
 *
 * <p>
 * Implementations MUST fail fast on unsupported source features (value interpolation,
 * duplicate section or option names) instead of silently merging or overwriting, and MUST
 * return a new tree on every call.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * @throws io.ini2toml.core.error.SourceParseException if the text is malformed
     */
    IrNode parse(String text);
}
