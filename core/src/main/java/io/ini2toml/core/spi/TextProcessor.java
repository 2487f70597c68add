package io.ini2toml.core.spi;

/**
 * Text-to-text function of a profile's pre- or post-processing chain.
 *
 * <p>
 * Implementations MUST be free of observable side effects and SHOULD be idempotent when
 * re-applied to their own output. Any exception aborts the translation and is reported as a
 * {@link io.ini2toml.core.error.ProcessorException}.
 */
@FunctionalInterface
public interface TextProcessor {

    String apply(String text);
}
