package io.ini2toml.core.model;

import java.util.Objects;

/**
 * A function registered in a profile chain, together with the name used to identify it in
 * logs and errors.
 *
 * @param name     identifying name (never empty)
 * @param function the processor
 * @param <F>      processor type ({@code TextProcessor} or {@code IntermediateProcessor})
 */
public record ChainFunction<F>(String name, F function) {

    public ChainFunction {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(function, "function must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("chain function name must not be blank");
        }
    }
}
