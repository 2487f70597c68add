package io.ini2toml.core.spi;

import io.ini2toml.core.model.IrNode;

/**
 * IR-to-IR function of a profile's intermediate chain. May modify and return its argument or
 * return a new tree; the returned tree is what the next function receives.
 *
 * <p>
 * Same purity contract as {@link TextProcessor}.
 */
@FunctionalInterface
public interface IntermediateProcessor {

    IrNode apply(IrNode document);
}
