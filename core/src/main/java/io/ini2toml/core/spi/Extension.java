package io.ini2toml.core.spi;

import io.ini2toml.core.engine.TranslatorBuilder;

/**
 * Activation entry point of an extension. Invoked exactly once, while the translator is
 * being built, with the builder as registration handle: extensions fetch-or-create profiles,
 * extend their chains and register augmentations through it.
 *
 * <p>
 * Extensions are registered under a name with
 * {@link TranslatorBuilder#register(String, Extension)} and activated in lexical order of
 * that name.
 */
@FunctionalInterface
public interface Extension {

    void activate(TranslatorBuilder translator);
}
