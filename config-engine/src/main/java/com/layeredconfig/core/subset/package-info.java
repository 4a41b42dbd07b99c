/**
 * Composition of configuration subsets from layered defaults.
 *
 * <p>
 * A {@link com.layeredconfig.core.subset.SubsetDescriptor} names a component,
 * its required keys and its default file.
 * {@link com.layeredconfig.core.subset.DefaultsComposer} merges the default
 * files found along a {@link com.layeredconfig.core.subset.SearchContext},
 * the defaults of the kind named by the discriminator (looked up in a
 * {@link com.layeredconfig.core.subset.ConfigKindRegistry}) and finally the
 * caller's values, then validates the result.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a kind, build a descriptor and register its discriminator at
 * startup with {@code ConfigKindRegistry.register()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.layeredconfig.core.subset;
