/**
 * Hierarchical configuration documents.
 *
 * <p>
 * {@link com.layeredconfig.core.config.Config} holds a nested tree of
 * mappings, sequences and scalars addressed by delimited or segmented key
 * paths, with deep-merge ({@code update}) and defaults-merge ({@code merge})
 * semantics. Files are read by
 * {@link com.layeredconfig.core.config.ConfigLoader} (YAML with the
 * {@code !include} tag, or JSON), after which the {@code includeConfigs}
 * directives are resolved.
 * </p>
 *
 * @since 1.0.0
 */
package com.layeredconfig.core.config;
