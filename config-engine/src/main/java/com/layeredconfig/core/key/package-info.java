/**
 * Parsing of key expressions into hierarchy segments.
 *
 * @since 1.0.0
 */
package com.layeredconfig.core.key;
