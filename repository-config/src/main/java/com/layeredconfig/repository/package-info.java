/**
 * Repository configuration built on the layered config engine.
 *
 * <h3>Sections</h3>
 * <ul>
 * <li>{@code registry}: kinds {@code sqlite} and {@code postgresql}</li>
 * <li>{@code datastore}: kinds {@code posix}, {@code inMemory} and
 * {@code chained}, the last one composing each entry of its
 * {@code datastores} list as a datastore of its own</li>
 * </ul>
 *
 * <p>
 * Built-in defaults ship as classpath resources under {@code config/}.
 * </p>
 */
package com.layeredconfig.repository;
