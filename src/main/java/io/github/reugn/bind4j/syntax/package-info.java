/**
 * Syntax trees consumed and produced by the expander.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.bind4j.syntax.Form} - the sealed node type</li>
 *   <li>{@link io.github.reugn.bind4j.syntax.Symbol}, {@link io.github.reugn.bind4j.syntax.Literal},
 *       {@link io.github.reugn.bind4j.syntax.ListForm}, {@link io.github.reugn.bind4j.syntax.VectorForm} - tree nodes</li>
 *   <li>{@link io.github.reugn.bind4j.syntax.Placeholder} - body and declaration markers used in templates</li>
 *   <li>{@link io.github.reugn.bind4j.syntax.FormReader} - s-expression reader</li>
 * </ul>
 */
package io.github.reugn.bind4j.syntax;
