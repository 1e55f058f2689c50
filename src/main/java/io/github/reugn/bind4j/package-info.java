/**
 * bind4j - expands a list of binding specifications into nested binding forms.
 * <p>
 * This package holds the exception hierarchy shared by the reader
 * ({@link io.github.reugn.bind4j.syntax}) and the expander
 * ({@link io.github.reugn.bind4j.expander}). Every exception extends
 * {@link io.github.reugn.bind4j.BindException}.
 */
package io.github.reugn.bind4j;
