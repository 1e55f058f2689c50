/**
 * Annotations for binding-form generators.
 * <p>
 * {@link io.github.reugn.bind4j.annotation.BindingForm} carries the tag, synonyms
 * and value-form capability of a generator so that the registry can install it
 * without further configuration.
 */
package io.github.reugn.bind4j.annotation;
