/**
 * The standard binding forms.
 * <p>
 * Each generator is published as a {@code BindingFormGenerator} service and
 * described by {@link io.github.reugn.bind4j.annotation.BindingForm}:
 * <ul>
 *   <li>{@code :variable}, {@code :array}, {@code :plist}, {@code :structure} - {@code let*} based, merge with neighbours</li>
 *   <li>{@code :destructure}, {@code :values}, {@code :flet}, {@code :labels} - templates with placeholders</li>
 *   <li>{@code :slots}, {@code :accessors} - evaluate the object once, then extend the inner construct</li>
 * </ul>
 */
package io.github.reugn.bind4j.forms;
