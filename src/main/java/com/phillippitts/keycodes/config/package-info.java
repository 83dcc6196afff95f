/**
 * Spring configuration: typed properties, startup validation and bean wiring for the
 * keyboard layout ({@code keycodes.layout.*}) and hotkey bindings ({@code hotkey.*}).
 *
 * <p>Invalid settings fail startup with an {@link java.lang.IllegalArgumentException} naming
 * the offending property.
 */
package com.phillippitts.keycodes.config;
