/**
 * Key identities and their text forms.
 *
 * <p>{@link com.phillippitts.keycodes.domain.KeyCode} is the closed set of physical key
 * positions, each with a canonical name, a US baseline label and a
 * {@link com.phillippitts.keycodes.domain.KeyCodeClass}.
 * {@link com.phillippitts.keycodes.domain.KeyCodeParser} maps canonical names and legacy
 * aliases back to keys. Everything in this package is immutable, free of I/O and safe to
 * use from any thread.
 *
 * @since 1.0
 */
package com.phillippitts.keycodes.domain;
