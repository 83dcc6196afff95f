/**
 * Layout-aware key labels.
 *
 * <p>{@link com.phillippitts.keycodes.layout.KeyLabelResolver} asks a
 * {@link com.phillippitts.keycodes.layout.KeyboardLayout} which glyph a writing system key
 * produces and falls back to the US baseline label when the layout has no answer.
 * Layout sources shipped here:
 * <ul>
 *   <li>{@code NoKeyboardLayout} - always empty</li>
 *   <li>{@code FixedKeyboardLayout} - explicit glyph table, used for overrides</li>
 *   <li>{@code InputLocaleKeyboardLayout} - picks a {@code StandardLayout} from the input locale</li>
 * </ul>
 */
package com.phillippitts.keycodes.layout;
