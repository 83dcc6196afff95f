/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base to enable consistent
 * error handling and HTTP response mapping.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.keycodes.exception.KeyCodesException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.keycodes.exception.UnknownKeyCodeException} - Thrown when
 *       a key name is neither a canonical key code nor an accepted alias</li>
 * </ul>
 *
 * <p>A keyboard layout that cannot be queried is not an error: the label resolver falls
 * back to the baseline label without raising anything.
 *
 * @see com.phillippitts.keycodes.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.keycodes.exception;
