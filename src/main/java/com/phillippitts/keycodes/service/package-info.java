/**
 * Service layer built on the key code domain.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.hotkey} - Loading persisted hotkey bindings from configuration</li>
 *   <li>{@code service.metrics} - Micrometer counters for parse failures and label resolution</li>
 * </ul>
 *
 * <p>Services are stateless Spring beans using constructor injection. They throw domain
 * exceptions, never HTTP exceptions.
 *
 * @see com.phillippitts.keycodes.service.hotkey
 * @since 1.0
 */
package com.phillippitts.keycodes.service;
