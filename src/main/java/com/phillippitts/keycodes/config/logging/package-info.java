/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.keycodes.config.logging.MdcFilter} puts {@code requestId},
 * {@code method} and {@code uri} into Log4j2's ThreadContext for every HTTP request.
 * The pattern in {@code log4j2-spring.xml} prints them on every line:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.keycodes.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.keycodes.config.logging;
