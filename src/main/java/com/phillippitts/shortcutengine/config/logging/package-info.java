/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - set by
 *       {@link com.phillippitts.shortcutengine.config.logging.MdcFilter} for REST calls</li>
 *   <li>{@code shortcutId} - set by the dispatch table while a shortcut's handlers run</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [thread-name] [requestId] [shortcutId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.shortcutengine.config.logging;
