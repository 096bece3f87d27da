/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.shortcutengine.config.ShortcutEngineConfig} - wires the registry,
 *       its JSON store, the shared state lock, the clock and the global key hook</li>
 *   <li>{@link com.phillippitts.shortcutengine.config.properties.ShortcutProperties} - typed
 *       {@code shortcuts.*} properties</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.hotkey} - matching mode and startup validation</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.shortcutengine.config;
