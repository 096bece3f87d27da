/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.shortcutengine.exception.ShortcutEngineException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.shortcutengine.exception.ShortcutConfigException} - Thrown by the
 *       configuration store when a file cannot be read, parsed or written</li>
 *   <li>{@link com.phillippitts.shortcutengine.exception.ShortcutNotFoundException} - Thrown by the
 *       REST layer for unknown shortcut ids</li>
 * </ul>
 *
 * <p>Shortcut conflicts are not exceptions: the registry returns them as
 * {@link com.phillippitts.shortcutengine.service.registry.RegistryResult} values so callers can
 * offer a resolution. Configuration exceptions never escape the registry; they are logged and
 * reported as booleans or {@link com.phillippitts.shortcutengine.service.registry.ImportResult}.
 *
 * @see com.phillippitts.shortcutengine.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.shortcutengine.exception;
