/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code /api/shortcuts} endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over {@code ShortcutsIntegrator} and {@code ShortcutRegistry};
 * registry conflicts are values and map to 409 in the controller, exceptions map to status codes
 * in {@link com.phillippitts.shortcutengine.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.shortcutengine.presentation;
