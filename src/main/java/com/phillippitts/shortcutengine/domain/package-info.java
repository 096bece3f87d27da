/**
 * Domain model for the shortcut engine.
 *
 * <p>Key Types:
 * <ul>
 *   <li>{@link com.phillippitts.shortcutengine.domain.Shortcut} - immutable record of a named
 *       action and its textual hotkey</li>
 *   <li>{@link com.phillippitts.shortcutengine.domain.HotkeySpec} - parsed, normalized form of a
 *       hotkey (modifier set plus main key)</li>
 *   <li>{@link com.phillippitts.shortcutengine.domain.Key} and
 *       {@link com.phillippitts.shortcutengine.domain.ModifierKey} - key identities shared by the
 *       parser and the OS event adapter</li>
 * </ul>
 *
 * <p>Groups are not modeled as a type: a group exists while at least one shortcut references it.
 *
 * @since 1.0
 */
package com.phillippitts.shortcutengine.domain;
