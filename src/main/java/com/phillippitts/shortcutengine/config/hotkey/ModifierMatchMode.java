package com.phillippitts.shortcutengine.config.hotkey;

/**
 * How a shortcut's required modifiers are compared with the modifiers currently held.
 * <p>
 * Spring Boot relaxed binding maps property values "any" and "all" to ANY and ALL.
 */
public enum ModifierMatchMode {
    /**
     * At least one required modifier must be held (set intersection). A {@code ctrl+shift+x}
     * shortcut therefore fires on {@code ctrl+x}. This is the long-standing behavior existing
     * user configurations rely on.
     */
    ANY,
    /** Every required modifier must be held (subset test). */
    ALL
}
