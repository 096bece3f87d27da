package com.phillippitts.shortcutengine.service.registry;

import com.phillippitts.shortcutengine.domain.HotkeySpec;

/**
 * An enabled shortcut paired with its parsed hotkey, as consumed by the key listener.
 */
public record ShortcutBinding(String shortcutId, String hotkey, HotkeySpec spec) { }
