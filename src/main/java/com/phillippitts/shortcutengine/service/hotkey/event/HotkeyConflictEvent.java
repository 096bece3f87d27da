package com.phillippitts.shortcutengine.service.hotkey.event;

import java.time.Instant;

/**
 * Published when an enabled shortcut is bound to an OS-reserved combination
 * (e.g., Cmd+Tab on macOS, Win+L on Windows).
 */
public record HotkeyConflictEvent(String shortcutId, String hotkey, String reserved, Instant at) { }
