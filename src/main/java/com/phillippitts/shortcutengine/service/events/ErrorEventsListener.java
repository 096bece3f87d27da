package com.phillippitts.shortcutengine.service.events;

import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.ShortcutConflictEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing shortcut warnings. Throttled to avoid log spam on
 * repeated reloads.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Keyboard shortcuts unavailable: global key hook was refused. On macOS grant Accessibility: "
                    + "System Settings → Privacy & Security → Accessibility (then restart app)");
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        String key = "hotkey-conflict-" + e.shortcutId() + '-' + e.hotkey();
        if (shouldLog(key)) {
            LOG.warn("Shortcut '{}' uses OS-reserved combination {} ({}). Assign a different hotkey.",
                    e.shortcutId(), e.hotkey(), e.reserved());
        }
    }

    @EventListener
    void onShortcutConflict(ShortcutConflictEvent e) {
        String key = "shortcut-conflict-" + e.conflicts().keySet();
        if (shouldLog(key)) {
            LOG.warn("Enabled shortcuts share hotkeys: {}. Only the first of each fires from the index; "
                    + "edit or disable the others.", e.conflicts());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
