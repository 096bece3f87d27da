package com.phillippitts.shortcutengine.service.listener;

import java.util.HashMap;
import java.util.Map;

/**
 * Last trigger time per shortcut id. A shortcut may fire again only once {@code window}
 * milliseconds have passed since it last fired; other shortcuts are unaffected.
 *
 * <p>Entries are created on first trigger and never evicted. Not thread-safe; the owning
 * listener serializes access.
 */
final class DebounceLedger {

    private final long windowMillis;
    private final Map<String, Long> lastTrigger = new HashMap<>();

    DebounceLedger(long windowMillis) {
        if (windowMillis < 0) {
            throw new IllegalArgumentException("windowMillis must be >= 0");
        }
        this.windowMillis = windowMillis;
    }

    /**
     * Records {@code nowMillis} for {@code shortcutId} unless it fired within the window.
     *
     * @return true if the shortcut may fire now
     */
    boolean tryAcquire(String shortcutId, long nowMillis) {
        Long last = lastTrigger.get(shortcutId);
        if (last != null && nowMillis - last < windowMillis) {
            return false;
        }
        lastTrigger.put(shortcutId, nowMillis);
        return true;
    }

    long windowMillis() {
        return windowMillis;
    }

    int size() {
        return lastTrigger.size();
    }
}
