package com.phillippitts.shortcutengine.service.listener;

import com.phillippitts.shortcutengine.util.TimeUtils;

/**
 * Millisecond clock that never goes backwards. Injected so debounce tests can control time.
 */
@FunctionalInterface
public interface MonotonicClock {

    long millis();

    static MonotonicClock system() {
        return TimeUtils::monotonicMillis;
    }
}
