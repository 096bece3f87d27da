package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.domain.Key;

/**
 * Normalized keyboard event used by the shortcut listener.
 * This avoids direct coupling to any specific native hook library
 * and keeps tests hermetic.
 */
public record NormalizedKeyEvent(Type type, Key key) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
    }

    public static NormalizedKeyEvent pressed(String key) {
        return new NormalizedKeyEvent(Type.PRESSED, Key.of(key));
    }

    public static NormalizedKeyEvent released(String key) {
        return new NormalizedKeyEvent(Type.RELEASED, Key.of(key));
    }
}
