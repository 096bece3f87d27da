package com.phillippitts.shortcutengine.domain;

/**
 * Logical modifier keys. Left and right variants of a physical modifier collapse to one value.
 *
 * <p>Declaration order is the canonical order used when formatting a hotkey.
 */
public enum ModifierKey {
    CTRL("ctrl"),
    ALT("alt"),
    SHIFT("shift"),
    META("meta");

    private final String token;

    ModifierKey(String token) {
        this.token = token;
    }

    /** Lowercase token used in formatted hotkey strings. */
    public String token() {
        return token;
    }
}
