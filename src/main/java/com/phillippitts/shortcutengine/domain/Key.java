package com.phillippitts.shortcutengine.domain;

import java.util.Locale;

/**
 * Identity of a single physical key, compared by its canonical lowercase name
 * (e.g. {@code f1}, {@code pause}, {@code x}, {@code ,}, {@code left_ctrl}).
 */
public record Key(String name) {

    public Key {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("key name must not be empty");
        }
        name = name.toLowerCase(Locale.ROOT);
    }

    public static Key of(String name) {
        return new Key(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
