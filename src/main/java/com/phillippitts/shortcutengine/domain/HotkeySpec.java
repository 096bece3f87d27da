package com.phillippitts.shortcutengine.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Structured form of a hotkey: a set of logical modifiers plus an optional main key.
 *
 * <p>A spec without a main key never matches a key event. The empty spec (no modifiers,
 * no main key) represents an unassigned hotkey.
 *
 * @param modifiers required modifiers (never null, unmodifiable)
 * @param mainKey main key, or {@code null} when the text named only modifiers
 */
public record HotkeySpec(Set<ModifierKey> modifiers, Key mainKey) {

    public static final HotkeySpec EMPTY = new HotkeySpec(Set.of(), null);

    public HotkeySpec {
        EnumSet<ModifierKey> copy = EnumSet.noneOf(ModifierKey.class);
        if (modifiers != null) {
            copy.addAll(modifiers);
        }
        modifiers = Collections.unmodifiableSet(copy);
    }

    public boolean isEmpty() {
        return modifiers.isEmpty() && mainKey == null;
    }

    public boolean hasMainKey() {
        return mainKey != null;
    }
}
