package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.config.hotkey.ModifierMatchMode;
import com.phillippitts.shortcutengine.domain.HotkeySpec;
import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.domain.ModifierKey;

import java.util.Set;

/**
 * Decides whether a key-down plus the currently held modifiers satisfies a hotkey spec.
 * Side-effect free.
 */
public final class HotkeyMatcher {

    private HotkeyMatcher() {}

    /**
     * @param pressed non-modifier key that went down
     * @param activeModifiers logical modifiers currently held
     * @param spec parsed shortcut hotkey
     * @param mode modifier comparison rule
     * @return true when the main key is equal and the modifier rule holds; a spec without
     *         modifiers matches regardless of what is held
     */
    public static boolean matches(Key pressed, Set<ModifierKey> activeModifiers, HotkeySpec spec,
                                  ModifierMatchMode mode) {
        if (spec == null || !spec.hasMainKey() || !spec.mainKey().equals(pressed)) {
            return false;
        }
        Set<ModifierKey> required = spec.modifiers();
        if (required.isEmpty()) {
            return true;
        }
        return switch (mode) {
            case ANY -> required.stream().anyMatch(activeModifiers::contains);
            case ALL -> activeModifiers.containsAll(required);
        };
    }
}
