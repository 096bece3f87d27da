package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.domain.ModifierKey;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Vocabulary of hotkey tokens: modifier aliases, named special keys and the physical modifier
 * keys reported by the OS adapter. Keeps the parser and the key hook on one naming scheme.
 */
public final class KeyNameMapper {

    public static final Key LEFT_CTRL = Key.of("left_ctrl");
    public static final Key RIGHT_CTRL = Key.of("right_ctrl");
    public static final Key LEFT_ALT = Key.of("left_alt");
    public static final Key RIGHT_ALT = Key.of("right_alt");
    public static final Key LEFT_SHIFT = Key.of("left_shift");
    public static final Key RIGHT_SHIFT = Key.of("right_shift");
    public static final Key LEFT_META = Key.of("left_meta");
    public static final Key RIGHT_META = Key.of("right_meta");

    private static final Map<String, ModifierKey> MODIFIER_TOKENS;
    private static final Map<String, String> NAMED_KEYS;

    static {
        Map<String, ModifierKey> mods = new HashMap<>();
        for (String side : new String[] {"", "left_", "right_"}) {
            mods.put(side + "ctrl", ModifierKey.CTRL);
            mods.put(side + "control", ModifierKey.CTRL);
            mods.put(side + "alt", ModifierKey.ALT);
            mods.put(side + "option", ModifierKey.ALT);
            mods.put(side + "shift", ModifierKey.SHIFT);
            mods.put(side + "meta", ModifierKey.META);
            mods.put(side + "win", ModifierKey.META);
            mods.put(side + "cmd", ModifierKey.META);
            mods.put(side + "command", ModifierKey.META);
            mods.put(side + "super", ModifierKey.META);
        }
        MODIFIER_TOKENS = Map.copyOf(mods);

        Map<String, String> keys = new HashMap<>();
        for (int i = 1; i <= 24; i++) {
            keys.put("f" + i, "f" + i);
        }
        for (String k : new String[] {"pause", "insert", "home", "end", "pageup", "pagedown", "space",
                "enter", "tab", "backspace", "delete", "escape", "up", "down", "left", "right"}) {
            keys.put(k, k);
        }
        // Aliases
        keys.put("esc", "escape");
        keys.put("return", "enter");
        keys.put("del", "delete");
        keys.put("ins", "insert");
        keys.put("page_up", "pageup");
        keys.put("page_down", "pagedown");
        keys.put("pgup", "pageup");
        keys.put("pgdn", "pagedown");
        NAMED_KEYS = Map.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a raw token: trimmed, lowercase, inner spaces to underscores. */
    public static String normalizeToken(String token) {
        if (token == null) {
            return "";
        }
        return token.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /** Logical modifier named by a hotkey token ({@code ctrl}, {@code cmd}, {@code left_shift}...). */
    public static Optional<ModifierKey> modifierForToken(String token) {
        return Optional.ofNullable(MODIFIER_TOKENS.get(normalizeToken(token)));
    }

    /** Named special key for a token, resolving aliases ({@code esc} → {@code escape}). */
    public static Optional<Key> namedKey(String token) {
        String canonical = NAMED_KEYS.get(normalizeToken(token));
        return canonical == null ? Optional.empty() : Optional.of(Key.of(canonical));
    }

    /** A single printable, non-whitespace character is accepted as a literal key. */
    public static boolean isLiteralKey(String token) {
        if (token == null || token.codePointCount(0, token.length()) != 1) {
            return false;
        }
        int cp = token.codePointAt(0);
        return !Character.isWhitespace(cp) && !Character.isISOControl(cp) && Character.isDefined(cp);
    }

    /** Logical modifier for a physical key reported by the OS, if the key is a modifier. */
    public static Optional<ModifierKey> modifierOf(Key key) {
        return key == null ? Optional.empty() : Optional.ofNullable(MODIFIER_TOKENS.get(key.name()));
    }

    public static boolean isModifier(Key key) {
        return modifierOf(key).isPresent();
    }

    /** Collapse held physical modifier keys to their logical modifiers. */
    public static Set<ModifierKey> logicalModifiers(Collection<Key> physical) {
        Set<ModifierKey> out = EnumSet.noneOf(ModifierKey.class);
        for (Key k : physical) {
            modifierOf(k).ifPresent(out::add);
        }
        return out;
    }
}
