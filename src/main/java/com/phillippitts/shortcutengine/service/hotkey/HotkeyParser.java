package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.domain.HotkeySpec;
import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.domain.ModifierKey;
import com.phillippitts.shortcutengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Converts textual hotkeys such as {@code "ctrl+shift+f1"} into {@link HotkeySpec} values and back.
 *
 * <p>Parsing is lenient: unknown tokens, empty tokens and any main key after the first are
 * dropped. Each dropped token is reported in {@link HotkeyParseResult#warnings()} and logged at
 * WARN, so a malformed hotkey degrades to a partial spec instead of failing configuration load.
 *
 * <p>{@link #format(HotkeySpec)} emits modifiers in the order {@code ctrl, alt, shift, meta}
 * followed by the main key. {@code parse(format(parse(s)))} always equals {@code parse(s)}.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class HotkeyParser {

    private static final Logger LOG = LogManager.getLogger(HotkeyParser.class);

    private static final String SEPARATOR = "+";
    private static final Key PLUS = Key.of("+");
    private static final int MAX_LOGGED_TOKEN = 32;

    private HotkeyParser() {}

    /**
     * Parses a hotkey string. Blank or null input yields {@link HotkeySpec#EMPTY}.
     */
    public static HotkeyParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return new HotkeyParseResult(HotkeySpec.EMPTY, List.of());
        }
        String body = text.trim().toLowerCase(Locale.ROOT);
        Key trailingPlus = null;
        if (body.equals(SEPARATOR)) {
            trailingPlus = PLUS;
            body = "";
        } else if (body.endsWith("++")) {
            trailingPlus = PLUS;
            body = body.substring(0, body.length() - 2);
        }

        Set<ModifierKey> modifiers = EnumSet.noneOf(ModifierKey.class);
        Key mainKey = null;
        List<String> warnings = new ArrayList<>();

        if (!body.isEmpty()) {
            for (String raw : body.split("\\+", -1)) {
                String token = raw.trim();
                if (token.isEmpty()) {
                    warnings.add("Empty key token");
                    continue;
                }
                Optional<ModifierKey> modifier = KeyNameMapper.modifierForToken(token);
                if (modifier.isPresent()) {
                    modifiers.add(modifier.get());
                    continue;
                }
                Key key = resolveKey(token);
                if (key == null) {
                    warnings.add("Unknown key token '" + LogSanitizer.sanitize(token, MAX_LOGGED_TOKEN) + "'");
                } else if (mainKey == null) {
                    mainKey = key;
                } else if (!mainKey.equals(key)) {
                    warnings.add("Extra main key '" + key + "' ignored; already have '" + mainKey + "'");
                }
            }
        }
        if (trailingPlus != null) {
            if (mainKey == null) {
                mainKey = trailingPlus;
            } else {
                warnings.add("Extra main key '+' ignored; already have '" + mainKey + "'");
            }
        }

        if (!warnings.isEmpty()) {
            LOG.warn("Hotkey '{}' parsed with warnings: {}",
                    LogSanitizer.sanitize(text, MAX_LOGGED_TOKEN * 2), warnings);
        }
        return new HotkeyParseResult(new HotkeySpec(modifiers, mainKey), warnings);
    }

    /** Convenience for callers that only need the spec. */
    public static HotkeySpec parseSpec(String text) {
        return parse(text).spec();
    }

    /**
     * Canonical text for a spec: {@code ctrl+alt+shift+meta+key}, lowercase. Empty spec → "".
     */
    public static String format(HotkeySpec spec) {
        if (spec == null || spec.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (ModifierKey m : ModifierKey.values()) {
            if (spec.modifiers().contains(m)) {
                joiner.add(m.token());
            }
        }
        if (spec.mainKey() != null) {
            joiner.add(spec.mainKey().name());
        }
        return joiner.toString();
    }

    /** Normalized form used as the registry's index key. */
    public static String normalize(String text) {
        return format(parseSpec(text));
    }

    /**
     * Display form for panels and menus: "Not Set" for an unassigned hotkey, otherwise the
     * canonical tokens capitalized ({@code "Ctrl+Shift+C"}).
     */
    public static String displayString(String text) {
        HotkeySpec spec = parseSpec(text);
        if (spec.isEmpty()) {
            return "Not Set";
        }
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (ModifierKey m : ModifierKey.values()) {
            if (spec.modifiers().contains(m)) {
                joiner.add(capitalize(m.token()));
            }
        }
        if (spec.mainKey() != null) {
            joiner.add(capitalize(spec.mainKey().name()));
        }
        return joiner.toString();
    }

    private static Key resolveKey(String token) {
        Optional<Key> named = KeyNameMapper.namedKey(token);
        if (named.isPresent()) {
            return named.get();
        }
        return KeyNameMapper.isLiteralKey(token) ? Key.of(token) : null;
    }

    private static String capitalize(String token) {
        if (token.codePointCount(0, token.length()) == 1) {
            return token.toUpperCase(Locale.ROOT);
        }
        return Character.toUpperCase(token.charAt(0)) + token.substring(1);
    }
}
