package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.domain.HotkeySpec;

import java.util.List;

/**
 * Parsed hotkey together with the tokens the parser had to drop.
 *
 * @param spec normalized spec (possibly partial)
 * @param warnings one human-readable entry per dropped token, in input order
 */
public record HotkeyParseResult(HotkeySpec spec, List<String> warnings) {

    public HotkeyParseResult {
        spec = spec == null ? HotkeySpec.EMPTY : spec;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
