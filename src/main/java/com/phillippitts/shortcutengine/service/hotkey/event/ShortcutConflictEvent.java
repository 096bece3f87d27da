package com.phillippitts.shortcutengine.service.hotkey.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Published after a load or reload finds enabled shortcuts sharing a hotkey,
 * which only happens with hand-edited or imported configuration.
 *
 * @param conflicts normalized hotkey → ids of the enabled shortcuts claiming it
 */
public record ShortcutConflictEvent(Map<String, List<String>> conflicts, Instant at) {

    public ShortcutConflictEvent {
        conflicts = Map.copyOf(conflicts);
    }
}
