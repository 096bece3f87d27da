package com.phillippitts.shortcutengine.service.registry;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ShortcutRegistry#importConfig}.
 *
 * @param success whether the file was read and applied
 * @param message summary for the caller to display
 * @param skippedIds incoming ids dropped in merge mode because the id already existed
 * @param conflicts conflict audit taken right after the import (normalized hotkey → ids)
 */
public record ImportResult(boolean success,
                           String message,
                           List<String> skippedIds,
                           Map<String, List<String>> conflicts) {

    public ImportResult {
        skippedIds = skippedIds == null ? List.of() : List.copyOf(skippedIds);
        conflicts = conflicts == null ? Map.of() : Map.copyOf(conflicts);
    }

    static ImportResult failure(String message) {
        return new ImportResult(false, message, List.of(), Map.of());
    }
}
