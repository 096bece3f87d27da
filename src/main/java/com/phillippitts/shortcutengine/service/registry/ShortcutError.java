package com.phillippitts.shortcutengine.service.registry;

/**
 * Why a registry write was refused.
 *
 * @param reason failure category
 * @param shortcutId id the caller tried to change
 * @param conflictingId for {@link Reason#CONFLICT}, the enabled shortcut that owns the hotkey
 * @param conflictingName display name of that shortcut, for one-click resolution prompts
 * @param message human-readable summary
 */
public record ShortcutError(Reason reason,
                            String shortcutId,
                            String conflictingId,
                            String conflictingName,
                            String message) {

    public enum Reason {
        NOT_FOUND,
        DUPLICATE_ID,
        CONFLICT
    }

    static ShortcutError notFound(String id) {
        return new ShortcutError(Reason.NOT_FOUND, id, null, null, "Shortcut '" + id + "' not found");
    }

    static ShortcutError duplicateId(String id) {
        return new ShortcutError(Reason.DUPLICATE_ID, id, null, null,
                "Shortcut ID '" + id + "' already exists");
    }

    static ShortcutError conflict(String id, String conflictingId, String conflictingName, String hotkey) {
        return new ShortcutError(Reason.CONFLICT, id, conflictingId, conflictingName,
                "Conflicts with '" + conflictingName + "' (" + hotkey + ")");
    }
}
