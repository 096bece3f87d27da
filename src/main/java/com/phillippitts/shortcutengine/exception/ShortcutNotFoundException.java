package com.phillippitts.shortcutengine.exception;

/**
 * Thrown at the REST boundary when a request names a shortcut id the registry does not know.
 * The registry itself reports unknown ids as result values.
 */
public class ShortcutNotFoundException extends ShortcutEngineException {

    private final String shortcutId;

    public ShortcutNotFoundException(String shortcutId) {
        super("Shortcut not found: " + shortcutId);
        this.shortcutId = shortcutId;
    }

    public String getShortcutId() {
        return shortcutId;
    }
}
