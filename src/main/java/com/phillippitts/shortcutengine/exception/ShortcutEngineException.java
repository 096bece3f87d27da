package com.phillippitts.shortcutengine.exception;

/**
 * Base exception for all shortcut engine errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ShortcutEngineException extends RuntimeException {

    public ShortcutEngineException(String message) {
        super(message);
    }

    public ShortcutEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public ShortcutEngineException(Throwable cause) {
        super(cause);
    }
}
