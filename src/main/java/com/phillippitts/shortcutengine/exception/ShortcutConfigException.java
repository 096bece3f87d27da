package com.phillippitts.shortcutengine.exception;

import java.nio.file.Path;

/**
 * Thrown when shortcut configuration cannot be read or written (I/O failure, malformed JSON,
 * missing export envelope).
 */
public class ShortcutConfigException extends ShortcutEngineException {

    private final String path;

    public ShortcutConfigException(String message, Path path) {
        super(message + " (path: " + path + ")");
        this.path = String.valueOf(path);
    }

    public ShortcutConfigException(String message, Path path, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.path = String.valueOf(path);
    }

    public String getPath() {
        return path;
    }
}
