package com.phillippitts.shortcutengine.service.registry;

import java.util.Optional;

/**
 * Outcome of a registry write. Conflicts are reported here, never thrown.
 */
public final class RegistryResult {

    private static final RegistryResult OK = new RegistryResult(null);

    private final ShortcutError error;

    private RegistryResult(ShortcutError error) {
        this.error = error;
    }

    public static RegistryResult ok() {
        return OK;
    }

    public static RegistryResult failed(ShortcutError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new RegistryResult(error);
    }

    public boolean isOk() {
        return error == null;
    }

    public Optional<ShortcutError> error() {
        return Optional.ofNullable(error);
    }

    public boolean isConflict() {
        return error != null && error.reason() == ShortcutError.Reason.CONFLICT;
    }

    @Override
    public String toString() {
        return isOk() ? "RegistryResult[ok]" : "RegistryResult[" + error + "]";
    }
}
