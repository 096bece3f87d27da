package com.phillippitts.shortcutengine.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (e.g., JNativeHook).
 *
 * Provides a test seam so unit tests can inject a fake implementation
 * and remain hermetic (no OS-level hooks required in CI).
 */
public interface GlobalKeyHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException when the OS refuses the hook (missing permission or native library)
     */
    void register();

    /** Unregister the global hook. Idempotent and safe to call from any thread. */
    void unregister();

    /**
     * Subscribe to normalized key events, replacing any previous subscriber.
     * Implementations deliver events one at a time on their own event thread.
     */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
