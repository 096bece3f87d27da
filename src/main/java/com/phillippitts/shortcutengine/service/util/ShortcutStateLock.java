package com.phillippitts.shortcutengine.service.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single mutual-exclusion lock shared by the shortcut registry (shortcut map, group lists,
 * hotkey index) and the dispatch table (handler lists).
 *
 * <p>Both the UI/main thread and the key-hook thread reach those structures, so every public
 * read-modify-write runs inside {@link #locked(Supplier)} for its whole critical section.
 * The lock is reentrant: a handler running on the hook thread may call back into the registry.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * return lock.locked(() -> {
 *     Shortcut s = shortcuts.get(id);
 *     ...
 *     return RegistryResult.ok();
 * });
 * }</pre>
 *
 * @since 1.0
 */
public final class ShortcutStateLock {

    private final Lock lock = new ReentrantLock();

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void lockedRun(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
