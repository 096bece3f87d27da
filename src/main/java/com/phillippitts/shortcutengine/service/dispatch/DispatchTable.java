package com.phillippitts.shortcutengine.service.dispatch;

import com.phillippitts.shortcutengine.service.util.ShortcutStateLock;
import com.phillippitts.shortcutengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps shortcut ids to the handlers bound to them.
 *
 * <p>Handlers for one id run in registration order, synchronously on the caller's thread.
 * A handler that throws (including {@link Error}s other than {@link VirtualMachineError}) is
 * logged with the shortcut id and does not prevent its siblings from running. Handler lists are guarded by the shared {@link ShortcutStateLock}; invocation
 * happens outside the lock on a snapshot, so a handler may register or remove handlers or
 * call into the registry.
 *
 * <p>Registrations are keyed by id only and survive registry reloads.
 */
public class DispatchTable {

    private static final Logger LOG = LogManager.getLogger(DispatchTable.class);

    static final String MDC_SHORTCUT_ID = "shortcutId";

    private final ShortcutStateLock lock;
    private final Map<String, List<Runnable>> handlers = new HashMap<>();

    public DispatchTable(ShortcutStateLock lock) {
        this.lock = lock;
    }

    /** Appends a handler for {@code shortcutId}. The same handler may be registered twice. */
    public void register(String shortcutId, Runnable handler) {
        if (shortcutId == null || shortcutId.isBlank()) {
            throw new IllegalArgumentException("shortcutId must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        lock.lockedRun(() -> handlers.computeIfAbsent(shortcutId, k -> new ArrayList<>()).add(handler));
    }

    /**
     * Removes the first registration of {@code handler} for {@code shortcutId}.
     *
     * @return true if a registration was removed
     */
    public boolean remove(String shortcutId, Runnable handler) {
        return lock.locked(() -> {
            List<Runnable> list = handlers.get(shortcutId);
            if (list == null || !list.remove(handler)) {
                return false;
            }
            if (list.isEmpty()) {
                handlers.remove(shortcutId);
            }
            return true;
        });
    }

    public int handlerCount(String shortcutId) {
        return lock.locked(() -> handlers.getOrDefault(shortcutId, List.of()).size());
    }

    /**
     * Calls every handler registered for {@code shortcutId}.
     * With no handlers a warning is logged and the outcome reports zero invocations.
     */
    public DispatchOutcome invoke(String shortcutId) {
        List<Runnable> snapshot = lock.locked(() -> List.copyOf(handlers.getOrDefault(shortcutId, List.of())));
        if (snapshot.isEmpty()) {
            LOG.warn("No handlers registered for shortcut '{}'", shortcutId);
            return new DispatchOutcome(shortcutId, 0, 0, 0L);
        }
        String previous = ThreadContext.get(MDC_SHORTCUT_ID);
        ThreadContext.put(MDC_SHORTCUT_ID, shortcutId);
        long start = System.nanoTime();
        int failures = 0;
        try {
            for (Runnable handler : snapshot) {
                try {
                    handler.run();
                } catch (VirtualMachineError fatal) {
                    throw fatal;
                } catch (Throwable t) { // include Errors and sneaky-thrown checked exceptions
                    failures++;
                    LOG.error("Handler for shortcut '{}' failed", shortcutId, t);
                }
            }
        } finally {
            if (previous == null) {
                ThreadContext.remove(MDC_SHORTCUT_ID);
            } else {
                ThreadContext.put(MDC_SHORTCUT_ID, previous);
            }
        }
        return new DispatchOutcome(shortcutId, snapshot.size(), failures, TimeUtils.elapsedNanos(start));
    }
}
