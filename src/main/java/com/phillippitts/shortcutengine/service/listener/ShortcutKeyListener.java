package com.phillippitts.shortcutengine.service.listener;

import com.phillippitts.shortcutengine.config.hotkey.ModifierMatchMode;
import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.domain.ModifierKey;
import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyMatcher;
import com.phillippitts.shortcutengine.service.hotkey.KeyNameMapper;
import com.phillippitts.shortcutengine.service.hotkey.NormalizedKeyEvent;
import com.phillippitts.shortcutengine.service.registry.ShortcutBinding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Turns the raw key stream of a {@link GlobalKeyHook} into shortcut triggers.
 *
 * <p>Per event:
 * <ul>
 *   <li>modifier down/up: add to / remove from the set of held physical modifiers</li>
 *   <li>non-modifier down: test every enabled binding in registry order; each match that is
 *       outside its debounce window is passed to the trigger callback</li>
 *   <li>non-modifier up: ignored</li>
 * </ul>
 *
 * <p>Events are handled one at a time under an event lock. {@link #stop()} takes the same lock,
 * so it returns only after the event in progress (including its handlers) has finished.
 * Held modifiers are cleared on start and stop; the debounce ledger is kept.
 */
public class ShortcutKeyListener {

    private static final Logger LOG = LogManager.getLogger(ShortcutKeyListener.class);

    private final GlobalKeyHook hook;
    private final Supplier<List<ShortcutBinding>> bindings;
    private final Consumer<String> trigger;
    private final MonotonicClock clock;
    private final ModifierMatchMode matchMode;
    private final DebounceLedger debounce;

    private final ReentrantLock eventLock = new ReentrantLock();
    private final Set<Key> heldModifiers = new HashSet<>();
    private volatile boolean running;

    public ShortcutKeyListener(GlobalKeyHook hook,
                               Supplier<List<ShortcutBinding>> bindings,
                               Consumer<String> trigger,
                               MonotonicClock clock,
                               long debounceMillis,
                               ModifierMatchMode matchMode) {
        this.hook = hook;
        this.bindings = bindings;
        this.trigger = trigger;
        this.clock = clock;
        this.matchMode = matchMode == null ? ModifierMatchMode.ANY : matchMode;
        this.debounce = new DebounceLedger(debounceMillis);
    }

    /**
     * Subscribes to the hook and registers it. Idempotent.
     *
     * @throws SecurityException if the OS refuses the hook; the listener stays stopped
     */
    public void start() {
        eventLock.lock();
        try {
            if (running) {
                return;
            }
            heldModifiers.clear();
            hook.addListener(this::onKeyEvent);
            hook.register();
            running = true;
        } finally {
            eventLock.unlock();
        }
        LOG.info("Shortcut key listener started (debounce={}ms, modifierMatch={})",
                debounce.windowMillis(), matchMode);
    }

    /**
     * Stops delivering triggers and unregisters the hook. Waits for the event in progress. Idempotent.
     */
    public void stop() {
        eventLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            heldModifiers.clear();
        } finally {
            eventLock.unlock();
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.warn("Failed to unregister global key hook: {}", e.toString());
        }
        LOG.info("Shortcut key listener stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Entry point for hook events. Package-private callers and tests may invoke it directly.
     */
    void onKeyEvent(NormalizedKeyEvent event) {
        eventLock.lock();
        try {
            if (!running) {
                return;
            }
            Key key = event.key();
            if (KeyNameMapper.isModifier(key)) {
                if (event.type() == NormalizedKeyEvent.Type.PRESSED) {
                    heldModifiers.add(key);
                } else {
                    heldModifiers.remove(key);
                }
                return;
            }
            if (event.type() == NormalizedKeyEvent.Type.PRESSED) {
                dispatch(key);
            }
        } finally {
            eventLock.unlock();
        }
    }

    private void dispatch(Key key) {
        Set<ModifierKey> active = KeyNameMapper.logicalModifiers(heldModifiers);
        long now = clock.millis();
        for (ShortcutBinding binding : bindings.get()) {
            if (!HotkeyMatcher.matches(key, active, binding.spec(), matchMode)) {
                continue;
            }
            if (!debounce.tryAcquire(binding.shortcutId(), now)) {
                LOG.debug("Shortcut '{}' debounced", binding.shortcutId());
                continue;
            }
            LOG.debug("Shortcut '{}' matched {}", binding.shortcutId(), binding.hotkey());
            try {
                trigger.accept(binding.shortcutId());
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable t) {
                LOG.error("Trigger for shortcut '{}' failed", binding.shortcutId(), t);
            }
        }
    }

    // Package-private for tests
    Set<Key> heldModifiers() {
        eventLock.lock();
        try {
            return Set.copyOf(heldModifiers);
        } finally {
            eventLock.unlock();
        }
    }
}
