package com.phillippitts.shortcutengine.service.integration;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import com.phillippitts.shortcutengine.domain.Shortcut;
import com.phillippitts.shortcutengine.service.dispatch.DispatchOutcome;
import com.phillippitts.shortcutengine.service.dispatch.DispatchTable;
import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyParser;
import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.ShortcutConflictEvent;
import com.phillippitts.shortcutengine.service.listener.MonotonicClock;
import com.phillippitts.shortcutengine.service.listener.ShortcutKeyListener;
import com.phillippitts.shortcutengine.service.metrics.ShortcutMetrics;
import com.phillippitts.shortcutengine.service.registry.RegistryResult;
import com.phillippitts.shortcutengine.service.registry.ShortcutBinding;
import com.phillippitts.shortcutengine.service.registry.ShortcutRegistry;
import com.phillippitts.shortcutengine.service.util.ShortcutStateLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composition root of the shortcut engine: owns the dispatch table and the key listener and
 * fronts the registry for application code.
 *
 * <p>Application code binds behavior with {@link #registerActionHandler(String, Runnable)};
 * the listener calls {@link #trigger(String)} on the hook thread when a hotkey matches.
 * Handler registrations are keyed by shortcut id and survive {@link #reloadShortcuts()}.
 *
 * <p>Lifecycle: on context start the registry is loaded and audited (latent duplicates,
 * OS-reserved combinations), then the listener starts if {@code shortcuts.listener-auto-start}
 * is set. A refused OS hook publishes {@link HotkeyPermissionDeniedEvent} and leaves the app
 * running with manual triggers only.
 */
@Service
public class ShortcutsIntegrator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ShortcutsIntegrator.class);

    private final ShortcutRegistry registry;
    private final DispatchTable dispatch;
    private final ShortcutKeyListener listener;
    private final ShortcutProperties props;
    private final ApplicationEventPublisher publisher;
    private final ShortcutMetrics metrics;

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private volatile boolean running;

    public ShortcutsIntegrator(ShortcutRegistry registry,
                               ShortcutStateLock lock,
                               GlobalKeyHook hook,
                               MonotonicClock clock,
                               ShortcutProperties props,
                               ApplicationEventPublisher publisher,
                               ShortcutMetrics metrics) {
        this.registry = registry;
        this.props = props;
        this.publisher = publisher;
        this.metrics = metrics;
        this.dispatch = new DispatchTable(lock);
        this.listener = new ShortcutKeyListener(hook, registry::enabledBindings, this::trigger,
                clock, props.getDebounceMs(), props.getModifierMatch());
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        initialize();
        if (props.isListenerAutoStart()) {
            startKeyboardListener();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        stopKeyboardListener();
        running = false;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Loads the registry and audits it. Runs once; later calls are no-ops.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        registry.load();
        audit();
        LOG.info("Shortcuts integrator initialized with {} shortcuts", registry.getAll().size());
    }

    public void registerActionHandler(String shortcutId, Runnable handler) {
        dispatch.register(shortcutId, handler);
        LOG.debug("Registered handler for shortcut '{}'", shortcutId);
    }

    public boolean removeActionHandler(String shortcutId, Runnable handler) {
        return dispatch.remove(shortcutId, handler);
    }

    /**
     * Runs the handlers bound to {@code shortcutId} on the calling thread. Called by the key
     * listener; handler failures are logged and counted, never propagated.
     */
    public void trigger(String shortcutId) {
        dispatch(shortcutId, TriggerSource.KEYBOARD);
    }

    /**
     * Fires a shortcut programmatically (menu actions, REST, tests). Bypasses debounce.
     * Ids unknown to the registry are rejected before any handler or metric is touched.
     *
     * @return true if the shortcut exists and at least one handler was registered and invoked
     */
    public boolean triggerById(String shortcutId) {
        if (shortcutId == null || registry.get(shortcutId).isEmpty()) {
            LOG.warn("Ignoring trigger for unknown shortcut '{}'", shortcutId);
            return false;
        }
        return dispatch(shortcutId, TriggerSource.MANUAL).hadHandlers();
    }

    /**
     * Re-reads the configuration file. Handler registrations are kept; the listener sees the
     * new bindings on the next key event.
     */
    public void reloadShortcuts() {
        registry.load();
        initialized.set(true);
        audit();
        LOG.info("Shortcuts reloaded from configuration");
    }

    /**
     * Starts the key listener.
     *
     * @return false when the OS refused the hook
     */
    public boolean startKeyboardListener() {
        try {
            listener.start();
            return true;
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
            return false;
        }
    }

    public void stopKeyboardListener() {
        listener.stop();
    }

    public boolean isKeyboardListenerRunning() {
        return listener.isRunning();
    }

    public Optional<String> getShortcutHotkey(String shortcutId) {
        return registry.get(shortcutId).map(Shortcut::hotkey);
    }

    public boolean isShortcutEnabled(String shortcutId) {
        return registry.get(shortcutId).map(Shortcut::enabled).orElse(false);
    }

    public RegistryResult setShortcutHotkey(String shortcutId, String hotkeyText) {
        return registry.setHotkey(shortcutId, hotkeyText);
    }

    public RegistryResult setShortcutEnabled(String shortcutId, boolean enabled) {
        return registry.setEnabled(shortcutId, enabled);
    }

    public List<Shortcut> getAllShortcuts() {
        return registry.getAll();
    }

    public List<Shortcut> getShortcutsByGroup(String group) {
        return registry.getGroup(group);
    }

    public Map<String, List<String>> detectAllConflicts() {
        return registry.detectAllConflicts();
    }

    private DispatchOutcome dispatch(String shortcutId, TriggerSource source) {
        LOG.debug("Triggering shortcut '{}' ({})", shortcutId, source.tag());
        metrics.incrementTrigger(shortcutId, source.tag());
        DispatchOutcome outcome = dispatch.invoke(shortcutId);
        if (outcome.hadHandlers()) {
            metrics.recordHandlerLatency(shortcutId, outcome.durationNanos());
            metrics.incrementHandlerFailures(shortcutId, outcome.failures());
        }
        return outcome;
    }

    private void audit() {
        Map<String, List<String>> conflicts = registry.detectAllConflicts();
        if (!conflicts.isEmpty()) {
            LOG.warn("Shortcut configuration contains conflicting hotkeys: {}", conflicts);
            publisher.publishEvent(new ShortcutConflictEvent(conflicts, Instant.now()));
        }
        detectReservedConflicts();
    }

    private void detectReservedConflicts() {
        List<ShortcutBinding> bindings = registry.enabledBindings();
        for (String reserved : props.getReserved()) {
            String normalized = HotkeyParser.normalize(reserved);
            if (normalized.isEmpty()) {
                continue;
            }
            for (ShortcutBinding binding : bindings) {
                if (binding.hotkey().equals(normalized)) {
                    LOG.warn("Shortcut '{}' ({}) conflicts with reserved '{}'",
                            binding.shortcutId(), binding.hotkey(), reserved);
                    publisher.publishEvent(new HotkeyConflictEvent(binding.shortcutId(), binding.hotkey(),
                            reserved, Instant.now()));
                }
            }
        }
    }
}
