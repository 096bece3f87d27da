package com.phillippitts.shortcutengine.service.integration;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.shortcutengine.service.hotkey.event.ShortcutConflictEvent;
import com.phillippitts.shortcutengine.service.metrics.ShortcutMetrics;
import com.phillippitts.shortcutengine.service.registry.ShortcutConfigStore;
import com.phillippitts.shortcutengine.service.registry.ShortcutRegistry;
import com.phillippitts.shortcutengine.service.util.ShortcutStateLock;
import com.phillippitts.shortcutengine.testutil.EventCapturingPublisher;
import com.phillippitts.shortcutengine.testutil.FakeClock;
import com.phillippitts.shortcutengine.testutil.FakeGlobalKeyHook;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ShortcutsIntegratorTest {

    @TempDir
    Path tmp;

    private Path configFile;
    private FakeGlobalKeyHook hook;
    private FakeClock clock;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        configFile = tmp.resolve("shortcuts_config.json");
        hook = new FakeGlobalKeyHook();
        clock = new FakeClock();
        publisher = new EventCapturingPublisher();
        meters = new SimpleMeterRegistry();
    }

    private ShortcutsIntegrator integrator(List<String> reserved) {
        ShortcutProperties props = new ShortcutProperties(configFile.toString(), 200L, true, false, null, reserved);
        ShortcutStateLock lock = new ShortcutStateLock();
        ShortcutRegistry registry = new ShortcutRegistry(new ShortcutConfigStore(configFile), lock);
        return new ShortcutsIntegrator(registry, lock, hook, clock, props, publisher, new ShortcutMetrics(meters));
    }

    @Test
    void pauseKeyTogglesRecordingWithDefaultConfig() {
        ShortcutsIntegrator integrator = integrator(null);
        AtomicInteger toggles = new AtomicInteger();
        integrator.registerActionHandler("record_toggle", toggles::incrementAndGet);

        integrator.start();
        hook.tap("pause");
        clock.advance(50);
        hook.tap("pause");
        clock.advance(250);
        hook.tap("pause");

        assertThat(toggles).hasValue(2);
        assertThat(meters.get("shortcuts.trigger").tag("id", "record_toggle").tag("source", "keyboard")
                .counter().count()).isEqualTo(2.0);
        integrator.stop();
        assertThat(integrator.isKeyboardListenerRunning()).isFalse();
    }

    @Test
    void ctrlShiftCCopiesLastTranscription() {
        ShortcutsIntegrator integrator = integrator(null);
        List<String> calls = new CopyOnWriteArrayList<>();
        integrator.registerActionHandler("copy_last", () -> calls.add("copy"));
        integrator.registerActionHandler("show_history", () -> calls.add("history"));
        integrator.start();

        hook.press("left_ctrl");
        hook.press("left_shift");
        hook.tap("c");
        hook.release("left_shift");
        clock.advance(300);
        hook.tap("h");

        assertThat(calls).containsExactly("copy", "history");
    }

    @Test
    void reloadKeepsHandlers() throws IOException {
        ShortcutsIntegrator integrator = integrator(null);
        AtomicInteger toggles = new AtomicInteger();
        integrator.registerActionHandler("record_toggle", toggles::incrementAndGet);
        integrator.start();

        Files.writeString(configFile, """
                {"recording": [{"id": "record_toggle", "name": "Toggle Recording", "hotkey": "f9", "enabled": true}]}
                """, StandardCharsets.UTF_8);
        integrator.reloadShortcuts();
        hook.tap("pause");
        hook.tap("f9");

        assertThat(toggles).hasValue(1);
        assertThat(integrator.getShortcutHotkey("record_toggle")).contains("f9");
    }

    @Test
    void triggerByIdReportsWhetherHandlersExist() {
        ShortcutsIntegrator integrator = integrator(null);
        integrator.initialize();
        AtomicInteger calls = new AtomicInteger();
        integrator.registerActionHandler("show_settings", calls::incrementAndGet);

        assertThat(integrator.triggerById("show_settings")).isTrue();
        assertThat(integrator.triggerById("show_settings")).isTrue();
        assertThat(integrator.triggerById("clear_history")).isFalse();
        assertThat(calls).hasValue(2);
        assertThat(meters.get("shortcuts.trigger").tag("source", "manual").tag("id", "show_settings")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void triggerByIdIgnoresUnknownIdsWithoutRecordingMetrics() {
        ShortcutsIntegrator integrator = integrator(null);
        integrator.initialize();
        AtomicInteger calls = new AtomicInteger();
        integrator.registerActionHandler("not_a_shortcut", calls::incrementAndGet);

        assertThat(integrator.triggerById("not_a_shortcut")).isFalse();
        assertThat(integrator.triggerById("also_missing")).isFalse();

        assertThat(calls).hasValue(0);
        assertThat(meters.find("shortcuts.trigger").tag("id", "not_a_shortcut").counter()).isNull();
        assertThat(meters.find("shortcuts.trigger").tag("id", "also_missing").counter()).isNull();
    }

    @Test
    void handlerFailuresAreCounted() {
        ShortcutsIntegrator integrator = integrator(null);
        integrator.initialize();
        integrator.registerActionHandler("show_history", () -> {
            throw new IllegalStateException("panel missing");
        });

        assertThat(integrator.triggerById("show_history")).isTrue();

        assertThat(meters.get("shortcuts.handler.failure").tag("id", "show_history").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void removedHandlerIsNoLongerCalled() {
        ShortcutsIntegrator integrator = integrator(null);
        AtomicInteger calls = new AtomicInteger();
        Runnable handler = calls::incrementAndGet;
        integrator.registerActionHandler("show_history", handler);

        assertThat(integrator.removeActionHandler("show_history", handler)).isTrue();
        assertThat(integrator.triggerById("show_history")).isFalse();
        assertThat(calls).hasValue(0);
    }

    @Test
    void latentConflictsArePublishedOnStart() throws IOException {
        Files.writeString(configFile, """
                {"application": [
                  {"id": "a", "name": "A", "hotkey": "ctrl+q", "enabled": true},
                  {"id": "b", "name": "B", "hotkey": "ctrl+q", "enabled": true}
                ]}
                """, StandardCharsets.UTF_8);
        ShortcutsIntegrator integrator = integrator(null);

        integrator.start();

        assertThat(publisher.eventsOfType(ShortcutConflictEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.conflicts()).containsEntry("ctrl+q", List.of("a", "b")));
    }

    @Test
    void reservedCombinationIsFlagged() {
        ShortcutsIntegrator integrator = integrator(List.of("CTRL+H"));

        integrator.start();

        assertThat(publisher.eventsOfType(HotkeyConflictEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.shortcutId()).isEqualTo("show_history");
                    assertThat(e.reserved()).isEqualTo("CTRL+H");
                });
    }

    @Test
    void refusedHookPublishesPermissionDeniedAndKeepsManualTriggers() {
        hook.denyPermission();
        ShortcutsIntegrator integrator = integrator(null);
        AtomicInteger calls = new AtomicInteger();
        integrator.registerActionHandler("record_toggle", calls::incrementAndGet);

        integrator.start();

        assertThat(integrator.isRunning()).isTrue();
        assertThat(integrator.isKeyboardListenerRunning()).isFalse();
        assertThat(publisher.eventsOfType(HotkeyPermissionDeniedEvent.class)).hasSize(1);
        assertThat(integrator.triggerById("record_toggle")).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void facadeDelegatesToRegistry() {
        ShortcutsIntegrator integrator = integrator(null);
        integrator.initialize();

        assertThat(integrator.isShortcutEnabled("copy_last")).isTrue();
        assertThat(integrator.isShortcutEnabled("missing")).isFalse();
        assertThat(integrator.getShortcutHotkey("missing")).isEmpty();
        assertThat(integrator.setShortcutHotkey("record_toggle", "ctrl+h").isConflict()).isTrue();
        assertThat(integrator.setShortcutEnabled("exit_app", true).isOk()).isTrue();
        assertThat(integrator.getShortcutsByGroup("navigation")).hasSize(2);
        assertThat(integrator.getAllShortcuts()).hasSize(17);
        assertThat(integrator.detectAllConflicts()).isEmpty();
    }

    @Test
    void handlerMayRebindItsOwnShortcut() {
        ShortcutsIntegrator integrator = integrator(null);
        integrator.registerActionHandler("record_toggle", () -> integrator.setShortcutHotkey("record_toggle", "f10"));
        integrator.start();

        hook.tap("pause");

        assertThat(integrator.getShortcutHotkey("record_toggle")).contains("f10");
    }
}
