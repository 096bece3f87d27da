package com.phillippitts.shortcutengine.testutil;

import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.NormalizedKeyEvent;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-memory GlobalKeyHook. Tests push key events with {@link #press(String)} / {@link #release(String)}.
 */
public class FakeGlobalKeyHook implements GlobalKeyHook {

    private final AtomicBoolean registered = new AtomicBoolean();
    private volatile Consumer<NormalizedKeyEvent> listener;
    private volatile boolean denyPermission;

    @Override
    public void register() {
        if (denyPermission) {
            throw new SecurityException("Accessibility permission not granted");
        }
        registered.set(true);
    }

    @Override
    public void unregister() {
        registered.set(false);
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    public boolean isRegistered() {
        return registered.get();
    }

    public void denyPermission() {
        this.denyPermission = true;
    }

    public void emit(NormalizedKeyEvent e) {
        Consumer<NormalizedKeyEvent> l = listener;
        if (l != null) {
            l.accept(e);
        }
    }

    public void press(String key) {
        emit(NormalizedKeyEvent.pressed(key));
    }

    public void release(String key) {
        emit(NormalizedKeyEvent.released(key));
    }

    /** Press and release a key. */
    public void tap(String key) {
        press(key);
        release(key);
    }
}
