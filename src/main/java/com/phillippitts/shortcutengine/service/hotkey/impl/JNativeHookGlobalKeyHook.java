package com.phillippitts.shortcutengine.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.KeyNameMapper;
import com.phillippitts.shortcutengine.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * Production GlobalKeyHook backed by JNativeHook.
 * Converts NativeKeyEvent into NormalizedKeyEvent for the shortcut listener.
 *
 * <p>Events are delivered on JNativeHook's dispatch thread, one at a time. Keys outside the
 * lookup table below are dropped; they cannot be named in a hotkey anyway.
 */
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private static final Map<Integer, Key> KEYS = buildKeyTable();

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Override
    public void register() {
        if (registered.get()) {
            return;
        }
        try {
            java.util.logging.Logger nativeLogger = java.util.logging.Logger
                    .getLogger(GlobalScreen.class.getPackage().getName());
            nativeLogger.setLevel(Level.WARNING);
            nativeLogger.setUseParentHandlers(false);

            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            registered.set(true);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | LinkageError e) {
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.get()) {
            return;
        }
        try {
            GlobalScreen.removeNativeKeyListener(this);
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook", e);
        } finally {
            registered.set(false);
        }
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) { /* ignore */ }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        Key key = toKey(ne.getKeyCode(), ne.getKeyLocation());
        if (key == null) {
            return;
        }
        NormalizedKeyEvent e = new NormalizedKeyEvent(type, key);
        try {
            l.accept(e);
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable t) {
            LOG.warn("Listener error for {}: {}", e, t.toString());
        }
    }

    /** Package-private for tests. */
    static Key toKey(int keyCode, int location) {
        boolean right = location == NativeKeyEvent.KEY_LOCATION_RIGHT;
        boolean left = location == NativeKeyEvent.KEY_LOCATION_LEFT;
        switch (keyCode) {
            case NativeKeyEvent.VC_CONTROL:
                return right ? KeyNameMapper.RIGHT_CTRL : left ? KeyNameMapper.LEFT_CTRL : Key.of("ctrl");
            case NativeKeyEvent.VC_ALT:
                return right ? KeyNameMapper.RIGHT_ALT : left ? KeyNameMapper.LEFT_ALT : Key.of("alt");
            case NativeKeyEvent.VC_SHIFT:
                return right ? KeyNameMapper.RIGHT_SHIFT : left ? KeyNameMapper.LEFT_SHIFT : Key.of("shift");
            case NativeKeyEvent.VC_META:
                return right ? KeyNameMapper.RIGHT_META : left ? KeyNameMapper.LEFT_META : Key.of("meta");
            default:
                return KEYS.get(keyCode);
        }
    }

    private static Map<Integer, Key> buildKeyTable() {
        Map<Integer, Key> m = new HashMap<>();
        int[] fn = {
            NativeKeyEvent.VC_F1, NativeKeyEvent.VC_F2, NativeKeyEvent.VC_F3, NativeKeyEvent.VC_F4,
            NativeKeyEvent.VC_F5, NativeKeyEvent.VC_F6, NativeKeyEvent.VC_F7, NativeKeyEvent.VC_F8,
            NativeKeyEvent.VC_F9, NativeKeyEvent.VC_F10, NativeKeyEvent.VC_F11, NativeKeyEvent.VC_F12,
            NativeKeyEvent.VC_F13, NativeKeyEvent.VC_F14, NativeKeyEvent.VC_F15, NativeKeyEvent.VC_F16,
            NativeKeyEvent.VC_F17, NativeKeyEvent.VC_F18, NativeKeyEvent.VC_F19, NativeKeyEvent.VC_F20,
            NativeKeyEvent.VC_F21, NativeKeyEvent.VC_F22, NativeKeyEvent.VC_F23, NativeKeyEvent.VC_F24
        };
        for (int i = 0; i < fn.length; i++) {
            m.put(fn[i], Key.of("f" + (i + 1)));
        }
        int[] letters = {
            NativeKeyEvent.VC_A, NativeKeyEvent.VC_B, NativeKeyEvent.VC_C, NativeKeyEvent.VC_D,
            NativeKeyEvent.VC_E, NativeKeyEvent.VC_F, NativeKeyEvent.VC_G, NativeKeyEvent.VC_H,
            NativeKeyEvent.VC_I, NativeKeyEvent.VC_J, NativeKeyEvent.VC_K, NativeKeyEvent.VC_L,
            NativeKeyEvent.VC_M, NativeKeyEvent.VC_N, NativeKeyEvent.VC_O, NativeKeyEvent.VC_P,
            NativeKeyEvent.VC_Q, NativeKeyEvent.VC_R, NativeKeyEvent.VC_S, NativeKeyEvent.VC_T,
            NativeKeyEvent.VC_U, NativeKeyEvent.VC_V, NativeKeyEvent.VC_W, NativeKeyEvent.VC_X,
            NativeKeyEvent.VC_Y, NativeKeyEvent.VC_Z
        };
        for (int i = 0; i < letters.length; i++) {
            m.put(letters[i], Key.of(String.valueOf((char) ('a' + i))));
        }
        int[] digits = {
            NativeKeyEvent.VC_0, NativeKeyEvent.VC_1, NativeKeyEvent.VC_2, NativeKeyEvent.VC_3,
            NativeKeyEvent.VC_4, NativeKeyEvent.VC_5, NativeKeyEvent.VC_6, NativeKeyEvent.VC_7,
            NativeKeyEvent.VC_8, NativeKeyEvent.VC_9
        };
        for (int i = 0; i < digits.length; i++) {
            m.put(digits[i], Key.of(String.valueOf(i)));
        }
        m.put(NativeKeyEvent.VC_PAUSE, Key.of("pause"));
        m.put(NativeKeyEvent.VC_INSERT, Key.of("insert"));
        m.put(NativeKeyEvent.VC_HOME, Key.of("home"));
        m.put(NativeKeyEvent.VC_END, Key.of("end"));
        m.put(NativeKeyEvent.VC_PAGE_UP, Key.of("pageup"));
        m.put(NativeKeyEvent.VC_PAGE_DOWN, Key.of("pagedown"));
        m.put(NativeKeyEvent.VC_SPACE, Key.of("space"));
        m.put(NativeKeyEvent.VC_ENTER, Key.of("enter"));
        m.put(NativeKeyEvent.VC_TAB, Key.of("tab"));
        m.put(NativeKeyEvent.VC_BACKSPACE, Key.of("backspace"));
        m.put(NativeKeyEvent.VC_DELETE, Key.of("delete"));
        m.put(NativeKeyEvent.VC_ESCAPE, Key.of("escape"));
        m.put(NativeKeyEvent.VC_UP, Key.of("up"));
        m.put(NativeKeyEvent.VC_DOWN, Key.of("down"));
        m.put(NativeKeyEvent.VC_LEFT, Key.of("left"));
        m.put(NativeKeyEvent.VC_RIGHT, Key.of("right"));
        m.put(NativeKeyEvent.VC_COMMA, Key.of(","));
        m.put(NativeKeyEvent.VC_PERIOD, Key.of("."));
        m.put(NativeKeyEvent.VC_SLASH, Key.of("/"));
        m.put(NativeKeyEvent.VC_SEMICOLON, Key.of(";"));
        m.put(NativeKeyEvent.VC_QUOTE, Key.of("'"));
        m.put(NativeKeyEvent.VC_BACKQUOTE, Key.of("`"));
        m.put(NativeKeyEvent.VC_MINUS, Key.of("-"));
        m.put(NativeKeyEvent.VC_EQUALS, Key.of("="));
        m.put(NativeKeyEvent.VC_OPEN_BRACKET, Key.of("["));
        m.put(NativeKeyEvent.VC_CLOSE_BRACKET, Key.of("]"));
        m.put(NativeKeyEvent.VC_BACK_SLASH, Key.of("\\"));
        return Map.copyOf(m);
    }
}
