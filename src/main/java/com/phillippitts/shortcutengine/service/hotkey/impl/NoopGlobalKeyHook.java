package com.phillippitts.shortcutengine.service.hotkey.impl;

import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Consumer;

/**
 * Hook used when {@code shortcuts.native-hook-enabled=false} (headless hosts, CI).
 * Never delivers events; shortcuts can still be fired through the integrator's trigger methods.
 */
public class NoopGlobalKeyHook implements GlobalKeyHook {

    private static final Logger LOG = LogManager.getLogger(NoopGlobalKeyHook.class);

    @Override
    public void register() {
        LOG.info("Native key hook disabled; keyboard shortcuts fire only via manual triggers");
    }

    @Override
    public void unregister() {
        // nothing registered
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        // events never arrive
    }
}
