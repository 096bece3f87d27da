package com.phillippitts.shortcutengine.config;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import com.phillippitts.shortcutengine.service.hotkey.GlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.impl.JNativeHookGlobalKeyHook;
import com.phillippitts.shortcutengine.service.hotkey.impl.NoopGlobalKeyHook;
import com.phillippitts.shortcutengine.service.listener.MonotonicClock;
import com.phillippitts.shortcutengine.service.registry.ShortcutConfigStore;
import com.phillippitts.shortcutengine.service.registry.ShortcutRegistry;
import com.phillippitts.shortcutengine.service.util.ShortcutStateLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shortcut engine's collaborators.
 *
 * <p>Tests replace the {@link GlobalKeyHook} or {@link MonotonicClock} with {@code @Primary} fakes.
 */
@Configuration
public class ShortcutEngineConfig {

    private static final Logger LOG = LogManager.getLogger(ShortcutEngineConfig.class);

    @Bean
    public ShortcutStateLock shortcutStateLock() {
        return new ShortcutStateLock();
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    @Bean
    public GlobalKeyHook globalKeyHook(ShortcutProperties props) {
        if (!props.isNativeHookEnabled()) {
            LOG.info("Native key hook disabled (shortcuts.native-hook-enabled=false)");
            return new NoopGlobalKeyHook();
        }
        return new JNativeHookGlobalKeyHook();
    }

    @Bean
    public ShortcutConfigStore shortcutConfigStore(ShortcutProperties props) {
        return new ShortcutConfigStore(props.getConfigPath());
    }

    @Bean
    public ShortcutRegistry shortcutRegistry(ShortcutConfigStore store, ShortcutStateLock lock) {
        return new ShortcutRegistry(store, lock);
    }
}
