package com.phillippitts.shortcutengine.config.properties;

import com.phillippitts.shortcutengine.config.hotkey.ModifierMatchMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.List;

/**
 * Typed properties for the shortcut engine ({@code shortcuts.*}).
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "shortcuts")
public class ShortcutProperties {

    static final String DEFAULT_CONFIG_FILE =
            System.getProperty("user.home") + "/.shortcut-engine/shortcuts_config.json";

    /** JSON file holding the shortcut groups. */
    @NotBlank
    private final String configFile;

    /** Minimum interval between two triggers of the same shortcut (ms). */
    @Min(0)
    @Max(5000)
    private final long debounceMs;

    /** Start the keyboard listener when the application context starts. */
    private final boolean listenerAutoStart;

    /** Use JNativeHook; when false a no-op hook is installed (headless/CI). */
    private final boolean nativeHookEnabled;

    /** Modifier comparison rule for matching. */
    @NotNull
    private final ModifierMatchMode modifierMatch;

    /** Reserved OS shortcuts to flag as conflicts (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public ShortcutProperties(String configFile,
                              Long debounceMs,
                              Boolean listenerAutoStart,
                              Boolean nativeHookEnabled,
                              ModifierMatchMode modifierMatch,
                              List<String> reserved) {
        this.configFile = (configFile == null || configFile.isBlank()) ? DEFAULT_CONFIG_FILE : configFile;
        this.debounceMs = debounceMs == null ? 200L : debounceMs;
        this.listenerAutoStart = listenerAutoStart == null || listenerAutoStart;
        this.nativeHookEnabled = nativeHookEnabled == null || nativeHookEnabled;
        this.modifierMatch = modifierMatch == null ? ModifierMatchMode.ANY : modifierMatch;
        this.reserved = reserved == null
                ? List.of("META+TAB", "META+L")
                : List.copyOf(reserved);
    }

    public String getConfigFile() {
        return configFile;
    }

    public Path getConfigPath() {
        return Path.of(configFile);
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public boolean isListenerAutoStart() {
        return listenerAutoStart;
    }

    public boolean isNativeHookEnabled() {
        return nativeHookEnabled;
    }

    public ModifierMatchMode getModifierMatch() {
        return modifierMatch;
    }

    public List<String> getReserved() {
        return reserved;
    }
}
