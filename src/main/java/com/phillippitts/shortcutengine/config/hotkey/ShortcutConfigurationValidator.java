package com.phillippitts.shortcutengine.config.hotkey;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyParseResult;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyParser;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Validates ShortcutProperties at startup to fail fast with actionable messages.
 */
@Component
class ShortcutConfigurationValidator {

    private final ShortcutProperties props;

    ShortcutConfigurationValidator(ShortcutProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        try {
            Path.of(props.getConfigFile());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid shortcuts.config-file: '" + props.getConfigFile()
                    + "'. " + e.getReason(), e);
        }
        if (props.getDebounceMs() < 0 || props.getDebounceMs() > 5000) {
            throw new IllegalArgumentException(
                    "shortcuts.debounce-ms must be between 0 and 5000 milliseconds, got: " + props.getDebounceMs());
        }
        for (String reserved : props.getReserved()) {
            HotkeyParseResult parsed = HotkeyParser.parse(reserved);
            if (!parsed.spec().hasMainKey() || !parsed.isClean()) {
                throw new IllegalArgumentException("Invalid shortcuts.reserved entry: '" + reserved
                        + "'. Expected modifiers and one key joined by '+', e.g. META+TAB.");
            }
        }
    }
}
