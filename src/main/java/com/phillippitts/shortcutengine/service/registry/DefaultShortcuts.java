package com.phillippitts.shortcutengine.service.registry;

import com.phillippitts.shortcutengine.domain.Shortcut;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in shortcut set, used when no configuration file exists or it cannot be read,
 * and by {@link ShortcutRegistry#resetToDefaults()}.
 */
public final class DefaultShortcuts {

    public static final String RECORDING = "recording";
    public static final String PLAYBACK = "playback";
    public static final String NAVIGATION = "navigation";
    public static final String HISTORY = "history";
    public static final String APPLICATION = "application";
    public static final String TEXT_PROCESSING = "text_processing";

    private static final Map<String, String> DISPLAY_NAMES = Map.of(
            RECORDING, "Recording Controls",
            PLAYBACK, "Playback Controls",
            NAVIGATION, "Navigation",
            HISTORY, "History Management",
            APPLICATION, "Application Control",
            TEXT_PROCESSING, "Text Processing"
    );

    private DefaultShortcuts() {}

    /**
     * Fresh copy of the defaults, grouped, in display order.
     */
    public static Map<String, List<Shortcut>> groups() {
        Map<String, List<Shortcut>> groups = new LinkedHashMap<>();
        group(groups, RECORDING,
                new Shortcut("record_toggle", "Toggle Recording", "pause",
                        "Start or stop recording", true, RECORDING),
                new Shortcut("record_start", "Start Recording", "",
                        "Start recording immediately", false, RECORDING),
                new Shortcut("record_stop", "Stop Recording", "",
                        "Stop recording and transcribe", false, RECORDING));
        group(groups, PLAYBACK,
                new Shortcut("play_pause", "Play/Pause", "",
                        "Play or pause playback", false, PLAYBACK));
        group(groups, NAVIGATION,
                new Shortcut("seek_forward", "Seek Forward", "",
                        "Seek forward in audio", false, NAVIGATION),
                new Shortcut("seek_backward", "Seek Backward", "",
                        "Seek backward in audio", false, NAVIGATION));
        group(groups, HISTORY,
                new Shortcut("copy_last", "Copy Last Transcription", "ctrl+shift+c",
                        "Copy the last transcription to clipboard", true, HISTORY),
                new Shortcut("show_history", "Show History", "ctrl+h",
                        "Show the history panel", true, HISTORY),
                new Shortcut("clear_history", "Clear History", "",
                        "Clear all transcription history", false, HISTORY));
        group(groups, APPLICATION,
                new Shortcut("toggle_app", "Toggle Application", "",
                        "Toggle the application on/off", false, APPLICATION),
                new Shortcut("show_settings", "Show Settings", "ctrl+,",
                        "Open the settings window", true, APPLICATION),
                new Shortcut("show_shortcuts", "Show Shortcuts", "ctrl+k",
                        "Open the shortcuts manager", true, APPLICATION),
                new Shortcut("toggle_privacy", "Toggle Privacy Mode", "ctrl+shift+p",
                        "Toggle privacy mode on/off", false, APPLICATION),
                new Shortcut("exit_app", "Exit Application", "ctrl+q",
                        "Exit the application", false, APPLICATION));
        group(groups, TEXT_PROCESSING,
                new Shortcut("show_dictionary", "Show Dictionary", "ctrl+d",
                        "Open the dictionary manager", false, TEXT_PROCESSING),
                new Shortcut("show_snippets", "Show Snippets", "ctrl+shift+s",
                        "Open the snippets manager", false, TEXT_PROCESSING),
                new Shortcut("show_text_processing", "Show Text Processing", "",
                        "Open text processing settings", false, TEXT_PROCESSING));
        return groups;
    }

    /** Human-readable group title; unknown groups display their own name. */
    public static String displayName(String group) {
        return DISPLAY_NAMES.getOrDefault(group, group);
    }

    private static void group(Map<String, List<Shortcut>> groups, String name, Shortcut... shortcuts) {
        List<Shortcut> list = new ArrayList<>(shortcuts.length);
        Collections.addAll(list, shortcuts);
        groups.put(name, list);
    }
}
