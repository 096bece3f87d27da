package com.phillippitts.shortcutengine.service.integration;

import java.util.Locale;

/** What fired a shortcut. Used as a metric tag. */
public enum TriggerSource {
    KEYBOARD,
    MANUAL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
