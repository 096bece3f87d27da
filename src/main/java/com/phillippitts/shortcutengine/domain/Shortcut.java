package com.phillippitts.shortcutengine.domain;

/**
 * A named application action bound to an optional hotkey.
 *
 * <p>Instances are immutable; the registry replaces a record whenever its hotkey or
 * enablement changes. An empty {@code hotkey} means "unassigned".
 *
 * @param id stable identifier, unique across the registry
 * @param name display name
 * @param hotkey textual hotkey as entered by the user (may be empty)
 * @param description free text shown in the shortcuts panel
 * @param enabled whether the shortcut participates in matching and conflict checks
 * @param group category tag (display only)
 */
public record Shortcut(String id,
                       String name,
                       String hotkey,
                       String description,
                       boolean enabled,
                       String group) {

    public Shortcut {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("shortcut id must not be blank");
        }
        name = name == null ? id : name;
        hotkey = hotkey == null ? "" : hotkey.trim();
        description = description == null ? "" : description;
        group = group == null ? "" : group;
    }

    public boolean hasHotkey() {
        return !hotkey.isEmpty();
    }

    public Shortcut withHotkey(String newHotkey) {
        return new Shortcut(id, name, newHotkey, description, enabled, group);
    }

    public Shortcut withEnabled(boolean newEnabled) {
        return new Shortcut(id, name, hotkey, description, newEnabled, group);
    }

    public Shortcut withGroup(String newGroup) {
        return new Shortcut(id, name, hotkey, description, enabled, newGroup);
    }
}
