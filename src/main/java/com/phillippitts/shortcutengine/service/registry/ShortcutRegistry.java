package com.phillippitts.shortcutengine.service.registry;

import com.phillippitts.shortcutengine.domain.HotkeySpec;
import com.phillippitts.shortcutengine.domain.Shortcut;
import com.phillippitts.shortcutengine.exception.ShortcutConfigException;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyParser;
import com.phillippitts.shortcutengine.service.util.ShortcutStateLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative store of shortcuts, their groups and the hotkey index.
 *
 * <p>Write-time invariant: at most one <em>enabled</em> shortcut owns a given normalized hotkey.
 * {@link #setHotkey}, {@link #setEnabled} and {@link #addShortcut} refuse writes that would
 * break it and report the conflict in a {@link RegistryResult}. Files edited by hand can still
 * contain duplicates; those are loaded as-is and reported by {@link #detectAllConflicts()}.
 *
 * <p>The hotkey index maps normalized hotkey text ({@link HotkeyParser#normalize}) to the ids of
 * the enabled shortcuts using it, in registry order, and is rebuilt after every mutation. The
 * first id is the owner returned by {@link #getByHotkey}. Conflict checks are index lookups; the
 * other ids in an entry are latent duplicates from a hand-edited file.
 *
 * <p>Thread-safety: every public method runs under the shared {@link ShortcutStateLock}.
 * File I/O happens under the lock too, so callers must not invoke load/save/import/export from
 * the key-hook thread.
 */
public class ShortcutRegistry {

    private static final Logger LOG = LogManager.getLogger(ShortcutRegistry.class);

    private final ShortcutConfigStore store;
    private final ShortcutStateLock lock;

    // id -> shortcut, registry (insertion) order
    private final Map<String, Shortcut> shortcuts = new LinkedHashMap<>();
    // group -> ids, group order as loaded
    private final Map<String, List<String>> groups = new LinkedHashMap<>();
    // normalized hotkey -> enabled ids, registry order; first id owns the hotkey
    private final Map<String, List<String>> hotkeyIndex = new LinkedHashMap<>();
    private List<ShortcutBinding> bindings = List.of();

    public ShortcutRegistry(ShortcutConfigStore store, ShortcutStateLock lock) {
        this.store = store;
        this.lock = lock;
    }

    /**
     * Loads the configuration file. A missing or unreadable file falls back to
     * {@link DefaultShortcuts}; this method never throws.
     */
    public void load() {
        lock.lockedRun(() -> {
            Optional<Map<String, List<Shortcut>>> fromFile;
            try {
                fromFile = store.read();
            } catch (ShortcutConfigException e) {
                LOG.error("Failed to parse shortcuts config, using defaults: {}", e.getMessage());
                store.backupCorrupt().ifPresent(p -> LOG.warn("Corrupt shortcuts config moved to {}", p));
                replaceAll(DefaultShortcuts.groups());
                return;
            }
            if (fromFile.isEmpty()) {
                LOG.info("No shortcuts config found at {}, using defaults", store.getConfigFile());
                replaceAll(DefaultShortcuts.groups());
                return;
            }
            replaceAll(fromFile.get());
            LOG.info("Loaded {} shortcuts in {} groups from {}",
                    shortcuts.size(), groups.size(), store.getConfigFile());
        });
    }

    /**
     * Persists the current state. On failure the error is logged and memory stays authoritative.
     *
     * @return true if the file was written
     */
    public boolean save() {
        return lock.locked(() -> {
            try {
                store.write(snapshotGroups());
                LOG.debug("Saved {} shortcuts to {}", shortcuts.size(), store.getConfigFile());
                return true;
            } catch (ShortcutConfigException e) {
                LOG.error("Failed to save shortcuts: {}", e.getMessage(), e);
                return false;
            }
        });
    }

    public Optional<Shortcut> get(String id) {
        return lock.locked(() -> Optional.ofNullable(shortcuts.get(id)));
    }

    /** Looks up the enabled shortcut owning a hotkey. Input is normalized first. */
    public Optional<Shortcut> getByHotkey(String hotkeyText) {
        String key = HotkeyParser.normalize(hotkeyText);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return lock.locked(() -> {
            List<String> ids = hotkeyIndex.get(key);
            return ids == null ? Optional.<Shortcut>empty() : Optional.ofNullable(shortcuts.get(ids.get(0)));
        });
    }

    /** All shortcuts in registry order. */
    public List<Shortcut> getAll() {
        return lock.locked(() -> List.copyOf(shortcuts.values()));
    }

    /** Members of a group in group order; empty for unknown groups. */
    public List<Shortcut> getGroup(String group) {
        return lock.locked(() -> {
            List<String> ids = groups.getOrDefault(group, List.of());
            List<Shortcut> out = new ArrayList<>(ids.size());
            for (String id : ids) {
                Shortcut s = shortcuts.get(id);
                if (s != null) {
                    out.add(s);
                }
            }
            return List.copyOf(out);
        });
    }

    public List<String> getGroupNames() {
        return lock.locked(() -> List.copyOf(groups.keySet()));
    }

    /**
     * Assigns a hotkey. Blank text unassigns.
     *
     * @return NOT_FOUND for unknown ids, CONFLICT when another enabled shortcut owns the hotkey
     */
    public RegistryResult setHotkey(String id, String hotkeyText) {
        String text = hotkeyText == null ? "" : hotkeyText.trim();
        return lock.locked(() -> {
            Shortcut current = shortcuts.get(id);
            if (current == null) {
                return RegistryResult.failed(ShortcutError.notFound(id));
            }
            Optional<Shortcut> owner = findConflict(id, text);
            if (owner.isPresent()) {
                return conflict(id, owner.get());
            }
            shortcuts.put(id, current.withHotkey(text));
            rebuildIndex();
            LOG.info("Shortcut '{}' hotkey set to '{}'", id, text);
            return RegistryResult.ok();
        });
    }

    /**
     * Enables or disables a shortcut without touching its hotkey. Enabling into a hotkey that
     * another enabled shortcut owns fails with CONFLICT and leaves the shortcut disabled.
     */
    public RegistryResult setEnabled(String id, boolean enabled) {
        return lock.locked(() -> {
            Shortcut current = shortcuts.get(id);
            if (current == null) {
                return RegistryResult.failed(ShortcutError.notFound(id));
            }
            if (current.enabled() == enabled) {
                return RegistryResult.ok();
            }
            if (enabled) {
                Optional<Shortcut> owner = findConflict(id, current.hotkey());
                if (owner.isPresent()) {
                    return conflict(id, owner.get());
                }
            }
            shortcuts.put(id, current.withEnabled(enabled));
            rebuildIndex();
            LOG.info("Shortcut '{}' {}", id, enabled ? "enabled" : "disabled");
            return RegistryResult.ok();
        });
    }

    /**
     * Adds a shortcut to a group, creating the group if needed.
     *
     * @return DUPLICATE_ID if the id exists, CONFLICT if enabled and its hotkey is taken
     */
    public RegistryResult addShortcut(String group, Shortcut shortcut) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("group must not be blank");
        }
        return lock.locked(() -> {
            if (shortcuts.containsKey(shortcut.id())) {
                return RegistryResult.failed(ShortcutError.duplicateId(shortcut.id()));
            }
            if (shortcut.enabled()) {
                Optional<Shortcut> owner = findConflict(shortcut.id(), shortcut.hotkey());
                if (owner.isPresent()) {
                    return conflict(shortcut.id(), owner.get());
                }
            }
            shortcuts.put(shortcut.id(), shortcut.withGroup(group));
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(shortcut.id());
            rebuildIndex();
            LOG.info("Added shortcut '{}' to group '{}'", shortcut.id(), group);
            return RegistryResult.ok();
        });
    }

    /**
     * Removes a shortcut. A group left without members disappears.
     *
     * @return false if the id was unknown
     */
    public boolean removeShortcut(String id) {
        return lock.locked(() -> {
            Shortcut removed = shortcuts.remove(id);
            if (removed == null) {
                return false;
            }
            List<String> members = groups.get(removed.group());
            if (members != null) {
                members.remove(id);
                if (members.isEmpty()) {
                    groups.remove(removed.group());
                }
            }
            rebuildIndex();
            LOG.info("Removed shortcut '{}'", id);
            return true;
        });
    }

    /**
     * Audits enabled shortcuts with a hotkey and returns every normalized hotkey claimed by two
     * or more of them, ids in registry order.
     */
    public Map<String, List<String>> detectAllConflicts() {
        return lock.locked(() -> {
            Map<String, List<String>> conflicts = new LinkedHashMap<>();
            hotkeyIndex.forEach((key, ids) -> {
                if (ids.size() > 1) {
                    conflicts.put(key, List.copyOf(ids));
                }
            });
            return conflicts;
        });
    }

    /**
     * Writes the current groups to {@code path} inside the export envelope.
     *
     * @return true on success; failures are logged
     */
    public boolean exportConfig(Path path) {
        return lock.locked(() -> {
            try {
                store.writeExport(path, snapshotGroups(), Instant.now());
                LOG.info("Shortcuts configuration exported to {}", path);
                return true;
            } catch (ShortcutConfigException e) {
                LOG.error("Failed to export shortcuts: {}", e.getMessage(), e);
                return false;
            }
        });
    }

    /**
     * Imports an export file.
     *
     * <p>Replace mode discards the current state. Merge mode keeps every existing id; incoming
     * shortcuts whose id already exists are skipped and listed in {@link ImportResult#skippedIds()}.
     * New groups are appended after existing ones. A successful import is saved.
     */
    public ImportResult importConfig(Path path, boolean merge) {
        return lock.locked(() -> {
            Map<String, List<Shortcut>> incoming;
            try {
                incoming = store.readExport(path);
            } catch (ShortcutConfigException e) {
                LOG.warn("Import from {} failed: {}", path, e.getMessage());
                return ImportResult.failure(e.getMessage());
            }
            List<String> skipped = new ArrayList<>();
            if (merge) {
                Map<String, List<Shortcut>> merged = snapshotGroups();
                for (Map.Entry<String, List<Shortcut>> entry : incoming.entrySet()) {
                    for (Shortcut s : entry.getValue()) {
                        if (shortcuts.containsKey(s.id()) || containsId(merged, s.id())) {
                            skipped.add(s.id());
                        } else {
                            merged.computeIfAbsent(entry.getKey(), g -> new ArrayList<>()).add(s);
                        }
                    }
                }
                replaceAll(merged);
            } else {
                replaceAll(incoming);
            }
            if (!skipped.isEmpty()) {
                LOG.warn("Import kept existing shortcuts for ids {}", skipped);
            }
            save();
            Map<String, List<String>> conflicts = detectAllConflicts();
            String message = "Configuration imported successfully";
            if (!skipped.isEmpty()) {
                message += " (" + skipped.size() + " existing id(s) kept)";
            }
            return new ImportResult(true, message, skipped, conflicts);
        });
    }

    /** Restores the built-in defaults and saves them. */
    public void resetToDefaults() {
        lock.lockedRun(() -> {
            replaceAll(DefaultShortcuts.groups());
            save();
            LOG.info("Shortcuts reset to defaults");
        });
    }

    /**
     * Enabled shortcuts with a hotkey, paired with their parsed specs, in registry order.
     * Specs are parsed when the registry changes, not per key event.
     */
    public List<ShortcutBinding> enabledBindings() {
        return lock.locked(() -> bindings);
    }

    private void replaceAll(Map<String, List<Shortcut>> source) {
        shortcuts.clear();
        groups.clear();
        for (Map.Entry<String, List<Shortcut>> entry : source.entrySet()) {
            String group = entry.getKey();
            List<String> ids = groups.computeIfAbsent(group, g -> new ArrayList<>());
            for (Shortcut s : entry.getValue()) {
                if (shortcuts.containsKey(s.id())) {
                    LOG.warn("Duplicate shortcut id '{}' in group '{}' skipped", s.id(), group);
                    continue;
                }
                shortcuts.put(s.id(), s.withGroup(group));
                ids.add(s.id());
            }
        }
        rebuildIndex();
    }

    private void rebuildIndex() {
        hotkeyIndex.clear();
        List<ShortcutBinding> enabled = new ArrayList<>();
        for (Shortcut s : shortcuts.values()) {
            if (!s.enabled() || !s.hasHotkey()) {
                continue;
            }
            HotkeySpec spec = HotkeyParser.parseSpec(s.hotkey());
            String key = HotkeyParser.format(spec);
            if (key.isEmpty()) {
                continue;
            }
            hotkeyIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(s.id());
            enabled.add(new ShortcutBinding(s.id(), key, spec));
        }
        bindings = List.copyOf(enabled);
    }

    private Optional<Shortcut> findConflict(String id, String hotkeyText) {
        String key = HotkeyParser.normalize(hotkeyText);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        for (String owner : hotkeyIndex.getOrDefault(key, List.of())) {
            if (!owner.equals(id)) {
                return Optional.of(shortcuts.get(owner));
            }
        }
        return Optional.empty();
    }

    private RegistryResult conflict(String id, Shortcut owner) {
        LOG.info("Hotkey for '{}' conflicts with '{}' ({})", id, owner.id(), owner.hotkey());
        return RegistryResult.failed(ShortcutError.conflict(id, owner.id(), owner.name(), owner.hotkey()));
    }

    private Map<String, List<Shortcut>> snapshotGroups() {
        Map<String, List<Shortcut>> out = new LinkedHashMap<>();
        groups.forEach((group, ids) -> {
            List<Shortcut> members = new ArrayList<>(ids.size());
            for (String id : ids) {
                Shortcut s = shortcuts.get(id);
                if (s != null) {
                    members.add(s);
                }
            }
            out.put(group, members);
        });
        return out;
    }

    private static boolean containsId(Map<String, List<Shortcut>> groups, String id) {
        for (List<Shortcut> members : groups.values()) {
            for (Shortcut s : members) {
                if (s.id().equals(id)) {
                    return true;
                }
            }
        }
        return false;
    }
}
