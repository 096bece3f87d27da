package com.phillippitts.shortcutengine.service.registry;

import com.phillippitts.shortcutengine.domain.Shortcut;
import com.phillippitts.shortcutengine.exception.ShortcutConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes shortcut groups as JSON.
 *
 * <p>Layout of the configuration file:
 * <pre>{@code
 * {
 *   "recording": [
 *     {"id": "record_toggle", "name": "Toggle Recording", "hotkey": "pause", "description": "...", "enabled": true}
 *   ]
 * }
 * }</pre>
 * Export files wrap the same object as {@code {"version": "1.0", "exported_at": "...", "shortcuts": {...}}}.
 *
 * <p>Files are read into Jackson's tree model, whose object nodes keep key order, so group order
 * survives a round trip. Writes are pretty-printed to a sibling temp file first and then moved
 * over the target.
 *
 * <p>All failures surface as {@link ShortcutConfigException}.
 */
public class ShortcutConfigStore {

    private static final Logger LOG = LogManager.getLogger(ShortcutConfigStore.class);

    static final String EXPORT_VERSION = "1.0";
    static final String KEY_VERSION = "version";
    static final String KEY_EXPORTED_AT = "exported_at";
    static final String KEY_SHORTCUTS = "shortcuts";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final Path configFile;

    public ShortcutConfigStore(Path configFile) {
        if (configFile == null) {
            throw new IllegalArgumentException("configFile must not be null");
        }
        this.configFile = configFile;
    }

    public Path getConfigFile() {
        return configFile;
    }

    /**
     * Reads the configuration file.
     *
     * @return groups in file order, or empty when the file does not exist
     * @throws ShortcutConfigException when the file cannot be read or is not a valid group object
     */
    public Optional<Map<String, List<Shortcut>>> read() {
        String text;
        try {
            text = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ShortcutConfigException("Failed to read shortcuts config", configFile, e);
        }
        return Optional.of(parseGroups(readObject(text, configFile), configFile));
    }

    /**
     * Writes groups to the configuration file, creating parent directories as needed.
     */
    public void write(Map<String, List<Shortcut>> groups) {
        writeAtomically(configFile, toJson(groupsNode(groups), configFile));
    }

    /**
     * Writes groups inside the export envelope.
     */
    public void writeExport(Path target, Map<String, List<Shortcut>> groups, Instant exportedAt) {
        String stamp = LocalDateTime.ofInstant(exportedAt, ZoneId.systemDefault()).toString();
        ObjectNode envelope = MAPPER.createObjectNode();
        envelope.put(KEY_VERSION, EXPORT_VERSION);
        envelope.put(KEY_EXPORTED_AT, stamp);
        envelope.set(KEY_SHORTCUTS, groupsNode(groups));
        writeAtomically(target, toJson(envelope, target));
    }

    /**
     * Reads an export file.
     *
     * @throws ShortcutConfigException when the file is missing, malformed or has no {@code shortcuts} key
     */
    public Map<String, List<Shortcut>> readExport(Path source) {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ShortcutConfigException("File not found", source, e);
        } catch (IOException e) {
            throw new ShortcutConfigException("Failed to read import file", source, e);
        }
        JsonNode shortcuts = readObject(text, source).get(KEY_SHORTCUTS);
        if (shortcuts == null || !shortcuts.isObject()) {
            throw new ShortcutConfigException("Invalid configuration file format", source);
        }
        return parseGroups(shortcuts, source);
    }

    /**
     * Moves an unreadable configuration file aside so the next save does not destroy it.
     *
     * @return the backup location, or empty if nothing was moved
     */
    public Optional<Path> backupCorrupt() {
        if (!Files.exists(configFile)) {
            return Optional.empty();
        }
        String fileName = configFile.getFileName().toString();
        String base = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        Path bad = configFile.resolveSibling(base + ".bad-" + Instant.now().toEpochMilli() + ".json");
        try {
            Files.move(configFile, bad, StandardCopyOption.REPLACE_EXISTING);
            return Optional.of(bad);
        } catch (IOException e) {
            LOG.warn("Could not back up corrupt shortcuts config {}: {}", configFile, e.toString());
            return Optional.empty();
        }
    }

    private static Map<String, List<Shortcut>> parseGroups(JsonNode raw, Path source) {
        Map<String, List<Shortcut>> groups = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String group = entry.getKey();
            JsonNode items = entry.getValue();
            if (!items.isArray()) {
                throw new ShortcutConfigException("Group '" + group + "' is not a JSON array", source);
            }
            List<Shortcut> shortcuts = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                JsonNode item = items.get(i);
                if (!item.isObject()) {
                    throw new ShortcutConfigException(
                            "Entry " + i + " of group '" + group + "' is not a JSON object", source);
                }
                shortcuts.add(toShortcut(item, group, source));
            }
            groups.put(group, shortcuts);
        }
        return groups;
    }

    private static Shortcut toShortcut(JsonNode item, String group, Path source) {
        String id = item.path("id").asText("");
        if (id.isBlank()) {
            throw new ShortcutConfigException("Shortcut without id in group '" + group + "'", source);
        }
        return new Shortcut(
                id,
                item.hasNonNull("name") ? item.get("name").asText() : id,
                item.path("hotkey").asText(""),
                item.path("description").asText(""),
                item.path("enabled").asBoolean(true),
                group);
    }

    private static JsonNode readObject(String text, Path source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ShortcutConfigException("Invalid JSON format: " + e.getOriginalMessage(), source, e);
        }
        if (root == null || !root.isObject()) {
            throw new ShortcutConfigException("Invalid JSON format: expected a JSON object", source);
        }
        return root;
    }

    private static ObjectNode groupsNode(Map<String, List<Shortcut>> groups) {
        ObjectNode node = MAPPER.createObjectNode();
        for (Map.Entry<String, List<Shortcut>> entry : groups.entrySet()) {
            ArrayNode items = node.putArray(entry.getKey());
            for (Shortcut s : entry.getValue()) {
                items.addObject()
                        .put("id", s.id())
                        .put("name", s.name())
                        .put("hotkey", s.hotkey())
                        .put("description", s.description())
                        .put("enabled", s.enabled());
            }
        }
        return node;
    }

    private static String toJson(JsonNode node, Path target) {
        try {
            return MAPPER.writeValueAsString(node) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new ShortcutConfigException("Failed to serialize shortcuts", target, e);
        }
    }

    private static void writeAtomically(Path target, String content) {
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ShortcutConfigException("Failed to write shortcuts config", target, e);
        }
    }
}
