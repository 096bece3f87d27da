package com.phillippitts.shortcutengine.presentation.controller;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import com.phillippitts.shortcutengine.domain.Shortcut;
import com.phillippitts.shortcutengine.exception.ShortcutNotFoundException;
import com.phillippitts.shortcutengine.service.hotkey.HotkeyParser;
import com.phillippitts.shortcutengine.service.integration.ShortcutsIntegrator;
import com.phillippitts.shortcutengine.service.registry.DefaultShortcuts;
import com.phillippitts.shortcutengine.service.registry.ImportResult;
import com.phillippitts.shortcutengine.service.registry.RegistryResult;
import com.phillippitts.shortcutengine.service.registry.ShortcutError;
import com.phillippitts.shortcutengine.service.registry.ShortcutRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST boundary for the shortcuts panel: browse, rebind, enable/disable, fire and persist shortcuts.
 * Successful mutations are saved immediately; conflicts come back as 409 with the conflicting shortcut.
 *
 * <p>Export and import paths are resolved against the directory of the configuration file;
 * paths that leave it are rejected with 400.
 */
@RestController
@RequestMapping("/api/shortcuts")
class ShortcutsController {

    private static final Logger LOG = LogManager.getLogger(ShortcutsController.class);

    private final ShortcutsIntegrator integrator;
    private final ShortcutRegistry registry;
    private final Path configDir;

    ShortcutsController(ShortcutsIntegrator integrator, ShortcutRegistry registry, ShortcutProperties props) {
        this.integrator = integrator;
        this.registry = registry;
        Path parent = props.getConfigPath().toAbsolutePath().normalize().getParent();
        this.configDir = parent != null ? parent : props.getConfigPath().toAbsolutePath().getRoot();
    }

    @GetMapping
    List<ShortcutView> list() {
        return integrator.getAllShortcuts().stream().map(ShortcutView::of).toList();
    }

    @GetMapping("/{id}")
    ShortcutView get(@PathVariable String id) {
        return registry.get(id).map(ShortcutView::of).orElseThrow(() -> new ShortcutNotFoundException(id));
    }

    @GetMapping("/groups")
    List<GroupView> groups() {
        return registry.getGroupNames().stream()
                .map(g -> new GroupView(g, DefaultShortcuts.displayName(g), registry.getGroup(g).size()))
                .toList();
    }

    @GetMapping("/groups/{group}")
    List<ShortcutView> group(@PathVariable String group) {
        return integrator.getShortcutsByGroup(group).stream().map(ShortcutView::of).toList();
    }

    @PutMapping("/{id}/hotkey")
    ResponseEntity<?> setHotkey(@PathVariable String id, @Valid @RequestBody HotkeyRequest request) {
        return applied(id, integrator.setShortcutHotkey(id, request.hotkey()));
    }

    @PutMapping("/{id}/enabled")
    ResponseEntity<?> setEnabled(@PathVariable String id, @Valid @RequestBody EnabledRequest request) {
        return applied(id, integrator.setShortcutEnabled(id, request.enabled()));
    }

    @GetMapping("/conflicts")
    Map<String, List<String>> conflicts() {
        return integrator.detectAllConflicts();
    }

    @PostMapping("/{id}/trigger")
    Map<String, Object> trigger(@PathVariable String id) {
        if (registry.get(id).isEmpty()) {
            throw new ShortcutNotFoundException(id);
        }
        boolean handled = integrator.triggerById(id);
        return Map.of("id", id, "handled", handled);
    }

    @PostMapping("/reload")
    List<ShortcutView> reload() {
        integrator.reloadShortcuts();
        return list();
    }

    @PostMapping("/save")
    Map<String, Object> save() {
        return Map.of("saved", registry.save());
    }

    @PostMapping("/reset")
    List<ShortcutView> reset() {
        registry.resetToDefaults();
        return list();
    }

    @PostMapping("/export")
    ResponseEntity<Map<String, Object>> export(@Valid @RequestBody PathRequest request) {
        boolean ok = registry.exportConfig(resolveInConfigDir(request.path()));
        return ResponseEntity.status(ok ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("exported", ok, "path", request.path()));
    }

    @PostMapping("/import")
    ResponseEntity<ImportResult> importConfig(@Valid @RequestBody ImportRequest request) {
        ImportResult result = registry.importConfig(resolveInConfigDir(request.path()), request.merge());
        return ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(result);
    }

    @PostMapping("/listener/start")
    Map<String, Object> startListener() {
        boolean started = integrator.startKeyboardListener();
        return Map.of("running", integrator.isKeyboardListenerRunning(), "started", started);
    }

    @PostMapping("/listener/stop")
    Map<String, Object> stopListener() {
        integrator.stopKeyboardListener();
        return Map.of("running", integrator.isKeyboardListenerRunning());
    }

    @GetMapping("/listener")
    Map<String, Object> listenerStatus() {
        return Map.of("running", integrator.isKeyboardListenerRunning());
    }

    private Path resolveInConfigDir(String requested) {
        Path resolved = configDir.resolve(requested).normalize();
        if (!resolved.startsWith(configDir)) {
            throw new IllegalArgumentException("Path must be inside " + configDir);
        }
        return resolved;
    }

    private ResponseEntity<?> applied(String id, RegistryResult result) {
        if (result.isOk()) {
            registry.save();
            return ResponseEntity.ok(get(id));
        }
        ShortcutError error = result.error().orElseThrow();
        if (error.reason() == ShortcutError.Reason.NOT_FOUND) {
            throw new ShortcutNotFoundException(id);
        }
        LOG.info("Rejected change to '{}': {}", id, error.message());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    record ShortcutView(String id, String name, String hotkey, String display, String description,
                        boolean enabled, String group) {
        static ShortcutView of(Shortcut s) {
            return new ShortcutView(s.id(), s.name(), s.hotkey(), HotkeyParser.displayString(s.hotkey()),
                    s.description(), s.enabled(), s.group());
        }
    }

    record GroupView(String name, String displayName, int size) { }

    record HotkeyRequest(@NotNull String hotkey) { }

    record EnabledRequest(@NotNull Boolean enabled) { }

    record PathRequest(@NotBlank String path) { }

    record ImportRequest(@NotBlank String path, boolean merge) { }
}
