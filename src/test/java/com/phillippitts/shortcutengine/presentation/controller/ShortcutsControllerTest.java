package com.phillippitts.shortcutengine.presentation.controller;

import com.phillippitts.shortcutengine.service.integration.ShortcutsIntegrator;
import com.phillippitts.shortcutengine.service.registry.ShortcutRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "shortcuts.native-hook-enabled=false",
        "shortcuts.listener-auto-start=true"
})
@AutoConfigureMockMvc
class ShortcutsControllerTest {

    @TempDir
    static Path tmp;

    @DynamicPropertySource
    static void shortcutProperties(DynamicPropertyRegistry registry) {
        registry.add("shortcuts.config-file", () -> tmp.resolve("shortcuts_config.json").toString());
    }

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ShortcutRegistry registry;

    @Autowired
    private ShortcutsIntegrator integrator;

    @BeforeEach
    void resetShortcuts() {
        registry.resetToDefaults();
    }

    @Test
    void listsAllShortcutsWithDisplayStrings() throws Exception {
        mvc.perform(get("/api/shortcuts"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-ID"))
                .andExpect(jsonPath("$", hasSize(17)))
                .andExpect(jsonPath("$[0].id").value("record_toggle"))
                .andExpect(jsonPath("$[0].display").value("Pause"))
                .andExpect(jsonPath("$[1].display").value("Not Set"));
    }

    @Test
    void unknownShortcutIs404() throws Exception {
        mvc.perform(get("/api/shortcuts/does_not_exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ShortcutNotFoundException"));
    }

    @Test
    void groupsCarryDisplayNames() throws Exception {
        mvc.perform(get("/api/shortcuts/groups"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("recording"))
                .andExpect(jsonPath("$[0].displayName").value("Recording Controls"))
                .andExpect(jsonPath("$[0].size").value(3));

        mvc.perform(get("/api/shortcuts/groups/history"))
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    void conflictingHotkeyIs409() throws Exception {
        mvc.perform(put("/api/shortcuts/record_toggle/hotkey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hotkey\": \"Ctrl+H\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("CONFLICT"))
                .andExpect(jsonPath("$.conflictingId").value("show_history"));
    }

    @Test
    void successfulRebindIsSaved() throws Exception {
        mvc.perform(put("/api/shortcuts/record_toggle/hotkey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hotkey\": \"ctrl+alt+r\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hotkey").value("ctrl+alt+r"))
                .andExpect(jsonPath("$.display").value("Ctrl+Alt+R"));

        String saved = Files.readString(tmp.resolve("shortcuts_config.json"), StandardCharsets.UTF_8);
        assertThat(saved).contains("ctrl+alt+r");
    }

    @Test
    void rebindOfUnknownIdIs404() throws Exception {
        mvc.perform(put("/api/shortcuts/nope/hotkey")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hotkey\": \"f1\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingBodyFieldIs400() throws Exception {
        mvc.perform(put("/api/shortcuts/record_toggle/enabled")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void disablingRemovesFromConflictAudit() throws Exception {
        mvc.perform(put("/api/shortcuts/show_history/enabled")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));

        mvc.perform(get("/api/shortcuts/conflicts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void manualTriggerRunsHandlers() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Runnable handler = calls::incrementAndGet;
        integrator.registerActionHandler("show_settings", handler);
        try {
            mvc.perform(post("/api/shortcuts/show_settings/trigger"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.handled").value(true));
            mvc.perform(post("/api/shortcuts/clear_history/trigger"))
                    .andExpect(jsonPath("$.handled").value(false));
        } finally {
            integrator.removeActionHandler("show_settings", handler);
        }
        assertThat(calls).hasValue(1);
    }

    @Test
    void exportAndImportRoundTrip() throws Exception {
        Path export = tmp.resolve("export.json");
        mvc.perform(post("/api/shortcuts/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"" + export.toString().replace("\\", "\\\\") + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exported").value(true));

        mvc.perform(post("/api/shortcuts/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"" + export.toString().replace("\\", "\\\\") + "\", \"merge\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.skippedIds", hasSize(17)));
    }

    @Test
    void importOfMissingFileIs400() throws Exception {
        mvc.perform(post("/api/shortcuts/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"" + tmp.resolve("absent.json").toString().replace("\\", "\\\\")
                                + "\", \"merge\": false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void exportOutsideConfigDirectoryIs400() throws Exception {
        Path outside = tmp.resolveSibling("outside-" + tmp.getFileName() + ".json");

        mvc.perform(post("/api/shortcuts/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"../" + outside.getFileName() + "\"}"))
                .andExpect(status().isBadRequest());

        assertThat(outside).doesNotExist();
    }

    @Test
    void importOfAbsolutePathOutsideConfigDirectoryIs400() throws Exception {
        mvc.perform(post("/api/shortcuts/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"/etc/passwd\", \"merge\": true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("IllegalArgumentException"));
    }

    @Test
    void relativeExportPathLandsInConfigDirectory() throws Exception {
        mvc.perform(post("/api/shortcuts/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"backup.json\"}"))
                .andExpect(status().isOk());

        assertThat(tmp.resolve("backup.json")).exists();
    }

    @Test
    void listenerCanBeStoppedAndStarted() throws Exception {
        mvc.perform(post("/api/shortcuts/listener/stop"))
                .andExpect(jsonPath("$.running").value(false));
        mvc.perform(get("/api/shortcuts/listener"))
                .andExpect(jsonPath("$.running").value(false));
        mvc.perform(post("/api/shortcuts/listener/start"))
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.started").value(true));
    }
}
