package com.phillippitts.shortcutengine.presentation.exception;

import com.phillippitts.shortcutengine.exception.ShortcutConfigException;
import com.phillippitts.shortcutengine.exception.ShortcutNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void notFoundReturns404WithId() {
        ResponseEntity<?> response = handler.handleNotFound(new ShortcutNotFoundException("nope"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("ShortcutNotFoundException").contains("nope");
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("group must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("group must not be blank");
    }

    @Test
    void configErrorReturns500() {
        ResponseEntity<?> response = handler.handleConfig(
                new ShortcutConfigException("Failed to write shortcuts config", Path.of("/tmp/x.json")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("Shortcut configuration unavailable");
    }

    @Test
    void unexpectedErrorHidesDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("secret internals");
        assertThat(response.getBody().toString()).contains("InternalServerError");
    }
}
