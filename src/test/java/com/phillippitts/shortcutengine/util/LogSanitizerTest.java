package com.phillippitts.shortcutengine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.sanitize(null, 10)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("ctrl+shift+c", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("ctrl+shift+c", -1)).isEmpty();
    }

    @Test
    void shouldKeepShortStrings() {
        assertThat(LogSanitizer.truncate("f9", 10)).isEqualTo("f9");
        assertThat(LogSanitizer.truncate("pause", 5)).isEqualTo("pause");
    }

    @Test
    void shouldTruncateLongStrings() {
        assertThat(LogSanitizer.truncate("ctrl+shift+alt+x", 4)).isEqualTo("ctrl");
        assertThat(LogSanitizer.truncate("a".repeat(1000), 64)).hasSize(64);
    }

    @Test
    void shouldReplaceControlCharacters() {
        assertThat(LogSanitizer.sanitize("ctrl+x\nFAKE LOG LINE", 100)).isEqualTo("ctrl+x?FAKE LOG LINE");
        assertThat(LogSanitizer.sanitize("\t\r", 10)).isEqualTo("??");
    }

    @Test
    void shouldTruncateBeforeSanitizing() {
        assertThat(LogSanitizer.sanitize("ab\ncd", 3)).isEqualTo("ab?");
    }
}
