package com.phillippitts.shortcutengine.service.hotkey;

import com.phillippitts.shortcutengine.domain.HotkeySpec;
import com.phillippitts.shortcutengine.domain.Key;
import com.phillippitts.shortcutengine.domain.ModifierKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HotkeyParserTest {

    @Test
    void parsesModifiersAndMainKey() {
        HotkeyParseResult r = HotkeyParser.parse("Ctrl+Shift+C");

        assertThat(r.isClean()).isTrue();
        assertThat(r.spec().modifiers()).containsExactlyInAnyOrder(ModifierKey.CTRL, ModifierKey.SHIFT);
        assertThat(r.spec().mainKey()).isEqualTo(Key.of("c"));
    }

    @Test
    void ignoresWhitespaceAroundTokens() {
        assertThat(HotkeyParser.normalize("  ctrl +  alt + f5 ")).isEqualTo("ctrl+alt+f5");
    }

    @Test
    void resolvesModifierAliases() {
        HotkeySpec spec = HotkeyParser.parseSpec("control+option+cmd+x");

        assertThat(spec.modifiers()).containsExactlyInAnyOrder(ModifierKey.CTRL, ModifierKey.ALT, ModifierKey.META);
        assertThat(HotkeyParser.parseSpec("win+x").modifiers()).containsExactly(ModifierKey.META);
        assertThat(HotkeyParser.parseSpec("super+x").modifiers()).containsExactly(ModifierKey.META);
        assertThat(HotkeyParser.parseSpec("command+x").modifiers()).containsExactly(ModifierKey.META);
    }

    @Test
    void resolvesNamedKeyAliases() {
        assertThat(HotkeyParser.normalize("esc")).isEqualTo("escape");
        assertThat(HotkeyParser.normalize("ctrl+return")).isEqualTo("ctrl+enter");
        assertThat(HotkeyParser.normalize("del")).isEqualTo("delete");
        assertThat(HotkeyParser.normalize("pgup")).isEqualTo("pageup");
        assertThat(HotkeyParser.normalize("page_down")).isEqualTo("pagedown");
        assertThat(HotkeyParser.normalize("F24")).isEqualTo("f24");
    }

    @Test
    void formatsModifiersInCanonicalOrder() {
        assertThat(HotkeyParser.normalize("meta+shift+alt+ctrl+k")).isEqualTo("ctrl+alt+shift+meta+k");
    }

    @Test
    void acceptsPunctuationAsLiteralKey() {
        HotkeySpec spec = HotkeyParser.parseSpec("ctrl+,");

        assertThat(spec.modifiers()).containsExactly(ModifierKey.CTRL);
        assertThat(spec.mainKey()).isEqualTo(Key.of(","));
    }

    @Test
    void trailingDoublePlusMeansPlusKey() {
        HotkeySpec spec = HotkeyParser.parseSpec("ctrl++");

        assertThat(spec.modifiers()).containsExactly(ModifierKey.CTRL);
        assertThat(spec.mainKey()).isEqualTo(Key.of("+"));
        assertThat(HotkeyParser.parseSpec("+").mainKey()).isEqualTo(Key.of("+"));
    }

    @Test
    void blankTextYieldsEmptySpecWithoutWarnings() {
        assertThat(HotkeyParser.parse("").spec().isEmpty()).isTrue();
        assertThat(HotkeyParser.parse("   ").isClean()).isTrue();
        assertThat(HotkeyParser.parse(null).spec()).isEqualTo(HotkeySpec.EMPTY);
        assertThat(HotkeyParser.format(HotkeySpec.EMPTY)).isEmpty();
    }

    @Test
    void unknownTokensAreDroppedWithWarning() {
        HotkeyParseResult r = HotkeyParser.parse("ctrl+hyper+x");

        assertThat(r.spec().modifiers()).containsExactly(ModifierKey.CTRL);
        assertThat(r.spec().mainKey()).isEqualTo(Key.of("x"));
        assertThat(r.warnings()).hasSize(1);
        assertThat(r.warnings().get(0)).contains("hyper");
    }

    @Test
    void firstMainKeyWins() {
        HotkeyParseResult r = HotkeyParser.parse("ctrl+a+b");

        assertThat(r.spec().mainKey()).isEqualTo(Key.of("a"));
        assertThat(r.warnings()).singleElement().asString().contains("'b'");
    }

    @Test
    void emptyTokensProduceWarnings() {
        HotkeyParseResult r = HotkeyParser.parse("ctrl++x");

        assertThat(r.spec()).isEqualTo(new HotkeySpec(Set.of(ModifierKey.CTRL), Key.of("x")));
        assertThat(r.warnings()).containsExactly("Empty key token");
    }

    @Test
    void modifierOnlySpecHasNoMainKey() {
        HotkeySpec spec = HotkeyParser.parseSpec("ctrl+shift");

        assertThat(spec.hasMainKey()).isFalse();
        assertThat(HotkeyParser.format(spec)).isEqualTo("ctrl+shift");
    }

    @ParameterizedTest
    @ValueSource(strings = {"pause", "ctrl+shift+c", "Ctrl+H", "ctrl+,", "cmd+option+F13", "shift+ctrl++",
            "alt+a+b", "ctrl+bogus+k", "left_ctrl+space", "+", "ctrl+shift"})
    void formatIsStableUnderReparse(String text) {
        HotkeySpec once = HotkeyParser.parseSpec(text);
        HotkeySpec twice = HotkeyParser.parseSpec(HotkeyParser.format(once));

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void displayStringCapitalizesTokens() {
        assertThat(HotkeyParser.displayString("ctrl+shift+c")).isEqualTo("Ctrl+Shift+C");
        assertThat(HotkeyParser.displayString("pause")).isEqualTo("Pause");
        assertThat(HotkeyParser.displayString("ctrl+,")).isEqualTo("Ctrl+,");
        assertThat(HotkeyParser.displayString("")).isEqualTo("Not Set");
    }
}
