package org.stylegen.compiler.color;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ColorValueTest {

    @Test
    @Tag("unit")
    void shortFormExpandsEachDigit() {
        assertThat(ColorValue.parseHex("#f80")).isEqualTo(new ColorValue(255, 136, 0, 255));
    }

    @Test
    @Tag("unit")
    void longFormsParseAlpha() {
        assertThat(ColorValue.parseHex("3366ff")).isEqualTo(new ColorValue(0x33, 0x66, 0xff, 255));
        assertThat(ColorValue.parseHex("#3366ff80").alpha()).isEqualTo(0x80);
        assertThat(ColorValue.parseHex("#3366FF80").toHex()).isEqualTo("#3366ff80");
    }

    @Test
    @Tag("unit")
    void rejectsInvalidText() {
        assertThatThrownBy(() -> ColorValue.parseHex("#12345")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorValue.parseHex("#zzzzzz")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ColorValue(256, 0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
