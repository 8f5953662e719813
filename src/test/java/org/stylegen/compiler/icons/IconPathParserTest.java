package org.stylegen.compiler.icons;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class IconPathParserTest {

    private static final SourceLocation LOCATION = new SourceLocation("icons.style", 1, 1);

    @Test
    @Tag("unit")
    void plainPathHasNoModifiers() {
        IconPath path = IconPathParser.parse("toolbar/save", LOCATION);

        assertThat(path.stem()).isEqualTo("toolbar/save");
        assertThat(path.hasModifiers()).isFalse();
    }

    @Test
    @Tag("unit")
    void modifiersMayAppearInAnyOrder() {
        IconPath sizeLast = IconPathParser.parse("arrow_flip_vertical-16x24", LOCATION);
        IconPath flipLast = IconPathParser.parse("arrow-16x24_flip_vertical", LOCATION);

        assertThat(sizeLast.stem()).isEqualTo("arrow");
        assertThat(sizeLast.flip()).contains(FlipAxis.VERTICAL);
        assertThat(sizeLast.forcedSize()).contains(new ForcedSize(16, 24));
        assertThat(flipLast.stem()).isEqualTo("arrow");
        assertThat(flipLast.flip()).isEqualTo(sizeLast.flip());
        assertThat(flipLast.forcedSize()).isEqualTo(sizeLast.forcedSize());
    }

    @Test
    @Tag("unit")
    void keepsRawText() {
        assertThat(IconPathParser.parse("a_flip_horizontal", LOCATION).raw()).isEqualTo("a_flip_horizontal");
    }

    @Test
    @Tag("unit")
    void repeatedModifierIsRejected() {
        assertThatThrownBy(() -> IconPathParser.parse("a-8x8-16x16", LOCATION))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("repeats the size modifier");
        assertThatThrownBy(() -> IconPathParser.parse("a_flip_vertical_flip_horizontal", LOCATION))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("repeats the flip modifier");
    }

    @Test
    @Tag("unit")
    void zeroSizeIsRejected() {
        assertThatThrownBy(() -> IconPathParser.parse("a-0x16", LOCATION)).isInstanceOf(ParseException.class);
    }

    @Test
    @Tag("unit")
    void modifierWithoutStemIsRejected() {
        assertThatThrownBy(() -> IconPathParser.parse("_flip_horizontal", LOCATION))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("has no file name");
    }
}
