package org.stylegen.compiler.frontend.parser;

import org.stylegen.compiler.StyleSources;
import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.ast.ColorLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.DoubleLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.IdentifierNode;
import org.stylegen.compiler.frontend.parser.ast.PixelsLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueForm;
import org.stylegen.compiler.frontend.parser.features.align.AlignNode;
import org.stylegen.compiler.frontend.parser.features.font.FontNode;
import org.stylegen.compiler.frontend.parser.features.geometry.GeometryNode;
import org.stylegen.compiler.frontend.parser.features.icon.IconNode;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.icons.FlipAxis;
import org.stylegen.compiler.model.Align;
import org.stylegen.compiler.model.FontFlag;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the recursive-descent parser and its constructor handlers.
 */
public class ParserTest {

    @Test
    @Tag("unit")
    void parsesImportsTypesAndAllValueForms() {
        SourceModule module = StyleSources.parse("""
                using "base.style";
                Btn { height: pixels; width: pixels }
                defaultBtn: Btn { height: 30px; width: 100px; }
                bigBtn: Btn(defaultBtn) { height: 40px; }
                panel { padding: 4px; }
                spacing: 8px;
                """);

        assertThat(module.imports()).hasSize(1);
        assertThat(module.imports().get(0).path()).isEqualTo("base.style");

        TypeDeclarationNode type = module.typeDeclarations().get(0);
        assertThat(type.nameText()).isEqualTo("Btn");
        assertThat(type.fields()).extracting(f -> f.name().text()).containsExactly("height", "width");

        assertThat(module.valueDeclarations()).extracting(ValueDeclarationNode::form).containsExactly(
                ValueForm.STRUCTURE, ValueForm.STRUCTURE, ValueForm.ANONYMOUS, ValueForm.SIMPLE);

        ValueDeclarationNode bigBtn = module.valueDeclarations().get(1);
        assertThat(bigBtn.typeName().orElseThrow().text()).isEqualTo("Btn");
        assertThat(bigBtn.baseName().orElseThrow().text()).isEqualTo("defaultBtn");
        assertThat(bigBtn.assignments()).hasSize(1);

        ValueDeclarationNode spacing = module.valueDeclarations().get(3);
        assertThat(spacing.simpleValue()).containsInstanceOf(PixelsLiteralNode.class);
    }

    @Test
    @Tag("unit")
    void parsesBuiltinConstructors() {
        SourceModule module = StyleSources.parse("""
                m: margins(1px, 2px, 3px, 4px);
                s: size(10px, 20px);
                a: align(topleft);
                f: font(13px, bold, italic, "Inter");
                i: icon{ {"arrow_flip_horizontal", fg}, {"box-24x24", #fff}, };
                d: 0.5;
                """);

        GeometryNode margins = (GeometryNode) module.valueDeclarations().get(0).simpleValue().orElseThrow();
        assertThat(margins.kind()).isEqualTo(BuiltinKind.MARGINS);
        assertThat(margins.arguments()).hasSize(4);

        GeometryNode size = (GeometryNode) module.valueDeclarations().get(1).simpleValue().orElseThrow();
        assertThat(size.kind()).isEqualTo(BuiltinKind.SIZE);

        AlignNode align = (AlignNode) module.valueDeclarations().get(2).simpleValue().orElseThrow();
        assertThat(align.align()).isEqualTo(Align.TOP_LEFT);

        FontNode font = (FontNode) module.valueDeclarations().get(3).simpleValue().orElseThrow();
        assertThat(font.flags()).containsExactlyInAnyOrder(FontFlag.BOLD, FontFlag.ITALIC);
        assertThat(font.family()).contains("Inter");

        IconNode icon = (IconNode) module.valueDeclarations().get(4).simpleValue().orElseThrow();
        assertThat(icon.layers()).hasSize(2);
        assertThat(icon.layers().get(0).path().stem()).isEqualTo("arrow");
        assertThat(icon.layers().get(0).path().flip()).contains(FlipAxis.HORIZONTAL);
        assertThat(icon.layers().get(0).color()).isInstanceOf(IdentifierNode.class);
        assertThat(icon.layers().get(1).path().forcedSize()).isPresent();
        assertThat(icon.layers().get(1).color()).isInstanceOf(ColorLiteralNode.class);

        assertThat(module.valueDeclarations().get(5).simpleValue()).containsInstanceOf(DoubleLiteralNode.class);
    }

    @Test
    @Tag("unit")
    void lastStatementMayOmitSemicolon() {
        SourceModule module = StyleSources.parse("gap: 4px");

        assertThat(module.valueDeclarations()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void missingSemicolonBetweenValuesIsAnError() {
        assertThatThrownBy(() -> StyleSources.parse("a: 1px\nb: 2px;"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("expected ';'");
    }

    @Test
    @Tag("unit")
    void usingAfterDeclarationIsAnError() {
        assertThatThrownBy(() -> StyleSources.parse("a: 1px;\nusing \"b.style\";"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'using'");
    }

    @Test
    @Tag("unit")
    void reportsLocationOfUnexpectedToken() {
        assertThatThrownBy(() -> StyleSources.parse("Btn {\n  height pixels;\n}"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException parseError = (ParseException) e;
                    assertThat(parseError.location().line()).isEqualTo(2);
                    assertThat(parseError.location().column()).isEqualTo(10);
                    assertThat(parseError.format()).startsWith("/styles/main.style:2:10: error[PARSE_ERROR]:");
                });
    }

    @Test
    @Tag("unit")
    void rejectsWrongConstructorArity() {
        assertThatThrownBy(() -> StyleSources.parse("s: size(1px);"))
                .isInstanceOf(ParseException.class);
    }

    @Test
    @Tag("unit")
    void rejectsUnknownAlignmentAndFontFlag() {
        assertThatThrownBy(() -> StyleSources.parse("a: align(middle);")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> StyleSources.parse("f: font(12px, heavy);")).isInstanceOf(ParseException.class);
    }

    @Test
    @Tag("unit")
    void rejectsEmptyIcon() {
        assertThatThrownBy(() -> StyleSources.parse("i: icon{ };")).isInstanceOf(ParseException.class);
    }
}
