package org.stylegen.compiler.backend.codegen;

import org.stylegen.compiler.color.ColorValue;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.TypeRules;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.StructShape;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.icons.AssetFormat;
import org.stylegen.compiler.icons.DensityVariant;
import org.stylegen.compiler.icons.IconAsset;
import org.stylegen.compiler.model.FontFlag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps style types to C++ types and renders resolved expressions as C++ initializers.
 */
class CppExpressionWriter {

    private final GeneratorOptions options;
    private final SymbolTable symbols;
    private final Map<String, String> synthesizedStructs;

    CppExpressionWriter(GeneratorOptions options, SymbolTable symbols, Map<String, String> synthesizedStructs) {
        this.options = options;
        this.symbols = symbols;
        this.synthesizedStructs = synthesizedStructs;
    }

    /**
     * {@code int} and {@code pixels} map to {@code int}, {@code bool} and {@code double} to
     * themselves, the other built-ins to the host types of the types namespace, and structures
     * to their struct.
     */
    String cppType(TypeRef type) {
        if (type instanceof TypeRef.Builtin builtin) {
            return switch (builtin.kind()) {
                case INT, PIXELS -> "int";
                case BOOL -> "bool";
                case DOUBLE -> "double";
                default -> qualifiedType(builtin.kind().keyword());
            };
        }
        if (type instanceof TypeRef.Named named) {
            return qualifiedType(named.name());
        }
        TypeRef.Inferred inferred = (TypeRef.Inferred) type;
        String struct = synthesizedStructs.get(inferred.valueName());
        if (struct == null) {
            throw new IllegalStateException("No struct generated yet for the shape of '" + inferred.valueName() + "'");
        }
        return qualifiedType(struct);
    }

    /**
     * @param expression The resolved expression.
     * @param expected   The type of the field or value it initializes.
     * @return The C++ initializer.
     */
    String render(ResolvedExpression expression, TypeRef expected) {
        if (expression instanceof ResolvedExpression.ValueReference reference) {
            return renderReference(reference, expected);
        }
        if (expression instanceof ResolvedExpression.IntValue value) {
            return Integer.toString(value.value());
        }
        if (expression instanceof ResolvedExpression.PixelsValue value) {
            return Integer.toString(value.value());
        }
        if (expression instanceof ResolvedExpression.DoubleValue value) {
            return Double.toString(value.value());
        }
        if (expression instanceof ResolvedExpression.BoolValue value) {
            return Boolean.toString(value.value());
        }
        if (expression instanceof ResolvedExpression.ColorConstant value) {
            ColorValue color = value.color();
            return qualifiedType("color") + "(" + color.red() + ", " + color.green() + ", "
                    + color.blue() + ", " + color.alpha() + ")";
        }
        if (expression instanceof ResolvedExpression.MarginsValue value) {
            return qualifiedType("margins") + "(" + value.left() + ", " + value.top() + ", "
                    + value.right() + ", " + value.bottom() + ")";
        }
        if (expression instanceof ResolvedExpression.SizeValue value) {
            return qualifiedType("size") + "(" + value.width() + ", " + value.height() + ")";
        }
        if (expression instanceof ResolvedExpression.PointValue value) {
            return qualifiedType("point") + "(" + value.x() + ", " + value.y() + ")";
        }
        if (expression instanceof ResolvedExpression.AlignValue value) {
            return qualifiedType("align") + "::" + value.align().name().toLowerCase(Locale.ROOT);
        }
        if (expression instanceof ResolvedExpression.FontValue value) {
            return renderFont(value);
        }
        if (expression instanceof ResolvedExpression.IconValue value) {
            return renderIcon(value);
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    /**
     * References are emitted by name. A value wider than the field it is assigned to is
     * projected onto the field's struct member by member.
     */
    private String renderReference(ResolvedExpression.ValueReference reference, TypeRef expected) {
        String qualified = options.valuesNamespace() + "::" + reference.name();
        if (expected instanceof TypeRef.Builtin || cppType(expected).equals(cppType(reference.type()))) {
            return qualified;
        }
        StructShape target = TypeRules.shapeOf(expected, symbols);
        List<String> members = new ArrayList<>();
        for (StructShape.Field field : target.fields()) {
            members.add("." + field.name() + " = " + qualified + "." + field.name());
        }
        return cppType(expected) + "{ " + String.join(", ", members) + " }";
    }

    private String renderFont(ResolvedExpression.FontValue font) {
        List<String> flags = new ArrayList<>();
        for (FontFlag flag : FontFlag.values()) {
            if (font.flags().contains(flag)) {
                flags.add(qualifiedType("font_flag") + "::" + flag.keyword());
            }
        }
        String flagText = flags.isEmpty() ? qualifiedType("font_flag") + "::none" : String.join(" | ", flags);
        StringBuilder text = new StringBuilder();
        text.append(qualifiedType("font")).append('(').append(font.size()).append(", ").append(flagText);
        font.family().ifPresent(family -> text.append(", ").append(stringLiteral(family)));
        return text.append(')').toString();
    }

    private String renderIcon(ResolvedExpression.IconValue icon) {
        List<String> layers = new ArrayList<>();
        for (IconAsset layer : icon.icon().layers()) {
            layers.add(renderLayer(layer));
        }
        return qualifiedType("icon") + "{ " + String.join(", ", layers) + " }";
    }

    private String renderLayer(IconAsset layer) {
        String color = render(layer.color(), TypeRef.of(BuiltinKind.COLOR));
        String layerType = qualifiedType("icon_layer");
        if (layer.format() == AssetFormat.VECTOR) {
            StringBuilder text = new StringBuilder();
            text.append(layerType).append("::vector(").append(stringLiteral(layer.baseFile())).append(", ").append(color);
            layer.forcedSize().ifPresent(size -> text.append(", ").append(qualifiedType("size"))
                    .append('(').append(size.width()).append(", ").append(size.height()).append(')'));
            return text.append(')').toString();
        }
        List<String> files = new ArrayList<>();
        for (DensityVariant variant : layer.variants()) {
            files.add(stringLiteral(variant.file()));
        }
        StringBuilder text = new StringBuilder();
        text.append(layerType).append("::raster({ ").append(String.join(", ", files)).append(" }, ").append(color);
        layer.flip().ifPresent(flip -> text.append(", ").append(qualifiedType("flip")).append("::")
                .append(flip.name().toLowerCase(Locale.ROOT)));
        return text.append(')').toString();
    }

    private String qualifiedType(String name) {
        return options.typesNamespace() + "::" + name;
    }

    private static String stringLiteral(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
