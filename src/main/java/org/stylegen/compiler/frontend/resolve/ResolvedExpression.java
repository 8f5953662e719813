package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.color.ColorValue;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.icons.IconAsset;
import org.stylegen.compiler.icons.ResolvedIcon;
import org.stylegen.compiler.model.Align;
import org.stylegen.compiler.model.FontFlag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A fully evaluated field or simple value expression.
 */
public sealed interface ResolvedExpression {

    /**
     * @return The type this expression produces.
     */
    TypeRef type();

    /**
     * Adds the names of all values this expression refers to, including references nested
     * inside icon layer colors.
     *
     * @param into The set to add to.
     */
    default void collectReferences(Set<String> into) {
    }

    record IntValue(int value) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.INT);
        }
    }

    record PixelsValue(int value) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.PIXELS);
        }
    }

    record DoubleValue(double value) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.DOUBLE);
        }
    }

    record BoolValue(boolean value) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.BOOL);
        }
    }

    /**
     * @param color       The concrete color.
     * @param paletteName The palette entry it was looked up under, empty for hex literals.
     */
    record ColorConstant(ColorValue color, Optional<String> paletteName) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.COLOR);
        }
    }

    record MarginsValue(int left, int top, int right, int bottom) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.MARGINS);
        }
    }

    record SizeValue(int width, int height) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.SIZE);
        }
    }

    record PointValue(int x, int y) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.POINT);
        }
    }

    record AlignValue(Align align) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.ALIGN);
        }
    }

    /**
     * @param size   The pixel size.
     * @param flags  The style flags.
     * @param family The family, if given.
     */
    record FontValue(int size, Set<FontFlag> flags, Optional<String> family) implements ResolvedExpression {

        public FontValue {
            flags = flags.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.noneOf(FontFlag.class))
                    : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        }

        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.FONT);
        }
    }

    record IconValue(ResolvedIcon icon) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return TypeRef.of(BuiltinKind.ICON);
        }

        @Override
        public void collectReferences(Set<String> into) {
            for (IconAsset layer : icon.layers()) {
                layer.color().collectReferences(into);
            }
        }
    }

    /**
     * A reference to another value by name. The generator emits the name, not the target's content.
     *
     * @param name   The referenced value.
     * @param target Its resolved form.
     */
    record ValueReference(String name, ResolvedValue target) implements ResolvedExpression {
        @Override
        public TypeRef type() {
            return target.type();
        }

        @Override
        public void collectReferences(Set<String> into) {
            into.add(name);
        }
    }
}
