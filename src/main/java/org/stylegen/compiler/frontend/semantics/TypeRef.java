package org.stylegen.compiler.frontend.semantics;

/**
 * The type of a field or value.
 * <ul>
 *   <li>{@link Builtin}: one of the {@link BuiltinKind}s.</li>
 *   <li>{@link Named}: a declared structure type.</li>
 *   <li>{@link Inferred}: the shape of an anonymous or widened value, which has no declared
 *       type of its own. It is only reached through a reference to that value.</li>
 * </ul>
 */
public sealed interface TypeRef permits TypeRef.Builtin, TypeRef.Named, TypeRef.Inferred {

    /**
     * @return The name used for this type in error messages.
     */
    String displayName();

    /**
     * Structural type identity: built-ins by kind, named types by name, inferred types by shape.
     *
     * @param other The type to compare with.
     * @return True if values of both types have the same representation.
     */
    boolean sameAs(TypeRef other);

    static TypeRef of(BuiltinKind kind) {
        return new Builtin(kind);
    }

    /**
     * @param kind The built-in kind.
     */
    record Builtin(BuiltinKind kind) implements TypeRef {
        @Override
        public String displayName() {
            return kind.keyword();
        }

        @Override
        public boolean sameAs(TypeRef other) {
            return other instanceof Builtin builtin && builtin.kind == kind;
        }
    }

    /**
     * @param name The declared structure type name.
     */
    record Named(String name) implements TypeRef {
        @Override
        public String displayName() {
            return name;
        }

        @Override
        public boolean sameAs(TypeRef other) {
            return other instanceof Named named && named.name.equals(name);
        }
    }

    /**
     * @param valueName The value whose shape this is.
     * @param shape     The shape.
     */
    record Inferred(String valueName, StructShape shape) implements TypeRef {
        @Override
        public String displayName() {
            return "shape of '" + valueName + "'";
        }

        @Override
        public boolean sameAs(TypeRef other) {
            return other instanceof Inferred inferred && inferred.shape.sameAs(shape);
        }
    }
}
