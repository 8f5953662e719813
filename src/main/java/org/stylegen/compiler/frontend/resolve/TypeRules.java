package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.diagnostics.TypeMismatchException;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;
import org.stylegen.compiler.frontend.semantics.StructShape;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Optional;

/**
 * Assignability between evaluated expressions and field types.
 * <ul>
 *   <li>Built-in kinds must match exactly, except that an {@code int} literal may be assigned
 *       to a {@code double} field.</li>
 *   <li>A structure value may be assigned to a structure field if its shape contains every
 *       field of the expected shape with the same type.</li>
 * </ul>
 */
public final class TypeRules {

    private TypeRules() {
    }

    /**
     * Checks an expression against the expected type and applies the int-to-double widening.
     *
     * @param actual   The evaluated expression.
     * @param expected The expected type, empty if the field type is inferred.
     * @param field    The field name for error messages.
     * @param location The expression location.
     * @param symbols  The symbol table, for declared type shapes.
     * @return The expression, converted to {@code double} if it was an int literal assigned to a double field.
     * @throws TypeMismatchException if the expression is not assignable.
     */
    public static ResolvedExpression check(ResolvedExpression actual, Optional<TypeRef> expected, String field,
                                           SourceLocation location, SymbolTable symbols) {
        if (expected.isEmpty()) {
            return actual;
        }
        TypeRef type = expected.get();
        if (actual instanceof ResolvedExpression.IntValue intValue
                && type.sameAs(TypeRef.of(BuiltinKind.DOUBLE))) {
            return new ResolvedExpression.DoubleValue(intValue.value());
        }
        if (!isAssignable(actual.type(), type, symbols)) {
            throw new TypeMismatchException(location, field, type.displayName(), actual.type().displayName());
        }
        return actual;
    }

    /**
     * @param actual   The type of the assigned value.
     * @param expected The field type.
     * @param symbols  The symbol table, for declared type shapes.
     * @return True if a value of type {@code actual} can be stored in a field of type {@code expected}.
     */
    public static boolean isAssignable(TypeRef actual, TypeRef expected, SymbolTable symbols) {
        if (expected instanceof TypeRef.Builtin || actual instanceof TypeRef.Builtin) {
            return actual.sameAs(expected);
        }
        return shapeOf(actual, symbols).containsAllOf(shapeOf(expected, symbols));
    }

    /**
     * @param structureType A named or inferred structure type.
     * @param symbols       The symbol table.
     * @return The shape of the type.
     */
    public static StructShape shapeOf(TypeRef structureType, SymbolTable symbols) {
        if (structureType instanceof TypeRef.Named named) {
            return symbols.shapeOf(named.name());
        }
        if (structureType instanceof TypeRef.Inferred inferred) {
            return inferred.shape();
        }
        throw new IllegalArgumentException("Not a structure type: " + structureType.displayName());
    }

    /**
     * Finds the structure behind a value, following simple values that only alias another value.
     *
     * @param value A resolved value.
     * @return The structure, or empty if the value is not a structure or an alias of one.
     */
    public static Optional<ResolvedStructure> structureOf(ResolvedValue value) {
        if (value instanceof ResolvedStructure structure) {
            return Optional.of(structure);
        }
        if (value instanceof ResolvedSimple simple
                && simple.expression() instanceof ResolvedExpression.ValueReference reference) {
            return structureOf(reference.target());
        }
        return Optional.empty();
    }

    /**
     * Folds a checked {@code pixels} expression to its number, following simple value references.
     *
     * @param expression An expression of type {@code pixels}.
     * @return The pixel count.
     */
    public static int pixelsOf(ResolvedExpression expression) {
        if (expression instanceof ResolvedExpression.PixelsValue pixels) {
            return pixels.value();
        }
        if (expression instanceof ResolvedExpression.ValueReference reference
                && reference.target() instanceof ResolvedSimple simple) {
            return pixelsOf(simple.expression());
        }
        throw new IllegalArgumentException("Not a pixels expression: " + expression);
    }
}
