package org.stylegen.compiler.frontend.parser.ast;

/**
 * The surface form of a value declaration.
 */
public enum ValueForm {
    /** {@code name: Type { ... }} or {@code name: Type(base) { ... }}. */
    STRUCTURE,
    /** {@code name { ... }}: the shape is inferred from the assignments. */
    ANONYMOUS,
    /** {@code name: expression;}: a single built-in value or an alias of another value. */
    SIMPLE
}
