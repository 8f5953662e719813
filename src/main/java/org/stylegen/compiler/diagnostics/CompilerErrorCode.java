package org.stylegen.compiler.diagnostics;

/**
 * Stable error codes for every failure the style compiler can report.
 * Tests assert on these codes instead of on message texts.
 */
public enum CompilerErrorCode {
    // region Frontend
    /** Malformed syntax in a style source file. */
    PARSE_ERROR,
    /** A {@code using} statement names a file that does not exist or cannot be read. */
    MODULE_NOT_FOUND,
    /** The {@code using} graph contains a cycle. */
    CYCLIC_IMPORT,
    // endregion

    // region Symbols
    /** A type, value or field name is declared twice. */
    DUPLICATE_DECLARATION,
    /** A declaration uses the name of a built-in kind. */
    RESERVED_NAME,
    /** A type or value name is not visible from the referencing module. */
    UNDEFINED_NAME,
    // endregion

    // region Resolution
    /** Value inheritance or value references form a cycle, or a structure contains itself. */
    CYCLIC_REFERENCE,
    /** A color name is neither a declared value nor known to the color source. */
    UNDEFINED_COLOR,
    /** An expression does not match the type expected for its field. */
    TYPE_MISMATCH,
    /** A field of the declared type was never assigned. */
    MISSING_FIELD,
    // endregion

    // region Icons
    /** No vector or raster asset exists for an icon path. */
    ASSET_NOT_FOUND,
    /** An icon path modifier cannot be applied to the resolved asset format. */
    MODIFIER_INCOMPATIBLE
    // endregion
}
