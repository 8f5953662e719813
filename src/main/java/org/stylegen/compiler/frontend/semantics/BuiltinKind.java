package org.stylegen.compiler.frontend.semantics;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The value kinds the style language understands natively. Their keywords are reserved:
 * no type or value may be declared under one of them, regardless of case.
 */
public enum BuiltinKind {
    INT("int"),
    BOOL("bool"),
    PIXELS("pixels"),
    DOUBLE("double"),
    COLOR("color"),
    ICON("icon"),
    MARGINS("margins"),
    SIZE("size"),
    POINT("point"),
    ALIGN("align"),
    FONT("font");

    private final String keyword;

    BuiltinKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The keyword used for this kind in field type positions, e.g. {@code pixels}.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a kind by its exact keyword.
     *
     * @param keyword The keyword as written in a type position.
     * @return The kind, or empty if the keyword names no built-in kind.
     */
    public static Optional<BuiltinKind> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(k -> k.keyword.equals(keyword)).findFirst();
    }

    /**
     * @param name A declared type or value name.
     * @return True if the name case-insensitively equals a built-in keyword.
     */
    public static boolean isReserved(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).anyMatch(k -> k.keyword.equals(lower));
    }
}
