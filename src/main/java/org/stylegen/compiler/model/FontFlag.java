package org.stylegen.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Style flags accepted by {@code font(...)} after the size argument.
 */
public enum FontFlag {
    BOLD("bold"),
    SEMIBOLD("semibold"),
    ITALIC("italic"),
    UNDERLINE("underline"),
    MONOSPACE("monospace");

    private final String keyword;

    FontFlag(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<FontFlag> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(f -> f.keyword.equals(keyword)).findFirst();
    }
}
