package org.stylegen.compiler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Alignment keywords accepted by {@code align(...)}.
 */
public enum Align {
    LEFT("left"),
    TOP("top"),
    RIGHT("right"),
    BOTTOM("bottom"),
    CENTER("center"),
    TOP_LEFT("topleft"),
    TOP_RIGHT("topright"),
    BOTTOM_LEFT("bottomleft"),
    BOTTOM_RIGHT("bottomright");

    private final String keyword;

    Align(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<Align> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(a -> a.keyword.equals(keyword)).findFirst();
    }
}
