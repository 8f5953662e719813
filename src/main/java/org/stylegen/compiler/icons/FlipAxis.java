package org.stylegen.compiler.icons;

/**
 * Mirror axis requested by a {@code _flip_horizontal} or {@code _flip_vertical} path suffix.
 */
public enum FlipAxis {
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String suffix;

    FlipAxis(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
