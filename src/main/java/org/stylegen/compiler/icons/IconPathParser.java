package org.stylegen.compiler.icons;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.diagnostics.SourceLocation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the modifier sub-grammar embedded in icon path strings:
 * <pre>
 *   path     := stem modifier*
 *   modifier := "_flip_horizontal" | "_flip_vertical" | "-" WIDTH "x" HEIGHT
 * </pre>
 * Modifiers are trailing, may appear in any order and each at most once.
 */
public final class IconPathParser {

    private static final Pattern SIZE_SUFFIX = Pattern.compile("^(.*)-(\\d+)x(\\d+)$");
    private static final Pattern FLIP_SUFFIX = Pattern.compile("^(.*)_flip_(horizontal|vertical)$");

    private IconPathParser() {
    }

    /**
     * @param raw      The path string as written inside {@code icon{...}}.
     * @param location The location of the string token, used for errors.
     * @return The stem and its modifiers.
     * @throws ParseException if the stem is empty, a size is not positive, or a modifier repeats.
     */
    public static IconPath parse(String raw, SourceLocation location) {
        String stem = raw;
        FlipAxis flip = null;
        ForcedSize size = null;

        boolean matched = true;
        while (matched) {
            matched = false;
            Matcher sizeMatcher = SIZE_SUFFIX.matcher(stem);
            if (sizeMatcher.matches()) {
                if (size != null) {
                    throw new ParseException(location, "Icon path '" + raw + "' repeats the size modifier");
                }
                size = parseSize(sizeMatcher.group(2), sizeMatcher.group(3), raw, location);
                stem = sizeMatcher.group(1);
                matched = true;
                continue;
            }
            Matcher flipMatcher = FLIP_SUFFIX.matcher(stem);
            if (flipMatcher.matches()) {
                if (flip != null) {
                    throw new ParseException(location, "Icon path '" + raw + "' repeats the flip modifier");
                }
                flip = "horizontal".equals(flipMatcher.group(2)) ? FlipAxis.HORIZONTAL : FlipAxis.VERTICAL;
                stem = flipMatcher.group(1);
                matched = true;
            }
        }

        if (stem.isEmpty() || stem.endsWith("/")) {
            throw new ParseException(location, "Icon path '" + raw + "' has no file name");
        }
        return new IconPath(raw, stem, Optional.ofNullable(flip), Optional.ofNullable(size));
    }

    private static ForcedSize parseSize(String width, String height, String raw, SourceLocation location) {
        try {
            return new ForcedSize(Integer.parseInt(width), Integer.parseInt(height));
        } catch (IllegalArgumentException e) {
            throw new ParseException(location, "Icon path '" + raw + "' has an invalid size modifier");
        }
    }
}
