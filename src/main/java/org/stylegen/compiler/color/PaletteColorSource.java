package org.stylegen.compiler.color;

import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.io.SourceLoader;
import org.stylegen.compiler.frontend.lexer.Lexer;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A color table read from a palette file. The file uses the style lexical syntax:
 * <pre>
 * // base colors
 * brand: #3366ff;
 * accent: brand;
 * </pre>
 * An entry is either a hex color or an alias of another entry. Aliases are followed on
 * lookup; an alias whose chain ends in an unknown name or loops is undefined.
 */
public class PaletteColorSource implements ColorSource {

    private static final Logger log = LoggerFactory.getLogger(PaletteColorSource.class);

    private sealed interface Entry permits Literal, Alias {}

    private record Literal(ColorValue color) implements Entry {}

    private record Alias(String target) implements Entry {}

    private final Map<String, Entry> entries;

    private PaletteColorSource(Map<String, Entry> entries) {
        this.entries = entries;
    }

    /**
     * Reads a palette file.
     *
     * @param file The palette file.
     * @return The color source.
     * @throws IOException    if the file cannot be read.
     * @throws ParseException if an entry is malformed.
     */
    public static PaletteColorSource load(Path file) throws IOException {
        SourceLoader.LoadResult result = SourceLoader.loadFile(file);
        PaletteColorSource palette = parse(result.content(), result.logicalName());
        log.debug("Loaded {} palette entries from {}", palette.entries.size(), result.logicalName());
        return palette;
    }

    /**
     * Parses palette text.
     *
     * @param content  The palette text.
     * @param fileName The name used in error locations.
     * @return The color source.
     * @throws ParseException                if an entry is malformed.
     * @throws DuplicateDeclarationException if a name is defined twice.
     */
    public static PaletteColorSource parse(String content, String fileName) {
        List<Token> tokens = new Lexer(content, fileName).scanTokens();
        Map<String, Entry> entries = new LinkedHashMap<>();
        Map<String, SourceLocation> origins = new LinkedHashMap<>();

        int i = 0;
        while (tokens.get(i).type() != TokenType.END_OF_FILE) {
            Token name = expect(tokens.get(i++), TokenType.IDENTIFIER, "a palette color name");
            expect(tokens.get(i++), TokenType.COLON, "':'");
            Token value = tokens.get(i++);
            Entry entry;
            if (value.type() == TokenType.HEX_COLOR) {
                entry = new Literal(ColorValue.parseHex((String) value.value()));
            } else if (value.type() == TokenType.IDENTIFIER) {
                entry = new Alias(value.text());
            } else {
                throw new ParseException(value.location(), "a hex color or palette name", value.describe());
            }
            Token terminator = tokens.get(i);
            if (terminator.type() == TokenType.SEMICOLON) {
                i++;
            } else if (terminator.type() != TokenType.END_OF_FILE) {
                throw new ParseException(terminator.location(), "';'", terminator.describe());
            }

            SourceLocation previous = origins.putIfAbsent(name.text(), name.location());
            if (previous != null) {
                throw new DuplicateDeclarationException(name.location(), name.text(), previous);
            }
            entries.put(name.text(), entry);
        }
        return new PaletteColorSource(entries);
    }

    private static Token expect(Token token, TokenType type, String expected) {
        if (token.type() != type) {
            throw new ParseException(token.location(), expected, token.describe());
        }
        return token;
    }

    @Override
    public Optional<ColorValue> resolveColor(String name) {
        Set<String> seen = new HashSet<>();
        String current = name;
        while (seen.add(current)) {
            Entry entry = entries.get(current);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry instanceof Literal literal) {
                return Optional.of(literal.color());
            }
            current = ((Alias) entry).target();
        }
        log.debug("Palette alias cycle while resolving '{}'", name);
        return Optional.empty();
    }

    /**
     * @return The defined names in file order.
     */
    public Set<String> names() {
        return entries.keySet();
    }
}
