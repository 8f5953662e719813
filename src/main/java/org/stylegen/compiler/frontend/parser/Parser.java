package org.stylegen.compiler.frontend.parser;

import org.stylegen.compiler.diagnostics.ParseException;
import org.stylegen.compiler.frontend.parser.ast.BoolLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ColorLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.DeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.DoubleLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.parser.ast.FieldAssignmentNode;
import org.stylegen.compiler.frontend.parser.ast.FieldDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.IdentifierNode;
import org.stylegen.compiler.frontend.parser.ast.ImportNode;
import org.stylegen.compiler.frontend.parser.ast.IntLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.PixelsLiteralNode;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.model.Token;
import org.stylegen.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser turning the tokens of one file into a {@link SourceModule}.
 * <p>
 * Identifiers with an upper-case initial are type names, all others are value or field
 * names; this is what tells a type declaration {@code Btn { ... }} apart from an anonymous
 * value group {@code btn { ... }}. The parser stops at the first error.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final ModuleId moduleId;
    private final ConstructorHandlerRegistry constructors;
    private int current = 0;

    /**
     * @param tokens   The tokens of the file, terminated by {@link TokenType#END_OF_FILE}.
     * @param moduleId The identity of the module being parsed.
     */
    public Parser(List<Token> tokens, ModuleId moduleId) {
        this.tokens = tokens;
        this.moduleId = moduleId;
        this.constructors = ConstructorHandlerRegistry.initialize();
    }

    /**
     * Parses the whole file.
     *
     * @return The parsed module.
     * @throws ParseException on the first syntax error.
     */
    public SourceModule parse() {
        List<ImportNode> imports = new ArrayList<>();
        while (check(TokenType.USING)) {
            imports.add(parseImport());
        }

        List<DeclarationNode> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            if (check(TokenType.USING)) {
                throw new ParseException(peek().location(),
                        "'using' statements must come before all declarations");
            }
            declarations.add(parseDeclaration());
        }
        return new SourceModule(moduleId, imports, declarations);
    }

    private ImportNode parseImport() {
        Token keyword = advance();
        Token path = consume(TokenType.STRING, "a module path in quotes after 'using'");
        match(TokenType.SEMICOLON);
        return new ImportNode((String) path.value(), keyword.location());
    }

    private DeclarationNode parseDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "a type or value declaration");
        if (isTypeName(name)) {
            return parseTypeDeclaration(name);
        }
        if (check(TokenType.LEFT_BRACE)) {
            return ValueDeclarationNode.anonymous(name, parseAssignmentBlock());
        }
        consume(TokenType.COLON, "':' or '{' after value name '" + name.text() + "'");

        if (check(TokenType.IDENTIFIER) && isTypeName(peek())) {
            Token typeName = advance();
            Token baseName = null;
            if (match(TokenType.LEFT_PAREN)) {
                baseName = consume(TokenType.IDENTIFIER, "a base value name");
                consume(TokenType.RIGHT_PAREN, "')' after the base value name");
            }
            List<FieldAssignmentNode> assignments = parseAssignmentBlock();
            return ValueDeclarationNode.structure(name, typeName, baseName, assignments);
        }

        ExpressionNode value = parseExpression();
        endStatement();
        return ValueDeclarationNode.simple(name, value);
    }

    private TypeDeclarationNode parseTypeDeclaration(Token name) {
        consume(TokenType.LEFT_BRACE, "'{' after type name '" + name.text() + "'");
        List<FieldDeclarationNode> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token fieldName = consume(TokenType.IDENTIFIER, "a field name or '}'");
            consume(TokenType.COLON, "':' after field name '" + fieldName.text() + "'");
            Token typeName = consume(TokenType.IDENTIFIER, "a field type");
            fields.add(new FieldDeclarationNode(fieldName, typeName));
            endFieldStatement();
        }
        advance(); // consume '}'
        match(TokenType.SEMICOLON);
        return new TypeDeclarationNode(name, fields);
    }

    private List<FieldAssignmentNode> parseAssignmentBlock() {
        consume(TokenType.LEFT_BRACE, "'{' opening the value block");
        List<FieldAssignmentNode> assignments = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            Token fieldName = consume(TokenType.IDENTIFIER, "a field name or '}'");
            consume(TokenType.COLON, "':' after field name '" + fieldName.text() + "'");
            assignments.add(new FieldAssignmentNode(fieldName, parseExpression()));
            endFieldStatement();
        }
        advance(); // consume '}'
        match(TokenType.SEMICOLON);
        return assignments;
    }

    @Override
    public ExpressionNode parseExpression() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER -> {
                advance();
                return new IntLiteralNode((Integer) token.value(), token.location());
            }
            case PIXELS -> {
                advance();
                return new PixelsLiteralNode((Integer) token.value(), token.location());
            }
            case DOUBLE -> {
                advance();
                return new DoubleLiteralNode((Double) token.value(), token.location());
            }
            case TRUE, FALSE -> {
                advance();
                return new BoolLiteralNode((Boolean) token.value(), token.location());
            }
            case HEX_COLOR -> {
                advance();
                return new ColorLiteralNode((String) token.value(), token.location());
            }
            case IDENTIFIER -> {
                advance();
                Optional<IConstructorHandler> handler = constructors.get(token.text());
                if (handler.isPresent()) {
                    return handler.get().parse(this, token);
                }
                return new IdentifierNode(token.text(), token.location());
            }
            default -> throw new ParseException(token.location(), "an expression", token.describe());
        }
    }

    private void endStatement() {
        if (!match(TokenType.SEMICOLON) && !isAtEnd()) {
            throw new ParseException(peek().location(), "';'", peek().describe());
        }
    }

    private void endFieldStatement() {
        if (!match(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE)) {
            throw new ParseException(peek().location(), "';' or '}'", peek().describe());
        }
    }

    private static boolean isTypeName(Token token) {
        return Character.isUpperCase(token.text().charAt(0));
    }

    // --- Token stream navigation ---

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        Token unexpected = peek();
        throw new ParseException(unexpected.location(), expected, unexpected.describe());
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }
}
