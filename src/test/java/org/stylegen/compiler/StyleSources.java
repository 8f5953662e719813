package org.stylegen.compiler;

import org.stylegen.compiler.frontend.lexer.Lexer;
import org.stylegen.compiler.frontend.parser.Parser;
import org.stylegen.compiler.frontend.parser.ast.DeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.SymbolTable;

/**
 * Builds parse trees and symbol tables from in-memory style sources.
 */
public final class StyleSources {

    public static final ModuleId MAIN = new ModuleId("/styles/main.style");

    private StyleSources() {
    }

    public static SourceModule parse(String source) {
        return parse(source, MAIN);
    }

    public static SourceModule parse(String source, ModuleId module) {
        return new Parser(new Lexer(source, module.path()).scanTokens(), module).parse();
    }

    /**
     * Registers every declaration of a single module and validates the types.
     * Without visibility entries every declaration is visible.
     */
    public static SymbolTable symbols(String source) {
        SymbolTable table = new SymbolTable();
        register(table, parse(source));
        table.validateTypes();
        return table;
    }

    public static void register(SymbolTable table, SourceModule module) {
        for (DeclarationNode declaration : module.declarations()) {
            if (declaration instanceof TypeDeclarationNode type) {
                table.registerType(type, module.id());
            } else if (declaration instanceof ValueDeclarationNode value) {
                table.registerValue(value, module.id());
            }
        }
    }
}
