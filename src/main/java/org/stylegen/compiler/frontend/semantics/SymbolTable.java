package org.stylegen.compiler.frontend.semantics;

import org.stylegen.compiler.diagnostics.CyclicReferenceException;
import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.ReservedNameException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.diagnostics.UndefinedNameException;
import org.stylegen.compiler.frontend.module.CompilationUnit;
import org.stylegen.compiler.frontend.module.QualifiedDeclaration;
import org.stylegen.compiler.frontend.parser.ast.FieldDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.stylegen.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The registry of structure types and value declarations of one compilation.
 *
 * <p>Names live in a single global namespace, but a lookup made on behalf of a module only
 * succeeds for declarations in that module or one of its transitive imports. Built-in type
 * keywords are always visible and can never be redeclared.</p>
 *
 * <p>The table is filled once and then only read; {@link #validateTypes()} must run before
 * {@link #shapeOf(String)} is used.</p>
 */
public class SymbolTable {

    private final Map<String, TypeSymbol> types = new LinkedHashMap<>();
    private final Map<String, ValueSymbol> values = new LinkedHashMap<>();
    private final Map<String, StructShape> shapes = new HashMap<>();
    private final Map<ModuleId, Set<ModuleId>> visibility = new HashMap<>();

    /**
     * Builds and validates the table for a resolved module graph.
     *
     * @param unit The compilation unit.
     * @return The populated table with all structure shapes computed.
     */
    public static SymbolTable from(CompilationUnit unit) {
        SymbolTable table = new SymbolTable();
        unit.visibleModules().forEach(table::setVisibility);
        for (QualifiedDeclaration qualified : unit.declarations()) {
            if (qualified.declaration() instanceof TypeDeclarationNode type) {
                table.registerType(type, qualified.module());
            } else if (qualified.declaration() instanceof ValueDeclarationNode value) {
                table.registerValue(value, qualified.module());
            }
        }
        table.validateTypes();
        return table;
    }

    // === Registration ===

    /**
     * @param module  A module.
     * @param visible The modules whose declarations {@code module} may reference, itself included.
     */
    public void setVisibility(ModuleId module, Set<ModuleId> visible) {
        visibility.put(module, Set.copyOf(visible));
    }

    /**
     * Registers a structure type.
     *
     * @param declaration The type declaration.
     * @param module      The declaring module.
     * @throws ReservedNameException         if the name is a built-in keyword.
     * @throws DuplicateDeclarationException if the name is already taken.
     */
    public void registerType(TypeDeclarationNode declaration, ModuleId module) {
        Token name = declaration.name();
        checkNameAvailable(name);
        types.put(name.text(), new TypeSymbol(name.text(), module, declaration));
    }

    /**
     * Registers a value declaration.
     *
     * @param declaration The value declaration.
     * @param module      The declaring module.
     * @throws ReservedNameException         if the name is a built-in keyword.
     * @throws DuplicateDeclarationException if the name is already taken.
     */
    public void registerValue(ValueDeclarationNode declaration, ModuleId module) {
        Token name = declaration.name();
        checkNameAvailable(name);
        values.put(name.text(), new ValueSymbol(name.text(), module, declaration));
    }

    private void checkNameAvailable(Token name) {
        if (BuiltinKind.isReserved(name.text())) {
            throw new ReservedNameException(name.location(),
                    "'" + name.text() + "' is a built-in type name and cannot be declared");
        }
        SourceLocation existing = null;
        if (types.containsKey(name.text())) {
            existing = types.get(name.text()).declaration().location();
        } else if (values.containsKey(name.text())) {
            existing = values.get(name.text()).declaration().location();
        }
        if (existing != null) {
            throw new DuplicateDeclarationException(name.location(), name.text(), existing);
        }
    }

    // === Type lookup ===

    /**
     * Resolves a type name written in a field or value declaration.
     *
     * @param name The type name token.
     * @param from The module the name is written in.
     * @return The built-in or named type.
     * @throws UndefinedNameException if no such type exists or it is not visible from {@code from}.
     */
    public TypeRef lookupType(Token name, ModuleId from) {
        Optional<BuiltinKind> builtin = BuiltinKind.fromKeyword(name.text());
        if (builtin.isPresent()) {
            return TypeRef.of(builtin.get());
        }
        TypeSymbol symbol = types.get(name.text());
        if (symbol == null) {
            throw new UndefinedNameException(name.location(), name.text(), "Undefined type '" + name.text() + "'");
        }
        requireVisible(symbol.module(), from, name.location(), name.text());
        return new TypeRef.Named(symbol.name());
    }

    /**
     * Resolves a type name regardless of module visibility.
     *
     * @param name A built-in keyword or declared type name.
     * @return The built-in or named type.
     * @throws UndefinedNameException if no such type exists.
     */
    public TypeRef lookupType(String name) {
        Optional<BuiltinKind> builtin = BuiltinKind.fromKeyword(name);
        if (builtin.isPresent()) {
            return TypeRef.of(builtin.get());
        }
        return findType(name)
                .<TypeRef>map(symbol -> new TypeRef.Named(symbol.name()))
                .orElseThrow(() -> new UndefinedNameException(null, name, "Undefined type '" + name + "'"));
    }

    public Optional<TypeSymbol> findType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * @param typeName A declared structure type.
     * @return Its field list.
     * @throws IllegalStateException if the type is unknown or {@link #validateTypes()} has not run.
     */
    public StructShape shapeOf(String typeName) {
        StructShape shape = shapes.get(typeName);
        if (shape == null) {
            throw new IllegalStateException("No shape for type '" + typeName + "'");
        }
        return shape;
    }

    // === Value lookup ===

    /**
     * Resolves a value name referenced from a module.
     *
     * @param name     The referenced name.
     * @param from     The referencing module.
     * @param location Where the reference is written.
     * @return The value symbol.
     * @throws UndefinedNameException if no such value exists or it is not visible from {@code from}.
     */
    public ValueSymbol lookupValue(String name, ModuleId from, SourceLocation location) {
        ValueSymbol symbol = values.get(name);
        if (symbol == null) {
            throw new UndefinedNameException(location, name);
        }
        requireVisible(symbol.module(), from, location, name);
        return symbol;
    }

    /**
     * Resolves a value name regardless of module visibility.
     *
     * @param name A value name.
     * @return The value symbol.
     * @throws UndefinedNameException if no value has this name.
     */
    public ValueSymbol lookupValue(String name) {
        return findValue(name).orElseThrow(() -> new UndefinedNameException(null, name));
    }

    /**
     * @param name A value name.
     * @return The symbol regardless of visibility.
     */
    public Optional<ValueSymbol> findValue(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @param name A value name.
     * @param from The referencing module.
     * @return The symbol if it exists and is visible from {@code from}.
     */
    public Optional<ValueSymbol> findVisibleValue(String name, ModuleId from) {
        ValueSymbol symbol = values.get(name);
        if (symbol == null || !isVisible(symbol.module(), from)) {
            return Optional.empty();
        }
        return Optional.of(symbol);
    }

    public Collection<TypeSymbol> types() {
        return Collections.unmodifiableCollection(types.values());
    }

    public Collection<ValueSymbol> values() {
        return Collections.unmodifiableCollection(values.values());
    }

    private boolean isVisible(ModuleId declaring, ModuleId from) {
        Set<ModuleId> visible = visibility.get(from);
        // Tables built without a module graph see everything.
        return visible == null || visible.contains(declaring);
    }

    private void requireVisible(ModuleId declaring, ModuleId from, SourceLocation location, String name) {
        if (!isVisible(declaring, from)) {
            throw new UndefinedNameException(location, name,
                    "'" + name + "' is declared in " + declaring + " which is not imported by " + from);
        }
    }

    // === Validation ===

    /**
     * Computes the shape of every registered type. Checks that field names are unique within
     * a type, that every field type exists and is visible, and that no type contains itself
     * through its fields.
     *
     * @throws DuplicateDeclarationException on a repeated field name.
     * @throws UndefinedNameException        on an unknown field type.
     * @throws CyclicReferenceException      on a recursive structure type.
     */
    public void validateTypes() {
        shapes.clear();
        for (TypeSymbol symbol : types.values()) {
            Map<String, FieldDeclarationNode> seen = new LinkedHashMap<>();
            List<StructShape.Field> fields = new ArrayList<>();
            for (FieldDeclarationNode field : symbol.declaration().fields()) {
                FieldDeclarationNode previous = seen.putIfAbsent(field.name().text(), field);
                if (previous != null) {
                    throw new DuplicateDeclarationException(field.name().location(), field.name().text(),
                            previous.name().location());
                }
                fields.add(new StructShape.Field(field.name().text(), lookupType(field.typeName(), symbol.module())));
            }
            shapes.put(symbol.name(), new StructShape(fields));
        }

        Set<String> done = new LinkedHashSet<>();
        for (TypeSymbol symbol : types.values()) {
            checkContainment(symbol.name(), new LinkedHashSet<>(), done);
        }
    }

    private void checkContainment(String typeName, LinkedHashSet<String> path, Set<String> done) {
        if (done.contains(typeName)) return;
        if (path.contains(typeName)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String onPath : path) {
                inCycle |= onPath.equals(typeName);
                if (inCycle) cycle.add(onPath);
            }
            cycle.add(typeName);
            throw new CyclicReferenceException(types.get(typeName).declaration().location(), cycle);
        }
        path.add(typeName);
        for (StructShape.Field field : shapes.get(typeName).fields()) {
            if (field.type() instanceof TypeRef.Named named) {
                checkContainment(named.name(), path, done);
            }
        }
        path.remove(typeName);
        done.add(typeName);
    }
}
