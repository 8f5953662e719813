package org.stylegen.compiler.backend.codegen;

import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.SourceModule;
import org.stylegen.compiler.frontend.parser.ast.TypeDeclarationNode;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.stylegen.compiler.frontend.resolve.ResolvedSimple;
import org.stylegen.compiler.frontend.resolve.ResolvedStructure;
import org.stylegen.compiler.frontend.resolve.ResolvedUnit;
import org.stylegen.compiler.frontend.resolve.ResolvedValue;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.StructShape;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emits one C++ header per style module.
 *
 * <p>A header contains, in this order: an include of the host core header and of the headers of
 * the directly imported modules, the module's structure types in dependency order followed by
 * the structs synthesized for anonymous and widened values, and one {@code inline const}
 * instance per value in dependency order.</p>
 *
 * <p>Output only depends on the resolved unit: every collection walked here is ordered.</p>
 */
public class CppCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CppCodeGenerator.class);

    private final GeneratorOptions options;

    public CppCodeGenerator(GeneratorOptions options) {
        this.options = options;
    }

    /**
     * @param unit The resolved compilation unit.
     * @return One header per module, in topological module order.
     * @throws DuplicateDeclarationException if two modules map to the same header file name.
     */
    public List<GeneratedFile> generate(ResolvedUnit unit) {
        Map<String, ModuleId> headers = new HashMap<>();
        // Value name to the struct synthesized for its shape, filled module by module.
        Map<String, String> synthesizedStructs = new HashMap<>();
        // Every struct name in the types namespace, declared or synthesized.
        Set<String> structNames = new HashSet<>();
        unit.symbols().types().forEach(type -> structNames.add(type.name()));
        CppExpressionWriter expressions = new CppExpressionWriter(options, unit.symbols(), synthesizedStructs);

        List<GeneratedFile> files = new ArrayList<>();
        for (SourceModule module : unit.unit().topologicalOrder()) {
            String header = headerName(module.id());
            ModuleId previous = headers.putIfAbsent(header, module.id());
            if (previous != null) {
                throw new DuplicateDeclarationException(SourceLocation.ofFile(module.id().path()), header,
                        SourceLocation.ofFile(previous.path()));
            }
            String content = new ModuleWriter(unit, module, expressions, synthesizedStructs, structNames).write();
            files.add(new GeneratedFile(module.id(), header, content));
            log.debug("Generated {} for {}", header, module.id());
        }
        return files;
    }

    /**
     * @param module A module.
     * @return The header file name, e.g. {@code style_buttons.h} for {@code ui/buttons.style}.
     */
    public String headerName(ModuleId module) {
        return options.headerPrefix() + module.stem() + ".h";
    }

    private final class ModuleWriter {

        private final ResolvedUnit unit;
        private final SourceModule module;
        private final CppExpressionWriter expressions;
        private final Map<String, String> synthesizedStructs;
        private final Set<String> structNames;
        private final SymbolTable symbols;
        private final StringBuilder out = new StringBuilder();

        ModuleWriter(ResolvedUnit unit, SourceModule module, CppExpressionWriter expressions,
                     Map<String, String> synthesizedStructs, Set<String> structNames) {
            this.unit = unit;
            this.module = module;
            this.expressions = expressions;
            this.synthesizedStructs = synthesizedStructs;
            this.structNames = structNames;
            this.symbols = unit.symbols();
        }

        String write() {
            out.append("// Generated by stylegen from ")
                    .append(Path.of(module.id().path()).getFileName())
                    .append(". Do not edit.\n");
            out.append("#pragma once\n\n");
            out.append("#include \"").append(options.coreInclude()).append("\"\n");
            for (ModuleId imported : unit.unit().directImports().getOrDefault(module.id(), List.of())) {
                out.append("#include \"").append(headerName(imported)).append("\"\n");
            }

            List<ResolvedValue> values = valuesInDependencyOrder();
            writeTypes(values);
            writeValues(values);
            return out.toString();
        }

        private void writeTypes(List<ResolvedValue> values) {
            List<String> structs = new ArrayList<>();
            for (String typeName : typesInDependencyOrder()) {
                structs.add(struct(typeName, symbols.shapeOf(typeName)));
            }

            Map<String, StructShape> localShapes = new LinkedHashMap<>();
            for (ResolvedValue value : values) {
                if (!(value instanceof ResolvedStructure structure) || !structure.isWidened()) {
                    continue;
                }
                String existing = null;
                for (Map.Entry<String, StructShape> shape : localShapes.entrySet()) {
                    if (shape.getValue().sameAs(structure.shape())) {
                        existing = shape.getKey();
                        break;
                    }
                }
                if (existing == null) {
                    existing = uniqueStructName(structure.declaredType()
                            .map(type -> type + "_" + structure.name())
                            .orElse(structure.name() + "_shape"));
                    localShapes.put(existing, structure.shape());
                    // Register before rendering member types so later shapes can refer to it.
                    synthesizedStructs.put(structure.name(), existing);
                    structs.add(struct(existing, structure.shape()));
                } else {
                    synthesizedStructs.put(structure.name(), existing);
                }
            }

            if (structs.isEmpty()) {
                return;
            }
            out.append("\nnamespace ").append(options.typesNamespace()).append(" {\n");
            for (String struct : structs) {
                out.append('\n').append(struct);
            }
            out.append("\n} // namespace ").append(options.typesNamespace()).append('\n');
        }

        /**
         * Appends {@code _2}, {@code _3}, ... while the name is taken by a declared type or an
         * earlier synthesized struct, then reserves it.
         */
        private String uniqueStructName(String preferred) {
            String name = preferred;
            for (int suffix = 2; structNames.contains(name); suffix++) {
                name = preferred + "_" + suffix;
            }
            structNames.add(name);
            return name;
        }

        private String struct(String name, StructShape shape) {
            StringBuilder struct = new StringBuilder();
            struct.append("struct ").append(name).append(" {\n");
            for (StructShape.Field field : shape.fields()) {
                struct.append("    ").append(expressions.cppType(field.type())).append(' ')
                        .append(field.name()).append(";\n");
            }
            struct.append("};\n");
            return struct.toString();
        }

        private void writeValues(List<ResolvedValue> values) {
            if (values.isEmpty()) {
                return;
            }
            out.append("\nnamespace ").append(options.valuesNamespace()).append(" {\n\n");
            for (ResolvedValue value : values) {
                String type = expressions.cppType(value.type());
                out.append("inline const ").append(type).append(' ').append(value.name()).append(" = ");
                if (value instanceof ResolvedSimple simple) {
                    out.append(expressions.render(simple.expression(), simple.type())).append(";\n");
                } else if (value instanceof ResolvedStructure structure) {
                    writeInitializer(structure);
                }
            }
            out.append("\n} // namespace ").append(options.valuesNamespace()).append('\n');
        }

        private void writeInitializer(ResolvedStructure structure) {
            if (structure.shape().fields().isEmpty()) {
                out.append("{};\n");
                return;
            }
            out.append("{\n");
            for (StructShape.Field field : structure.shape().fields()) {
                ResolvedExpression value = structure.field(field.name());
                out.append("    .").append(field.name()).append(" = ")
                        .append(expressions.render(value, field.type())).append(",\n");
            }
            out.append("};\n");
        }

        /**
         * Declared types of this module, each after the same-module types its fields use.
         */
        private List<String> typesInDependencyOrder() {
            Set<String> ordered = new LinkedHashSet<>();
            for (TypeDeclarationNode type : module.typeDeclarations()) {
                visitType(type.nameText(), ordered);
            }
            return new ArrayList<>(ordered);
        }

        private void visitType(String typeName, Set<String> ordered) {
            if (ordered.contains(typeName)) return;
            for (StructShape.Field field : symbols.shapeOf(typeName).fields()) {
                if (field.type() instanceof TypeRef.Named named && isLocalType(named.name())) {
                    visitType(named.name(), ordered);
                }
            }
            ordered.add(typeName);
        }

        private boolean isLocalType(String typeName) {
            return symbols.findType(typeName).map(t -> t.module().equals(module.id())).orElse(false);
        }

        /**
         * Values of this module, each after the same-module values it references or inherits from.
         * Shape validation and cycle checks already ran, so the walk terminates.
         */
        private List<ResolvedValue> valuesInDependencyOrder() {
            Set<String> ordered = new LinkedHashSet<>();
            for (ResolvedValue value : unit.valuesOf(module.id())) {
                visitValue(value, ordered);
            }
            return ordered.stream().map(unit::value).toList();
        }

        private void visitValue(ResolvedValue value, Set<String> ordered) {
            if (ordered.contains(value.name())) return;
            for (String dependency : value.dependencies()) {
                ResolvedValue target = unit.value(dependency);
                if (target != null && target.module().equals(module.id())) {
                    visitValue(target, ordered);
                }
            }
            ordered.add(value.name());
        }
    }
}
