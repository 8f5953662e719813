package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.module.CompilationUnit;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.SymbolTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A compilation unit with every value resolved; the input of code generation.
 *
 * @param unit    The module graph.
 * @param symbols The type registry, used for declared type shapes.
 * @param values  Every resolved value by name, in declaration order.
 */
public record ResolvedUnit(CompilationUnit unit, SymbolTable symbols, Map<String, ResolvedValue> values) {

    public ResolvedUnit {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public ResolvedValue value(String name) {
        return values.get(name);
    }

    /**
     * @param module A module of the unit.
     * @return The values declared in that module, in declaration order.
     */
    public List<ResolvedValue> valuesOf(ModuleId module) {
        return values.values().stream().filter(v -> v.module().equals(module)).toList();
    }
}
