package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A resolved {@code name: expression;} value.
 *
 * @param name       The value name.
 * @param module     The declaring module.
 * @param expression The evaluated expression.
 */
public record ResolvedSimple(String name, ModuleId module, ResolvedExpression expression) implements ResolvedValue {

    @Override
    public TypeRef type() {
        return expression.type();
    }

    @Override
    public Set<String> dependencies() {
        Set<String> names = new LinkedHashSet<>();
        expression.collectReferences(names);
        return Collections.unmodifiableSet(names);
    }
}
