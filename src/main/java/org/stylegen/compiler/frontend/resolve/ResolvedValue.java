package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Set;

/**
 * The result of resolving one value declaration.
 */
public sealed interface ResolvedValue permits ResolvedStructure, ResolvedSimple {

    String name();

    ModuleId module();

    /**
     * @return The value's type: the built-in kind of a simple value, the declared type of a
     *         structure whose shape matches it exactly, otherwise the structure's own shape.
     */
    TypeRef type();

    /**
     * @return The values this value refers to or inherits from, in first-use order.
     */
    Set<String> dependencies();
}
