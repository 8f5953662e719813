package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.StructShape;
import org.stylegen.compiler.frontend.semantics.TypeRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A resolved structure value: a typed instantiation or an anonymous group.
 *
 * <p>The field table is immutable. Values inheriting from this one start from a copy
 * obtained through {@link #fieldTable()}, so a derived value can never change its base.</p>
 *
 * @param name         The value name.
 * @param module       The declaring module.
 * @param declaredType The type named in the declaration, empty for anonymous groups.
 * @param base         The value inherited from, if any.
 * @param shape        The final shape: declared type fields, inherited extra fields, then new fields.
 * @param fields       The field values in shape order.
 * @param type         {@code Named(declaredType)} when the shape equals the declared type's shape,
 *                     otherwise the value's own inferred shape.
 */
public record ResolvedStructure(
        String name,
        ModuleId module,
        Optional<String> declaredType,
        Optional<String> base,
        StructShape shape,
        Map<String, ResolvedExpression> fields,
        TypeRef type
) implements ResolvedValue {

    public ResolvedStructure {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * @return True if the value has no nominal type of its own: an anonymous group, or a
     *         typed value that added fields beyond its declared type.
     */
    public boolean isWidened() {
        return !(type() instanceof TypeRef.Named);
    }

    public ResolvedExpression field(String fieldName) {
        return fields.get(fieldName);
    }

    /**
     * @return A mutable copy of the field table in shape order.
     */
    public LinkedHashMap<String, ResolvedExpression> fieldTable() {
        return new LinkedHashMap<>(fields);
    }

    @Override
    public Set<String> dependencies() {
        Set<String> names = new LinkedHashSet<>();
        base.ifPresent(names::add);
        for (ResolvedExpression expression : fields.values()) {
            expression.collectReferences(names);
        }
        return Collections.unmodifiableSet(names);
    }
}
