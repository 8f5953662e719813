package org.stylegen.compiler.frontend.semantics;

import java.util.List;
import java.util.Optional;

/**
 * The ordered field list a structure value must satisfy. Field names are unique.
 *
 * @param fields The fields in first-declared order.
 */
public record StructShape(List<Field> fields) {

    /**
     * @param name The field name.
     * @param type The field type.
     */
    public record Field(String name, TypeRef type) {}

    public StructShape {
        fields = List.copyOf(fields);
        long distinct = fields.stream().map(Field::name).distinct().count();
        if (distinct != fields.size()) {
            throw new IllegalArgumentException("Duplicate field names in shape " + fields);
        }
    }

    public Optional<Field> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public List<String> fieldNames() {
        return fields.stream().map(Field::name).toList();
    }

    /**
     * Checks structural widening: this shape has every field of {@code narrower}
     * with the same type, possibly plus more.
     *
     * @param narrower The shape that must be contained.
     * @return True if this shape can be used where {@code narrower} is expected.
     */
    public boolean containsAllOf(StructShape narrower) {
        for (Field expected : narrower.fields) {
            Optional<Field> actual = field(expected.name());
            if (actual.isEmpty() || !actual.get().type().sameAs(expected.type())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param other Another shape.
     * @return True if both shapes have the same fields, types and order.
     */
    public boolean sameAs(StructShape other) {
        if (other.fields.size() != fields.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            Field mine = fields.get(i);
            Field theirs = other.fields.get(i);
            if (!mine.name().equals(theirs.name()) || !mine.type().sameAs(theirs.type())) {
                return false;
            }
        }
        return true;
    }
}
