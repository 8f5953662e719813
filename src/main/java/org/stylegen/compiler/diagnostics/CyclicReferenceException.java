package org.stylegen.compiler.diagnostics;

import java.util.List;

/**
 * Thrown when value inheritance or value references loop back to a value that is still being
 * resolved, or when a structure type contains itself.
 */
public class CyclicReferenceException extends StyleCompilationException {

    private final List<String> cycle;

    /**
     * @param location Declaration that closes the cycle.
     * @param cycle    The names along the cycle, first and last entry equal.
     */
    public CyclicReferenceException(SourceLocation location, List<String> cycle) {
        super(CompilerErrorCode.CYCLIC_REFERENCE, location, "Cyclic reference: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
