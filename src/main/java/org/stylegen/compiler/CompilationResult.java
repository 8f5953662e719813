package org.stylegen.compiler;

import org.stylegen.compiler.backend.codegen.GeneratedFile;
import org.stylegen.compiler.frontend.resolve.ResolvedUnit;

import java.util.List;

/**
 * The outcome of a successful compilation, not yet written to disk.
 *
 * @param unit  The resolved unit.
 * @param files The generated headers.
 */
public record CompilationResult(ResolvedUnit unit, List<GeneratedFile> files) {

    public CompilationResult {
        files = List.copyOf(files);
    }
}
