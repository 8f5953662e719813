package org.stylegen.compiler.backend.codegen;

import org.stylegen.compiler.frontend.semantics.ModuleId;

/**
 * One generated header.
 *
 * @param module   The module it was generated from.
 * @param fileName The header file name, without directories.
 * @param content  The header text.
 */
public record GeneratedFile(ModuleId module, String fileName, String content) {
}
