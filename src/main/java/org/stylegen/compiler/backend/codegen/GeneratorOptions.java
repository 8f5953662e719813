package org.stylegen.compiler.backend.codegen;

import com.typesafe.config.Config;

/**
 * Naming conventions of the generated C++ headers.
 *
 * @param typesNamespace  Namespace of the host value types and the generated structs.
 * @param valuesNamespace Namespace of the generated instances.
 * @param headerPrefix    Prefix of every header file name, followed by the module file stem.
 * @param coreInclude     The host header declaring the built-in value types, included first.
 */
public record GeneratorOptions(String typesNamespace, String valuesNamespace, String headerPrefix, String coreInclude) {

    public static GeneratorOptions defaults() {
        return new GeneratorOptions("style", "st", "style_", "style/style_core.h");
    }

    /**
     * Reads the options from a {@code generator} config block:
     * <pre>
     * generator {
     *   types-namespace = "style"
     *   values-namespace = "st"
     *   header-prefix = "style_"
     *   core-include = "style/style_core.h"
     * }
     * </pre>
     *
     * @param config The {@code generator} block.
     * @return The options.
     */
    public static GeneratorOptions fromConfig(Config config) {
        return new GeneratorOptions(
                config.getString("types-namespace"),
                config.getString("values-namespace"),
                config.getString("header-prefix"),
                config.getString("core-include"));
    }
}
