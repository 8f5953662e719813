package org.stylegen.compiler.frontend.parser.features.font;

import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.model.FontFlag;

import java.util.Optional;
import java.util.Set;

/**
 * A {@code font(size, flag..., "family")} call.
 *
 * @param size     The pixel size expression.
 * @param flags    The style flags, iteration order follows {@link FontFlag} declaration order.
 * @param family   The font family, if given.
 * @param location The position of the constructor name.
 */
public record FontNode(ExpressionNode size, Set<FontFlag> flags, Optional<String> family, SourceLocation location)
        implements ExpressionNode {
}
