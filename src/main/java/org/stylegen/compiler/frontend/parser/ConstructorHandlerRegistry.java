package org.stylegen.compiler.frontend.parser;

import org.stylegen.compiler.frontend.parser.features.align.AlignConstructorHandler;
import org.stylegen.compiler.frontend.parser.features.font.FontConstructorHandler;
import org.stylegen.compiler.frontend.parser.features.geometry.GeometryConstructorHandler;
import org.stylegen.compiler.frontend.parser.features.icon.IconConstructorHandler;
import org.stylegen.compiler.frontend.semantics.BuiltinKind;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for constructor handlers.
 * Maps constructor names (e.g., "margins", "icon") to their handlers.
 */
public class ConstructorHandlerRegistry {

    private final Map<String, IConstructorHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a constructor name.
     * @param name    The constructor name as written in source.
     * @param handler The handler for this constructor.
     */
    public void register(String name, IConstructorHandler handler) {
        handlers.put(name, handler);
    }

    /**
     * Looks up the handler for a constructor name.
     * @param name The identifier text.
     * @return The handler, or empty if the identifier is not a constructor.
     */
    public Optional<IConstructorHandler> get(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    /**
     * Creates a registry with all built-in constructor handlers.
     * @return A new registry instance.
     */
    public static ConstructorHandlerRegistry initialize() {
        ConstructorHandlerRegistry registry = new ConstructorHandlerRegistry();
        registry.register(BuiltinKind.MARGINS.keyword(), new GeometryConstructorHandler(BuiltinKind.MARGINS, 4));
        registry.register(BuiltinKind.SIZE.keyword(), new GeometryConstructorHandler(BuiltinKind.SIZE, 2));
        registry.register(BuiltinKind.POINT.keyword(), new GeometryConstructorHandler(BuiltinKind.POINT, 2));
        registry.register(BuiltinKind.ALIGN.keyword(), new AlignConstructorHandler());
        registry.register(BuiltinKind.FONT.keyword(), new FontConstructorHandler());
        registry.register(BuiltinKind.ICON.keyword(), new IconConstructorHandler());
        return registry;
    }
}
