package org.stylegen.compiler.frontend.resolve;

import org.stylegen.compiler.color.ColorSource;
import org.stylegen.compiler.diagnostics.CyclicReferenceException;
import org.stylegen.compiler.diagnostics.DuplicateDeclarationException;
import org.stylegen.compiler.diagnostics.MissingFieldException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.diagnostics.TypeMismatchException;
import org.stylegen.compiler.diagnostics.UndefinedNameException;
import org.stylegen.compiler.frontend.parser.ast.ExpressionNode;
import org.stylegen.compiler.frontend.parser.ast.FieldAssignmentNode;
import org.stylegen.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.stylegen.compiler.frontend.parser.ast.ValueForm;
import org.stylegen.compiler.frontend.semantics.ModuleId;
import org.stylegen.compiler.frontend.semantics.StructShape;
import org.stylegen.compiler.frontend.semantics.SymbolTable;
import org.stylegen.compiler.frontend.semantics.TypeRef;
import org.stylegen.compiler.frontend.semantics.ValueSymbol;
import org.stylegen.compiler.icons.IconAssetResolver;
import org.stylegen.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves value declarations into {@link ResolvedValue}s on demand.
 *
 * <p>Resolution order follows the reference graph, not source order: resolving a value first
 * resolves its base and every value its expressions reference. Each value is resolved at most
 * once and memoized. A value that is reached again while it is still being resolved closes a
 * cycle and fails with {@link CyclicReferenceException}.</p>
 *
 * <p>A structure value is built in these steps:</p>
 * <ol>
 *   <li>the declared type's fields seed the shape;</li>
 *   <li>the base, if any, is resolved and must be a structure (or a simple value aliasing one)
 *       containing every declared type field with the same type; its extra fields are kept and
 *       its field table is copied;</li>
 *   <li>local assignments are evaluated in order against the field type, new fields widen the
 *       shape with the type of their expression;</li>
 *   <li>any declared type field still without a value is missing.</li>
 * </ol>
 *
 * <p>All access to the memoization cache is serialized by one engine-wide lock. A thread asking
 * for a value another thread is resolving waits for the lock and then reads the cached result.</p>
 */
public class ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    /**
     * Resolution state of a value name.
     */
    public enum Status {
        UNRESOLVED,
        IN_PROGRESS,
        RESOLVED
    }

    private final SymbolTable symbols;
    private final ColorSource colors;
    private final IconAssetResolver icons;
    private final ExpressionEvaluatorRegistry evaluators;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Status> status = new HashMap<>();
    private final Map<String, ResolvedValue> resolved = new HashMap<>();
    private final List<String> resolutionStack = new ArrayList<>();

    public ResolutionEngine(SymbolTable symbols, ColorSource colors, IconAssetResolver icons,
                            ExpressionEvaluatorRegistry evaluators) {
        this.symbols = symbols;
        this.colors = colors;
        this.icons = icons;
        this.evaluators = evaluators;
    }

    public ResolutionEngine(SymbolTable symbols, ColorSource colors, IconAssetResolver icons) {
        this(symbols, colors, icons, ExpressionEvaluatorRegistry.initializeWithDefaults());
    }

    /**
     * Resolves a value by name, regardless of module visibility.
     *
     * @param name The value name.
     * @return The resolved value.
     * @throws UndefinedNameException if no value has this name.
     * @throws org.stylegen.compiler.diagnostics.StyleCompilationException on any resolution error.
     */
    public ResolvedValue resolve(String name) {
        ValueSymbol symbol = symbols.lookupValue(name);
        lock.lock();
        try {
            return resolveSymbol(symbol, symbol.declaration().location());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves every registered value.
     *
     * @return The resolved values by name, in declaration order.
     */
    public Map<String, ResolvedValue> resolveAll() {
        Map<String, ResolvedValue> all = new LinkedHashMap<>();
        for (ValueSymbol symbol : symbols.values()) {
            all.put(symbol.name(), resolve(symbol.name()));
        }
        log.debug("Resolved {} value(s)", all.size());
        return all;
    }

    /**
     * @param name A value name.
     * @return Its current resolution state.
     */
    public Status status(String name) {
        lock.lock();
        try {
            return status.getOrDefault(name, Status.UNRESOLVED);
        } finally {
            lock.unlock();
        }
    }

    // === Resolution (lock held) ===

    private ResolvedValue resolveSymbol(ValueSymbol symbol, SourceLocation referencedAt) {
        String name = symbol.name();
        Status current = status.getOrDefault(name, Status.UNRESOLVED);
        if (current == Status.RESOLVED) {
            return resolved.get(name);
        }
        if (current == Status.IN_PROGRESS) {
            List<String> cycle = new ArrayList<>(resolutionStack.subList(resolutionStack.indexOf(name),
                    resolutionStack.size()));
            cycle.add(name);
            throw new CyclicReferenceException(referencedAt, cycle);
        }

        status.put(name, Status.IN_PROGRESS);
        resolutionStack.add(name);
        try {
            ValueDeclarationNode declaration = symbol.declaration();
            ResolvedValue value = declaration.form() == ValueForm.SIMPLE
                    ? resolveSimple(symbol)
                    : resolveStructure(symbol);
            resolved.put(name, value);
            status.put(name, Status.RESOLVED);
            log.debug("Resolved value '{}' as {}", name, value.type().displayName());
            return value;
        } catch (RuntimeException e) {
            status.remove(name);
            throw e;
        } finally {
            resolutionStack.remove(resolutionStack.size() - 1);
        }
    }

    private ResolvedValue resolveSimple(ValueSymbol symbol) {
        ValueDeclarationNode declaration = symbol.declaration();
        ExpressionNode expression = declaration.simpleValue().orElseThrow();
        ResolvedExpression value = new Context(symbol.module()).evaluate(expression, symbol.name(), Optional.empty());
        return new ResolvedSimple(symbol.name(), symbol.module(), value);
    }

    private ResolvedValue resolveStructure(ValueSymbol symbol) {
        ValueDeclarationNode declaration = symbol.declaration();
        ModuleId module = symbol.module();
        Context context = new Context(module);

        Map<String, TypeRef> shapeFields = new LinkedHashMap<>();
        Map<String, ResolvedExpression> table = new LinkedHashMap<>();

        Optional<String> declaredType = Optional.empty();
        StructShape declaredShape = null;
        if (declaration.typeName().isPresent()) {
            Token typeName = declaration.typeName().get();
            TypeRef type = symbols.lookupType(typeName, module);
            if (!(type instanceof TypeRef.Named named)) {
                throw new TypeMismatchException(typeName.location(), symbol.name(), "a structure type",
                        type.displayName());
            }
            declaredType = Optional.of(named.name());
            declaredShape = symbols.shapeOf(named.name());
            for (StructShape.Field field : declaredShape.fields()) {
                shapeFields.put(field.name(), field.type());
            }
        }

        Optional<String> baseName = declaration.baseName().map(Token::text);
        if (declaration.baseName().isPresent()) {
            Token baseToken = declaration.baseName().get();
            ValueSymbol baseSymbol = symbols.lookupValue(baseToken.text(), module, baseToken.location());
            ResolvedValue base = resolveSymbol(baseSymbol, baseToken.location());
            Optional<String> expectedType = declaredType;
            ResolvedStructure baseStructure = TypeRules.structureOf(base)
                    .orElseThrow(() -> new TypeMismatchException(baseToken.location(), baseToken.text(),
                            expectedType.orElse("a structure"), base.type().displayName()));
            List<StructShape.Field> requiredFields = declaredShape != null ? declaredShape.fields() : List.of();
            for (StructShape.Field required : requiredFields) {
                Optional<StructShape.Field> inherited = baseStructure.shape().field(required.name());
                if (inherited.isEmpty()) {
                    throw new TypeMismatchException(baseToken.location(), required.name(),
                            required.type().displayName(), "nothing in base '" + baseToken.text() + "'");
                }
                if (!inherited.get().type().sameAs(required.type())) {
                    throw new TypeMismatchException(baseToken.location(), required.name(),
                            required.type().displayName(), inherited.get().type().displayName());
                }
            }
            for (StructShape.Field field : baseStructure.shape().fields()) {
                shapeFields.putIfAbsent(field.name(), field.type());
            }
            table.putAll(baseStructure.fieldTable());
        }

        Map<String, SourceLocation> assignedHere = new HashMap<>();
        for (FieldAssignmentNode assignment : declaration.assignments()) {
            String field = assignment.name().text();
            SourceLocation previous = assignedHere.putIfAbsent(field, assignment.location());
            if (previous != null) {
                throw new DuplicateDeclarationException(assignment.location(), field, previous);
            }
            Optional<TypeRef> expected = Optional.ofNullable(shapeFields.get(field));
            ResolvedExpression value = context.evaluate(assignment.value(), field, expected);
            if (expected.isEmpty()) {
                shapeFields.put(field, value.type());
            }
            table.put(field, value);
        }

        for (String field : shapeFields.keySet()) {
            if (!table.containsKey(field)) {
                throw new MissingFieldException(declaration.location(), symbol.name(), field);
            }
        }

        List<StructShape.Field> fields = new ArrayList<>();
        Map<String, ResolvedExpression> ordered = new LinkedHashMap<>();
        shapeFields.forEach((field, type) -> {
            fields.add(new StructShape.Field(field, type));
            ordered.put(field, table.get(field));
        });
        StructShape shape = new StructShape(fields);
        TypeRef type = declaredShape != null && declaredShape.sameAs(shape)
                ? new TypeRef.Named(declaredType.get())
                : new TypeRef.Inferred(symbol.name(), shape);
        return new ResolvedStructure(symbol.name(), module, declaredType, baseName, shape, ordered, type);
    }

    /**
     * Evaluation context for the expressions of one value.
     */
    private final class Context implements EvaluationContext {

        private final ModuleId module;

        private Context(ModuleId module) {
            this.module = module;
        }

        @Override
        public ModuleId module() {
            return module;
        }

        @Override
        public SymbolTable symbols() {
            return symbols;
        }

        @Override
        public ColorSource colors() {
            return colors;
        }

        @Override
        public IconAssetResolver icons() {
            return icons;
        }

        @Override
        public ResolvedValue resolveReference(String name, SourceLocation location) {
            return resolveSymbol(symbols.lookupValue(name, module, location), location);
        }

        @Override
        public ResolvedExpression evaluate(ExpressionNode node, String field, Optional<TypeRef> expected) {
            IExpressionEvaluator<ExpressionNode> evaluator = evaluators.resolve(node)
                    .orElseThrow(() -> new IllegalStateException(
                            "No evaluator registered for " + node.getClass().getSimpleName()));
            return evaluator.evaluate(node, field, expected, this);
        }
    }
}
