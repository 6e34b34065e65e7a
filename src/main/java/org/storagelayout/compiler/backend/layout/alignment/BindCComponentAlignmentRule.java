package org.storagelayout.compiler.backend.layout.alignment;

import org.storagelayout.compiler.backend.layout.SizeAndAlignment;
import org.storagelayout.compiler.backend.layout.TypeSizeOracle;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.semantics.Attr;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.DerivedTypeSpec;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.Symbol;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * AIX alignment of BIND(C) derived-type components. A component that is not the first
 * component of its type and is a REAL or COMPLEX wider than 4 bytes is aligned to 4 bytes.
 * A component of derived type takes the alignment computed over that type's own components,
 * provided one of them is such a wide floating-point value.
 */
public final class BindCComponentAlignmentRule implements IAlignmentOverrideRule {

    static final long WIDE_FLOAT_ALIGNMENT = 4;
    static final int MAX_NESTING_DEPTH = 64;

    private final TypeSizeOracle oracle;

    public BindCComponentAlignmentRule(TypeSizeOracle oracle) {
        this.oracle = oracle;
    }

    @Override
    public AlignmentOverride overrideFor(Symbol symbol) {
        DeclaredType type = symbol.type();
        if (type == null) {
            return AlignmentOverride.NONE;
        }
        Scope owner = symbol.owner();
        if (owner.symbol() == null || !owner.isDerivedType() || !owner.symbol().has(Attr.BIND_C)) {
            return AlignmentOverride.NONE;
        }
        List<Symbol> components = owner.symbols();
        if (!components.isEmpty() && components.get(0) == symbol) {
            return AlignmentOverride.NONE;
        }
        if (type.isRealWiderThan4Bytes()) {
            return AlignmentOverride.of(WIDE_FLOAT_ALIGNMENT);
        }
        if (type.derived() != null) {
            AlignmentOverride result = componentAlignment(type.derived());
            if (result instanceof AlignmentOverride.Malformed m) {
                CompilerLogger.trace("No AIX alignment for {}: {}", symbol, m.reason());
            }
            return result;
        }
        return AlignmentOverride.NONE;
    }

    private static final class Frame {
        final List<Symbol> components;
        int index;
        long maxAlignment;
        boolean containsWideFloat;
        long pendingAlignment;

        Frame(List<Symbol> components) {
            this.components = components;
        }
    }

    /**
     * Walks the components of a derived type depth first. The alignment of a nested
     * derived component counts only if the nested type itself yields an override;
     * otherwise the whole computation yields no override.
     */
    AlignmentOverride componentAlignment(DerivedTypeSpec spec) {
        if (spec.scope() == null) {
            return new AlignmentOverride.Malformed("type " + spec.name() + " has no component scope");
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(componentsOf(spec.scope())));
        AlignmentOverride nested = null;
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (nested != null) {
                if (!(nested instanceof AlignmentOverride.Value)) {
                    return nested;
                }
                frame.maxAlignment = Math.max(frame.maxAlignment, frame.pendingAlignment);
                frame.index++;
                nested = null;
            }
            if (frame.index >= frame.components.size()) {
                stack.pop();
                AlignmentOverride result = frame.containsWideFloat
                        ? AlignmentOverride.of(frame.maxAlignment) : AlignmentOverride.NONE;
                if (stack.isEmpty()) {
                    return result;
                }
                nested = result;
                continue;
            }
            Symbol component = frame.components.get(frame.index);
            DeclaredType type = component.type();
            if (type == null) {
                return new AlignmentOverride.Malformed("component " + component + " has no type");
            }
            SizeAndAlignment s = oracle.sizeAndAlignment(component, true);
            if (type.isRealWiderThan4Bytes()) {
                frame.maxAlignment = Math.max(frame.maxAlignment, WIDE_FLOAT_ALIGNMENT);
                frame.containsWideFloat = true;
                frame.index++;
            } else if (type.derived() != null) {
                if (type.derived().scope() == null) {
                    return new AlignmentOverride.Malformed("type " + type.derived().name() + " has no component scope");
                }
                if (stack.size() >= MAX_NESTING_DEPTH) {
                    return new AlignmentOverride.Malformed("derived types nested deeper than " + MAX_NESTING_DEPTH);
                }
                frame.pendingAlignment = s.alignment();
                stack.push(new Frame(componentsOf(type.derived().scope())));
            } else {
                frame.maxAlignment = Math.max(frame.maxAlignment, s.alignment());
                frame.index++;
            }
        }
        return AlignmentOverride.NONE;
    }

    private static List<Symbol> componentsOf(Scope scope) {
        return scope.symbols().stream().filter(Symbol::isObjectEntity).toList();
    }
}
