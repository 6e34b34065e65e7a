package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.internal.i18n.Messages;
import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.EquivalenceObject;
import org.storagelayout.compiler.semantics.EquivalenceSet;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.ShapeSpec;
import org.storagelayout.compiler.semantics.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the EQUIVALENCE sets of a scope into dependency edges (aliased symbol to base
 * symbol plus offset) and into the extent of each base's storage sequence.
 * <p>
 * Within a set, the object with the largest offset from its resolved symbol becomes the
 * representative, so that every other object lies at a non-negative offset from it.
 * A set that would place one symbol's first storage unit at two different offsets is
 * reported and otherwise ignored.
 */
public final class EquivalenceResolver {

    private final TypeSizeOracle oracle;
    private final DesignatorFormatter designators;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param oracle The size oracle.
     * @param diagnostics The engine receiving conflict errors.
     */
    public EquivalenceResolver(TypeSizeOracle oracle, DiagnosticsEngine diagnostics) {
        this.oracle = oracle;
        this.designators = new DesignatorFormatter(oracle);
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves all EQUIVALENCE sets of a scope. Every aliased symbol gets its size assigned.
     *
     * @param scope The scope.
     * @return The dependency edges, each pointing directly at a base symbol, and the block extents.
     * @throws IllegalStateException if an aliased symbol was already sized, or a set is empty.
     */
    public EquivalenceResolution resolve(Scope scope) {
        EquivalenceResolution resolution = new EquivalenceResolution();
        for (EquivalenceSet set : scope.equivalenceSets()) {
            doEquivalenceSet(set, resolution);
        }
        for (Symbol symbol : new ArrayList<>(resolution.dependents().keySet())) {
            SymbolAndOffset dep = resolve(resolution.dependent(symbol), resolution);
            resolution.replaceDependent(symbol, dep);
            if (symbol.size() != 0) {
                throw new IllegalStateException("EQUIVALENCE member " + symbol + " already has size " + symbol.size());
            }
            SizeAndAlignment info = oracle.sizeAndAlignment(symbol, true);
            symbol.setSize(info.size());
            resolution.includeInBlock(dep.symbol(), dep.offset() + info.size(), info.alignment());
            CompilerLogger.trace("EQUIVALENCE {} -> {} + {}", symbol, dep.symbol(), dep.offset());
        }
        return resolution;
    }

    private void doEquivalenceSet(EquivalenceSet set, EquivalenceResolution resolution) {
        List<SymbolAndOffset> resolved = new ArrayList<>();
        int representative = -1;
        for (EquivalenceObject object : set.objects()) {
            long offset = computeOffset(object);
            SymbolAndOffset r = resolve(new SymbolAndOffset(object.symbol(), offset, object), resolution);
            resolved.add(r);
            // Later objects win ties.
            if (representative < 0 || r.offset() >= resolved.get(representative).offset()) {
                representative = resolved.size() - 1;
            }
        }
        if (representative < 0) {
            throw new IllegalStateException("EQUIVALENCE set without objects");
        }
        SymbolAndOffset base = resolved.get(representative);
        for (SymbolAndOffset r : resolved) {
            if (r.symbol() == base.symbol()) {
                if (r.offset() != base.offset()) {
                    reportConflict(base, r);
                }
            } else {
                SymbolAndOffset earlier = resolution.putDependentIfAbsent(r.symbol(),
                        new SymbolAndOffset(base.symbol(), base.offset() - r.offset(), r.object()));
                // The same variable named twice in one set at different positions.
                if (earlier != null && base.offset() - earlier.offset() != r.offset()) {
                    reportConflict(new SymbolAndOffset(r.symbol(), base.offset() - earlier.offset(), earlier.object()), r);
                }
            }
        }
    }

    /**
     * Follows dependency edges from a location to its base symbol, compressing the
     * traversed path so that every visited symbol points directly at the base.
     */
    SymbolAndOffset resolve(SymbolAndOffset start, EquivalenceResolution resolution) {
        List<Symbol> path = new ArrayList<>();
        Symbol current = start.symbol();
        long offset = start.offset();
        SymbolAndOffset next;
        while ((next = resolution.dependent(current)) != null) {
            if (path.size() > resolution.dependentCount()) {
                throw new IllegalStateException("Cyclic EQUIVALENCE dependency through " + start.symbol());
            }
            path.add(current);
            offset += next.offset();
            current = next.symbol();
        }
        long remaining = offset - start.offset();
        for (Symbol s : path) {
            SymbolAndOffset edge = resolution.dependent(s);
            if (edge.symbol() != current) {
                resolution.replaceDependent(s, new SymbolAndOffset(current, remaining, edge.object()));
            }
            remaining -= edge.offset();
        }
        return new SymbolAndOffset(current, offset, start.object());
    }

    /**
     * @param object An EQUIVALENCE object.
     * @return The byte offset of the object from the start of its variable.
     */
    long computeOffset(EquivalenceObject object) {
        Symbol symbol = object.symbol();
        List<Long> subscripts = object.subscripts();
        long index = 0;
        if (!subscripts.isEmpty() && symbol.isObjectEntity()) {
            ArraySpec shape = symbol.shape();
            if (subscripts.size() > shape.rank()) {
                throw new IllegalStateException("EQUIVALENCE object " + symbol + " has more subscripts than dimensions");
            }
            for (int i = subscripts.size() - 1; ; ) {
                index += subscripts.get(i) - lowerBound(symbol, shape.get(i));
                if (i == 0) {
                    break;
                }
                --i;
                index *= shape.get(i).extent();
            }
        }
        long result = index * oracle.sizeAndAlignment(symbol, false).size();
        if (object.substringStart().isPresent()) {
            result += (long) oracle.characterKindWidth(symbol) * (object.substringStart().getAsLong() - 1);
        }
        return result;
    }

    private static long lowerBound(Symbol symbol, ShapeSpec dim) {
        if (!dim.isExplicit()) {
            throw new IllegalStateException("EQUIVALENCE object " + symbol + " does not have an explicit shape");
        }
        return dim.lower().value();
    }

    private void reportConflict(SymbolAndOffset base, SymbolAndOffset other) {
        Symbol symbol = base.symbol();
        Optional<String> x = designators.toDesignator(symbol, base.offset());
        Optional<String> y = designators.toDesignator(symbol, other.offset());
        if (x.isPresent() && y.isPresent()) {
            diagnostics.reportError(CompilerErrorCode.EQUIVALENCE_CONFLICTING_OFFSETS,
                            Messages.get("equivalence.conflict", x.get(), y.get()), base.object().source())
                    .attachNote(Messages.get("equivalence.conflict.note", y.get()), other.object().source());
        } else {
            diagnostics.reportError(CompilerErrorCode.EQUIVALENCE_CONFLICTING_OFFSETS,
                            Messages.get("equivalence.conflictOffsets", symbol.name(), base.offset(), other.offset()),
                            base.object().source())
                    .attachNote(Messages.get("equivalence.conflictOffsets.note", symbol.name(), other.offset()),
                            other.object().source());
        }
    }
}
