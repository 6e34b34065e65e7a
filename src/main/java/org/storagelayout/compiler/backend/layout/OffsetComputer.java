package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.IOffsetComputer;
import org.storagelayout.compiler.backend.layout.alignment.IAlignmentOverrideRule;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.semantics.CommonBlock;
import org.storagelayout.compiler.semantics.LayoutStatus;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.SymbolDetails;

import java.util.Map;

/**
 * Walks a scope tree bottom-up and lays out each scope exactly once.
 * <p>
 * For one scope the order is: resolve EQUIVALENCE, place the bases of EQUIVALENCE
 * sequences outside COMMON, place the remaining ordinary symbols, record the scope's
 * size and alignment, lay out the COMMON blocks in their own regions, and finally
 * derive the offsets of all aliased symbols from their bases.
 */
public final class OffsetComputer implements IOffsetComputer {

    private final TypeSizeOracle oracle;
    private final IAlignmentOverrideRule alignmentRule;
    private final EquivalenceResolver equivalenceResolver;
    private final CommonBlockMerger commonBlockMerger;

    /**
     * @param oracle The size oracle.
     * @param alignmentRule The target's alignment override rule.
     * @param conflictChecker Receives every finished COMMON block.
     * @param diagnostics The engine receiving all user diagnostics.
     */
    public OffsetComputer(TypeSizeOracle oracle, IAlignmentOverrideRule alignmentRule,
                          ICommonBlockConflictChecker conflictChecker, DiagnosticsEngine diagnostics) {
        this.oracle = oracle;
        this.alignmentRule = alignmentRule;
        this.equivalenceResolver = new EquivalenceResolver(oracle, diagnostics);
        this.commonBlockMerger = new CommonBlockMerger(oracle, diagnostics, conflictChecker);
    }

    @Override
    public void compute(Scope scope) {
        for (Scope child : scope.children()) {
            compute(child);
        }
        if (scope.isDerivedTypeWithKindParameter()) {
            CompilerLogger.trace("Skipping kind-parameterized type template {}", scope);
            return;
        }
        if (scope.status() != LayoutStatus.UNPROCESSED) {
            return;
        }
        scope.markInProgress();
        layout(scope);
    }

    private void layout(Scope scope) {
        EquivalenceResolution equivalences = equivalenceResolver.resolve(scope);
        LayoutAssigner cursor = new LayoutAssigner(oracle, 1);

        for (Symbol base : equivalences.basesInPlacementOrder()) {
            if (base.commonBlock() == null) {
                cursor.place(base);
                SizeAndAlignment block = equivalences.extendBlockBase(base);
                cursor.coverExtent(base.offset() + block.size());
            }
        }

        for (Symbol symbol : scope.symbols()) {
            if (symbol.commonBlock() != null || equivalences.isDependent(symbol) || equivalences.isBase(symbol)) {
                continue;
            }
            cursor.place(symbol, alignmentRule.overrideFor(symbol).alignment());
            if (symbol.details() instanceof SymbolDetails.Generic generic) {
                Symbol specific = generic.specific();
                // May be a shadowed procedure pointer.
                if (specific != null && specific != symbol && specific.commonBlock() == null) {
                    cursor.place(specific);
                }
            }
        }

        scope.finish(cursor.alignedSize(), Math.max(1, cursor.alignment()));
        CompilerLogger.debug(String.format("Scope %s: size %d, alignment %d", scope, scope.size(), scope.alignment()));

        // COMMON is not allowed in a BLOCK construct.
        if (scope.kind() != Scope.Kind.BLOCK_CONSTRUCT) {
            for (CommonBlock block : scope.commonBlocks()) {
                commonBlockMerger.layout(block, equivalences);
            }
        }

        for (Map.Entry<Symbol, SymbolAndOffset> entry : equivalences.dependents().entrySet()) {
            Symbol symbol = entry.getKey();
            SymbolAndOffset dep = entry.getValue();
            symbol.setOffset(dep.symbol().offset() + dep.offset());
            if (dep.symbol().commonBlock() != null) {
                symbol.setCommonBlock(dep.symbol().commonBlock());
            }
        }
    }
}
