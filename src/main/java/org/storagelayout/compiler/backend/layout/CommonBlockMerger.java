package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.internal.i18n.Messages;
import org.storagelayout.compiler.semantics.CommonBlock;
import org.storagelayout.compiler.semantics.Symbol;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Lays out the members of a COMMON block in declaration order, in a region of its own.
 * EQUIVALENCE may extend a block past its last member, or pull a base symbol into the
 * block, but it may not extend the block before its first storage unit, associate two
 * different blocks, or contradict the layout of the block's own members.
 */
public final class CommonBlockMerger {

    private final TypeSizeOracle oracle;
    private final DiagnosticsEngine diagnostics;
    private final ICommonBlockConflictChecker conflictChecker;

    /**
     * @param oracle The size oracle.
     * @param diagnostics The engine receiving storage association errors and padding warnings.
     * @param conflictChecker Receives every finished block.
     */
    public CommonBlockMerger(TypeSizeOracle oracle, DiagnosticsEngine diagnostics, ICommonBlockConflictChecker conflictChecker) {
        this.oracle = oracle;
        this.diagnostics = diagnostics;
        this.conflictChecker = conflictChecker;
    }

    /**
     * Assigns offsets to the members of a block and records its size and alignment.
     *
     * @param block The block.
     * @param equivalences The EQUIVALENCE structure of the scope declaring the block.
     */
    public void layout(CommonBlock block, EquivalenceResolution equivalences) {
        LayoutAssigner cursor = new LayoutAssigner(oracle, 0);
        long minSize = 0;
        long minAlignment = 0;
        Set<Symbol> previous = new HashSet<>();
        for (Symbol symbol : block.objects()) {
            SourceInfo errorSite = block.isBlank() ? symbol.source() : block.source();
            long padding = cursor.place(symbol);
            if (padding != 0) {
                diagnostics.reportWarning(CompilerErrorCode.COMMON_BLOCK_PADDING,
                        Messages.get("common.padding", block.name(), padding, symbol.name()), errorSite);
            }
            previous.add(symbol);
            Symbol eqBase = null;
            Optional<SymbolAndOffset> dependency = equivalences.dependencyOf(symbol);
            if (dependency.isEmpty()) {
                if (equivalences.isBase(symbol)) {
                    equivalences.extendBlockBase(symbol);
                    eqBase = symbol;
                }
            } else {
                SymbolAndOffset dep = dependency.get();
                Symbol base = dep.symbol();
                CommonBlock baseBlock = base.commonBlock();
                if (baseBlock != null) {
                    if (baseBlock == block) {
                        if (!previous.contains(base) || base.offset() != symbol.offset() - dep.offset()) {
                            diagnostics.reportError(CompilerErrorCode.EQUIVALENCE_INCONSISTENT_IN_COMMON,
                                    Messages.get("common.equivalenceElsewhere", symbol.name(), base.name(), block.name()),
                                    errorSite);
                        }
                    } else {
                        diagnostics.reportError(CompilerErrorCode.EQUIVALENCE_CROSSES_COMMON_BLOCKS,
                                Messages.get("common.crossBlock", symbol.name(), block.name(), base.name(), baseBlock.name()),
                                errorSite);
                    }
                } else if (dep.offset() > symbol.offset()) {
                    diagnostics.reportError(CompilerErrorCode.COMMON_BLOCK_BACKWARD_EXTENSION,
                            Messages.get("common.backwardExtend", symbol.name(), block.name(), base.name()), errorSite);
                } else {
                    base.setCommonBlock(block);
                    base.setOffset(symbol.offset() - dep.offset());
                    previous.add(base);
                    if (equivalences.isBase(base)) {
                        eqBase = base;
                    }
                }
            }
            // The whole EQUIVALENCE sequence belongs to the block.
            if (eqBase != null) {
                SizeAndAlignment blockInfo = equivalences.blockOf(eqBase).orElseThrow();
                minSize = Math.max(minSize, Math.max(cursor.offset(), eqBase.offset() + blockInfo.size()));
                minAlignment = Math.max(minAlignment, blockInfo.alignment());
            }
        }
        block.setSize(Math.max(minSize, cursor.offset()));
        block.setAlignment(Math.max(minAlignment, cursor.alignment()));
        CompilerLogger.debug(String.format("COMMON %s: size %d, alignment %d", block, block.size(), block.alignment()));
        conflictChecker.mapCommonBlockAndCheckConflicts(block);
    }
}
