package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.internal.i18n.Messages;
import org.storagelayout.compiler.semantics.CommonBlock;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Tracks every occurrence of each named COMMON block across the program units laid out
 * with this registry. A named block should have the same size everywhere, and at most one
 * occurrence may be initialized. Blank COMMON may differ in size.
 */
public final class CommonBlockRegistry implements ICommonBlockConflictChecker {

    private final DiagnosticsEngine diagnostics;
    private final Map<String, CommonBlock> initialized = new HashMap<>();
    private final Map<String, CommonBlock> firstSeen = new HashMap<>();
    private final Map<String, Long> largestSize = new HashMap<>();

    public CommonBlockRegistry(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    @Override
    public void mapCommonBlockAndCheckConflicts(CommonBlock block) {
        String key = block.name().toUpperCase(Locale.ROOT);
        if (block.isInitialized()) {
            CommonBlock previous = initialized.putIfAbsent(key, block);
            if (previous != null && previous != block) {
                diagnostics.reportError(CompilerErrorCode.COMMON_BLOCK_MULTIPLE_INITIALIZATION,
                                Messages.get("common.multipleInit", block.name()), block.source())
                        .attachNote(Messages.get("common.multipleInit.note", block.name()), previous.source());
            }
        }
        CommonBlock first = firstSeen.putIfAbsent(key, block);
        if (first != null && first != block && !block.isBlank()) {
            checkSize(block, key, first);
        }
        largestSize.merge(key, block.size(), Math::max);
    }

    private void checkSize(CommonBlock block, String key, CommonBlock first) {
        if (block.size() == first.size()) {
            return;
        }
        CommonBlock init = initialized.get(key);
        if (init != null) {
            long other = init == block ? largestSize.get(key) : block.size();
            if (init.size() < other) {
                diagnostics.reportError(CompilerErrorCode.COMMON_BLOCK_SIZE_MISMATCH,
                        Messages.get("common.initializedSmaller", init.name(), init.size(), other), init.source());
                return;
            }
        }
        diagnostics.reportWarning(CompilerErrorCode.COMMON_BLOCK_SIZE_MISMATCH,
                        Messages.get("common.sizeMismatch", block.size()), block.source())
                .attachNote(Messages.get("common.sizeMismatch.note", block.name(), first.size()), first.source());
    }

    /**
     * @param name The block name, empty for blank COMMON.
     * @return The largest size seen for the block, which code generation allocates.
     */
    public OptionalLong largestSize(String name) {
        Long size = largestSize.get(name.toUpperCase(Locale.ROOT));
        return size != null ? OptionalLong.of(size) : OptionalLong.empty();
    }
}
