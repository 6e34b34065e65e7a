package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.CommonBlock;

/**
 * Receives every COMMON block once its layout is final, to check it against the other
 * occurrences of the same block in the program.
 */
@FunctionalInterface
public interface ICommonBlockConflictChecker {

    /** A checker that accepts every block. */
    ICommonBlockConflictChecker NONE = block -> { };

    /**
     * @param block A COMMON block with final size and alignment.
     */
    void mapCommonBlockAndCheckConflicts(CommonBlock block);
}
