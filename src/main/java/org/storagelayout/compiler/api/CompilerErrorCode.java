package org.storagelayout.compiler.api;

/**
 * Defines unique, testable codes for all diagnostics the storage layout pass can report.
 * This decouples the test logic from the translated messages.
 */
public enum CompilerErrorCode {
    // region Symbol Table Errors
    /** A name was declared twice in the same scope. */
    DUPLICATE_SYMBOL,
    // endregion

    // region Equivalence Errors
    /** Two equivalence chains force the first storage unit of one symbol to two different offsets. */
    EQUIVALENCE_CONFLICTING_OFFSETS,
    /** A COMMON member is equivalenced elsewhere to a member of the same block at an inconsistent offset. */
    EQUIVALENCE_INCONSISTENT_IN_COMMON,
    /** An equivalence associates members of two different COMMON blocks. */
    EQUIVALENCE_CROSSES_COMMON_BLOCKS,
    /** An equivalence would extend a COMMON block before its first storage unit. */
    COMMON_BLOCK_BACKWARD_EXTENSION,
    // endregion

    // region Common Block Diagnostics
    /** Padding was inserted before a COMMON member to satisfy its alignment. */
    COMMON_BLOCK_PADDING,
    /** A named COMMON block is initialized in more than one place. */
    COMMON_BLOCK_MULTIPLE_INITIALIZATION,
    /** A named COMMON block does not have the same size everywhere it appears. */
    COMMON_BLOCK_SIZE_MISMATCH
    // endregion
}
