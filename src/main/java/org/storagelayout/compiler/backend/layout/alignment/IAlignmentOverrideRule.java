package org.storagelayout.compiler.backend.layout.alignment;

import org.storagelayout.compiler.semantics.Symbol;

/**
 * A target-specific exception to natural alignment, consulted before each top-level
 * placement of a scope's ordinary symbols.
 */
@FunctionalInterface
public interface IAlignmentOverrideRule {

    /** The rule of targets that always use natural alignment. */
    IAlignmentOverrideRule NATURAL = symbol -> AlignmentOverride.NONE;

    /**
     * @param symbol The symbol about to be placed.
     * @return The alignment to use instead of the natural one, if any.
     */
    AlignmentOverride overrideFor(Symbol symbol);
}
