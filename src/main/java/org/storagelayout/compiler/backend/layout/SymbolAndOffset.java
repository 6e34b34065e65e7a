package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.EquivalenceObject;
import org.storagelayout.compiler.semantics.Symbol;

/**
 * A location expressed relative to the first storage unit of a symbol.
 *
 * @param symbol The symbol the offset is relative to.
 * @param offset The byte offset from the start of {@code symbol}.
 * @param object The EQUIVALENCE object this location was derived from, for diagnostics.
 */
public record SymbolAndOffset(Symbol symbol, long offset, EquivalenceObject object) {}
