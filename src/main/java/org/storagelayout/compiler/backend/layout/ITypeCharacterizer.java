package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.Symbol;

import java.util.Optional;

/**
 * Characterizes the type of a data object: the storage size and the natural alignment.
 * Implementations are owned by the type system; the layout pass only queries them.
 */
@FunctionalInterface
public interface ITypeCharacterizer {

    /**
     * @param symbol A data object.
     * @param wholeObject {@code true} for the size of the whole object, {@code false} for one element.
     * @return The size and alignment, or empty if the type cannot be measured statically.
     */
    Optional<SizeAndAlignment> characterize(Symbol symbol, boolean wholeObject);
}
