package org.storagelayout.compiler.semantics;

import java.util.List;

/**
 * A group of objects that must share their first storage unit.
 *
 * @param objects The objects, in source order.
 */
public record EquivalenceSet(List<EquivalenceObject> objects) {

    public EquivalenceSet {
        objects = List.copyOf(objects);
    }

    public static EquivalenceSet of(EquivalenceObject... objects) {
        return new EquivalenceSet(List.of(objects));
    }
}
