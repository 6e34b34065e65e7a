package org.storagelayout.compiler.semantics;

import java.util.List;
import java.util.OptionalLong;

/**
 * The declared shape of an array; a scalar has an empty specification.
 *
 * @param dimensions The dimensions, first dimension first.
 */
public record ArraySpec(List<ShapeSpec> dimensions) {

    /** The shape of a scalar. */
    public static final ArraySpec SCALAR = new ArraySpec(List.of());

    public ArraySpec {
        dimensions = List.copyOf(dimensions);
    }

    public static ArraySpec of(ShapeSpec... dimensions) {
        return new ArraySpec(List.of(dimensions));
    }

    public int rank() {
        return dimensions.size();
    }

    public boolean isScalar() {
        return dimensions.isEmpty();
    }

    public ShapeSpec get(int i) {
        return dimensions.get(i);
    }

    /**
     * @return {@code true} if every dimension has explicit constant bounds.
     */
    public boolean isExplicitShape() {
        return dimensions.stream().allMatch(ShapeSpec::isExplicit);
    }

    /**
     * @return {@code true} for assumed-shape ({@code lower:}) and deferred-shape ({@code :}) arrays.
     */
    public boolean isAssumedOrDeferredShape() {
        return !isScalar() && dimensions.stream()
                .allMatch(d -> d.upper().kind() == ShapeSpec.Bound.Kind.DEFERRED);
    }

    /**
     * @return The constant number of elements, or empty if the shape is not explicit.
     */
    public OptionalLong elementCount() {
        if (!isExplicitShape()) {
            return OptionalLong.empty();
        }
        long count = 1;
        for (ShapeSpec d : dimensions) {
            count *= d.extent();
        }
        return OptionalLong.of(count);
    }
}
