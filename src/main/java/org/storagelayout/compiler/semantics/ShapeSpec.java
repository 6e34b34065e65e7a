package org.storagelayout.compiler.semantics;

/**
 * One dimension of an array specification.
 *
 * @param lower The lower bound.
 * @param upper The upper bound.
 */
public record ShapeSpec(Bound lower, Bound upper) {

    /**
     * A bound of a dimension. Only explicit bounds have a value.
     *
     * @param kind Whether the bound is explicit, deferred (":") or assumed ("*").
     * @param value The constant value of an explicit bound.
     */
    public record Bound(Kind kind, long value) {

        public enum Kind { EXPLICIT, DEFERRED, ASSUMED }

        public static Bound of(long value) {
            return new Bound(Kind.EXPLICIT, value);
        }

        public static Bound deferred() {
            return new Bound(Kind.DEFERRED, 0);
        }

        public static Bound assumed() {
            return new Bound(Kind.ASSUMED, 0);
        }

        public boolean isExplicit() {
            return kind == Kind.EXPLICIT;
        }
    }

    /**
     * @param lower The explicit lower bound.
     * @param upper The explicit upper bound.
     * @return The explicit-shape dimension {@code lower:upper}.
     */
    public static ShapeSpec explicit(long lower, long upper) {
        return new ShapeSpec(Bound.of(lower), Bound.of(upper));
    }

    /**
     * @return A deferred-shape dimension {@code :}.
     */
    public static ShapeSpec deferred() {
        return new ShapeSpec(Bound.deferred(), Bound.deferred());
    }

    /**
     * @param lower The explicit lower bound.
     * @return An assumed-shape dimension {@code lower:}.
     */
    public static ShapeSpec assumedShape(long lower) {
        return new ShapeSpec(Bound.of(lower), Bound.deferred());
    }

    public boolean isExplicit() {
        return lower.isExplicit() && upper.isExplicit();
    }

    /**
     * @return The number of elements along this dimension, never negative.
     * @throws IllegalStateException if the dimension is not explicit.
     */
    public long extent() {
        if (!isExplicit()) {
            throw new IllegalStateException("Extent of a non-explicit dimension requested");
        }
        return Math.max(0, upper.value() - lower.value() + 1);
    }
}
