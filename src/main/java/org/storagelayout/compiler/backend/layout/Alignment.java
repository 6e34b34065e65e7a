package org.storagelayout.compiler.backend.layout;

/**
 * Offset rounding shared by every layout step.
 */
public final class Alignment {

    private Alignment() {}

    /**
     * Rounds an offset up to an alignment, never aligning more strictly than the target allows.
     * Alignments must be powers of two; an alignment of 0 or 1 leaves the offset unchanged.
     *
     * @param offset The offset to round.
     * @param alignment The requested alignment.
     * @param maxAlignment The largest alignment the target honors.
     * @return The smallest multiple of {@code min(alignment, maxAlignment)} that is not below {@code offset}.
     */
    public static long align(long offset, long alignment, long maxAlignment) {
        long effective = Math.min(alignment, maxAlignment);
        if (effective <= 1) {
            return offset;
        }
        return (offset + effective - 1) & -effective;
    }
}
