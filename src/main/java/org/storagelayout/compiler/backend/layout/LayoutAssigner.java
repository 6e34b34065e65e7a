package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.Symbol;

import java.util.OptionalLong;

/**
 * Places symbols one after another in a growing storage region, inserting padding to
 * satisfy each symbol's alignment and tracking the largest alignment seen.
 * One instance serves one region: the ordinary variables of a scope, or one COMMON block.
 */
public final class LayoutAssigner {

    private final TypeSizeOracle oracle;
    private final long maxAlignment;
    private long offset;
    private long alignment;

    /**
     * @param oracle The size oracle.
     * @param initialAlignment The alignment of the region before anything is placed.
     */
    public LayoutAssigner(TypeSizeOracle oracle, long initialAlignment) {
        this.oracle = oracle;
        this.maxAlignment = oracle.target().maxAlignment();
        this.alignment = initialAlignment;
    }

    /**
     * Places a symbol at the next suitably aligned offset.
     * @param symbol The symbol.
     * @return The number of padding bytes inserted before it.
     */
    public long place(Symbol symbol) {
        return place(symbol, OptionalLong.empty());
    }

    /**
     * Places a symbol at the next suitably aligned offset. Symbols that are neither data
     * objects nor procedure entities, and symbols without storage, are left untouched.
     *
     * @param symbol The symbol.
     * @param overrideAlignment An alignment to use instead of the symbol's natural one.
     * @return The number of padding bytes inserted before it.
     */
    public long place(Symbol symbol, OptionalLong overrideAlignment) {
        if (!symbol.isObjectEntity() && !symbol.isProcEntity()) {
            return 0;
        }
        SizeAndAlignment s = oracle.sizeAndAlignment(symbol, true);
        if (s.size() == 0) {
            return 0;
        }
        long previousOffset = offset;
        long alignTo = overrideAlignment.orElse(s.alignment());
        offset = Alignment.align(offset, alignTo, maxAlignment);
        long padding = offset - previousOffset;
        symbol.setSize(s.size());
        symbol.setOffset(offset);
        offset += s.size();
        alignment = Math.max(alignment, Math.min(alignTo, maxAlignment));
        return padding;
    }

    /**
     * Advances the cursor so that the region covers at least {@code end} bytes.
     * @param end The end offset of storage placed outside of {@link #place}.
     */
    public void coverExtent(long end) {
        offset = Math.max(offset, end);
    }

    /**
     * @return The current end of the region.
     */
    public long offset() {
        return offset;
    }

    /**
     * @return The largest alignment placed so far.
     */
    public long alignment() {
        return alignment;
    }

    /**
     * @return The size of the region rounded up to its alignment.
     */
    public long alignedSize() {
        return Alignment.align(offset, alignment, maxAlignment);
    }
}
