package org.storagelayout.compiler.backend.layout;

/**
 * Descriptor sizes of the runtime library. The size over-approximates so that any
 * descriptor of the given rank fits.
 */
public final class RuntimeDescriptorSizer implements IDescriptorSizer {

    /** Base address, element length, version, rank, type, attribute and extra bytes. */
    static final long HEADER_BYTES = 24;
    /** Lower bound, extent and byte stride of one dimension. */
    static final long DIMENSION_BYTES = 24;
    /** Derived type pointer plus the first length parameter slot. */
    static final long ADDENDUM_BYTES = 16;
    static final long LEN_PARAMETER_BYTES = 8;

    @Override
    public long descriptorSize(int rank, boolean hasAddendum, int lenParameterCount) {
        long bytes = HEADER_BYTES + (long) rank * DIMENSION_BYTES;
        if (hasAddendum || lenParameterCount > 0) {
            bytes += ADDENDUM_BYTES + (long) Math.max(lenParameterCount - 1, 0) * LEN_PARAMETER_BYTES;
        }
        return bytes;
    }
}
