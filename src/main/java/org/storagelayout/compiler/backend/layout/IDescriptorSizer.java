package org.storagelayout.compiler.backend.layout;

/**
 * Measures runtime descriptors for dynamically shaped and polymorphic entities.
 */
@FunctionalInterface
public interface IDescriptorSizer {

    /**
     * @param rank The rank of the described entity.
     * @param hasAddendum Whether the descriptor carries type information for a derived or unlimited polymorphic type.
     * @param lenParameterCount The number of length type parameters of the derived type.
     * @return The descriptor size in bytes.
     */
    long descriptorSize(int rank, boolean hasAddendum, int lenParameterCount);
}
