package org.storagelayout.compiler.semantics;

import java.util.List;

/**
 * The kind-specific details of a symbol, as determined by name resolution.
 */
public sealed interface SymbolDetails permits SymbolDetails.ObjectEntity, SymbolDetails.ProcEntity,
        SymbolDetails.Subprogram, SymbolDetails.Generic, SymbolDetails.DerivedType, SymbolDetails.Misc {

    /**
     * A data object: a variable, a dummy argument or a derived-type component.
     * @param type The declared type.
     * @param shape The declared array shape, {@link ArraySpec#SCALAR} for scalars.
     */
    record ObjectEntity(DeclaredType type, ArraySpec shape) implements SymbolDetails {}

    /**
     * A procedure entity; with the POINTER attribute it is a procedure pointer.
     * @param interfaceName The name of the explicit interface, may be null.
     */
    record ProcEntity(String interfaceName) implements SymbolDetails {}

    /** A subprogram defined in this compilation. */
    record Subprogram() implements SymbolDetails {}

    /**
     * A generic interface. It may shadow a specific procedure (or procedure pointer) of the same name.
     * @param specific The shadowed specific, may be null.
     */
    record Generic(Symbol specific) implements SymbolDetails {}

    /**
     * The name of a derived type.
     * @param kindParameters The names of the kind type parameters.
     * @param lenParameters The names of the length type parameters.
     */
    record DerivedType(List<String> kindParameters, List<String> lenParameters) implements SymbolDetails {
        public DerivedType {
            kindParameters = List.copyOf(kindParameters);
            lenParameters = List.copyOf(lenParameters);
        }
    }

    /** Any other named entity without storage (construct names, namelist groups, ...). */
    record Misc() implements SymbolDetails {}
}
