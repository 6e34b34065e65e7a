package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.DerivedTypeSpec;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.target.TargetCharacteristics;

/**
 * Sizes every kind of symbol the layout pass sees. Descriptor entities are measured by
 * the descriptor sizer, procedure pointers by the target, plain procedures occupy nothing,
 * and data objects are measured by the type characterizer.
 */
public final class TypeSizeOracle {

    private final TargetCharacteristics target;
    private final ITypeCharacterizer characterizer;
    private final IDescriptorSizer descriptorSizer;

    /**
     * @param target The target characteristics.
     * @param characterizer The type characterization service.
     * @param descriptorSizer The descriptor size service.
     */
    public TypeSizeOracle(TargetCharacteristics target, ITypeCharacterizer characterizer, IDescriptorSizer descriptorSizer) {
        this.target = target;
        this.characterizer = characterizer;
        this.descriptorSizer = descriptorSizer;
    }

    public TargetCharacteristics target() {
        return target;
    }

    /**
     * @param symbol The symbol to measure.
     * @param wholeObject {@code true} for the whole object, {@code false} for one array element.
     * @return The size and alignment; {@link SizeAndAlignment#EMPTY} for symbols without storage
     *         and for types that cannot be measured.
     */
    public SizeAndAlignment sizeAndAlignment(Symbol symbol, boolean wholeObject) {
        if (symbol.isDescriptor()) {
            DeclaredType type = symbol.type();
            DerivedTypeSpec derived = type != null ? type.derived() : null;
            int lenParams = derived != null ? derived.lenParameterCount() : 0;
            boolean addendum = derived != null || (type != null && type.unlimited());
            long size = descriptorSizer.descriptorSize(symbol.rank(), addendum, lenParams);
            return new SizeAndAlignment(size, target.descriptorAlignment());
        }
        if (symbol.isProcedurePointer()) {
            return new SizeAndAlignment(target.procedurePointerByteSize(), target.procedurePointerAlignment());
        }
        if (symbol.isProcedure()) {
            return SizeAndAlignment.EMPTY;
        }
        return characterizer.characterize(symbol, wholeObject).orElse(SizeAndAlignment.EMPTY);
    }

    /**
     * @param symbol A data object.
     * @return The byte width of one character of the symbol's type, or of the default kind
     *         if the type is not an intrinsic type.
     */
    public int characterKindWidth(Symbol symbol) {
        DeclaredType type = symbol.type();
        if (type != null && type.isIntrinsic() && type.kind() > 0) {
            return type.kind();
        }
        return target.defaultCharacterKind();
    }
}
