package org.storagelayout.compiler.semantics;

/**
 * The declared type of a data object, as resolved by the upstream type checker.
 *
 * @param category The type category.
 * @param kind The kind type parameter in bytes (for DERIVED it is unused and 0).
 * @param characterLength The constant length of a CHARACTER type, or null if not constant.
 * @param derived The derived type, for the DERIVED category only.
 * @param polymorphic True for CLASS(T) and CLASS(*).
 * @param unlimited True for CLASS(*).
 */
public record DeclaredType(
        TypeCategory category,
        int kind,
        Long characterLength,
        DerivedTypeSpec derived,
        boolean polymorphic,
        boolean unlimited
) {

    public static DeclaredType integer(int kind) {
        return new DeclaredType(TypeCategory.INTEGER, kind, null, null, false, false);
    }

    public static DeclaredType real(int kind) {
        return new DeclaredType(TypeCategory.REAL, kind, null, null, false, false);
    }

    public static DeclaredType complex(int kind) {
        return new DeclaredType(TypeCategory.COMPLEX, kind, null, null, false, false);
    }

    public static DeclaredType logical(int kind) {
        return new DeclaredType(TypeCategory.LOGICAL, kind, null, null, false, false);
    }

    public static DeclaredType character(int kind, Long length) {
        return new DeclaredType(TypeCategory.CHARACTER, kind, length, null, false, false);
    }

    public static DeclaredType derived(DerivedTypeSpec spec) {
        return new DeclaredType(TypeCategory.DERIVED, 0, null, spec, false, false);
    }

    /**
     * @param spec The declared type of the polymorphic entity.
     * @return The type CLASS(spec).
     */
    public static DeclaredType polymorphic(DerivedTypeSpec spec) {
        return new DeclaredType(TypeCategory.DERIVED, 0, null, spec, true, false);
    }

    /**
     * @return The type CLASS(*).
     */
    public static DeclaredType unlimitedPolymorphic() {
        return new DeclaredType(TypeCategory.DERIVED, 0, null, null, true, true);
    }

    public boolean isIntrinsic() {
        return category != TypeCategory.DERIVED;
    }

    /**
     * @return {@code true} if this is a REAL or COMPLEX type whose kind is wider than 4 bytes.
     */
    public boolean isRealWiderThan4Bytes() {
        return category.isFloatingPoint() && kind > 4;
    }
}
