package org.storagelayout.compiler.semantics;

/**
 * A reference to a derived type: the symbol naming the type and the scope holding its components.
 * For a kind-parameterized type, {@code scope} is the instantiation, not the template.
 *
 * @param typeSymbol The symbol that names the type.
 * @param scope The scope whose symbols are the type's components, in declaration order.
 */
public record DerivedTypeSpec(Symbol typeSymbol, Scope scope) {

    /**
     * @return The number of length type parameters the type declares.
     */
    public int lenParameterCount() {
        if (typeSymbol.details() instanceof SymbolDetails.DerivedType dt) {
            return dt.lenParameters().size();
        }
        return 0;
    }

    /**
     * @return {@code true} if the type was declared with BIND(C).
     */
    public boolean isBindC() {
        return typeSymbol.attrs().contains(Attr.BIND_C);
    }

    public String name() {
        return typeSymbol.name();
    }
}
