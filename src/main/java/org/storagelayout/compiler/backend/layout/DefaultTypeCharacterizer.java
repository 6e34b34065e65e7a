package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.LayoutStatus;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.Symbol;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Measures intrinsic types by kind and derived types by their laid-out component scope.
 * A derived type can only be measured after its component scope has been laid out; the
 * scope walker lays out nested scopes in declaration order before their parent.
 */
public final class DefaultTypeCharacterizer implements ITypeCharacterizer {

    @Override
    public Optional<SizeAndAlignment> characterize(Symbol symbol, boolean wholeObject) {
        DeclaredType type = symbol.type();
        if (type == null) {
            return Optional.empty();
        }
        Optional<SizeAndAlignment> element = elementOf(type);
        if (element.isEmpty() || !wholeObject) {
            return element;
        }
        OptionalLong count = symbol.shape().elementCount();
        if (count.isEmpty()) {
            return Optional.empty();
        }
        SizeAndAlignment e = element.get();
        return Optional.of(new SizeAndAlignment(e.size() * count.getAsLong(), e.alignment()));
    }

    private static Optional<SizeAndAlignment> elementOf(DeclaredType type) {
        switch (type.category()) {
            case INTEGER:
            case REAL:
            case LOGICAL:
                return Optional.of(new SizeAndAlignment(type.kind(), type.kind()));
            case COMPLEX:
                return Optional.of(new SizeAndAlignment(2L * type.kind(), type.kind()));
            case CHARACTER:
                if (type.characterLength() == null) {
                    return Optional.empty();
                }
                return Optional.of(new SizeAndAlignment(type.kind() * Math.max(0, type.characterLength()), type.kind()));
            case DERIVED:
                if (type.derived() == null) {
                    return Optional.empty();
                }
                Scope components = type.derived().scope();
                if (components == null || components.status() != LayoutStatus.DONE) {
                    return Optional.empty();
                }
                return Optional.of(new SizeAndAlignment(components.size(), components.alignment()));
            default:
                return Optional.empty();
        }
    }
}
