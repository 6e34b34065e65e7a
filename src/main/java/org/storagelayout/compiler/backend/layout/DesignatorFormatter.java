package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.ShapeSpec;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.TypeCategory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.StringJoiner;

/**
 * Rebuilds the source designator that addresses a byte offset within a variable,
 * such as {@code A(3)}, {@code M(2,1)} or {@code C(4:4)}.
 */
public final class DesignatorFormatter {

    private final TypeSizeOracle oracle;

    public DesignatorFormatter(TypeSizeOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * @param symbol The variable.
     * @param offset The byte offset from the start of the variable.
     * @return The designator of the storage unit at that offset, or empty if the offset does not
     *         fall on an element or character boundary, or the shape is not explicit.
     */
    public Optional<String> toDesignator(Symbol symbol, long offset) {
        if (offset < 0) {
            return Optional.empty();
        }
        ArraySpec shape = symbol.shape();
        if (shape.isScalar()) {
            if (offset == 0 && !isCharacter(symbol)) {
                return Optional.of(symbol.name());
            }
            return substring(symbol, offset).map(s -> symbol.name() + s);
        }
        OptionalLong count = shape.elementCount();
        long elementSize = oracle.sizeAndAlignment(symbol, false).size();
        if (count.isEmpty() || elementSize <= 0) {
            return Optional.empty();
        }
        long index = offset / elementSize;
        long remainder = offset % elementSize;
        if (index >= count.getAsLong()) {
            return Optional.empty();
        }
        StringJoiner subscripts = new StringJoiner(",", "(", ")");
        for (ShapeSpec dim : shape.dimensions()) {
            long extent = dim.extent();
            subscripts.add(Long.toString(dim.lower().value() + index % extent));
            index /= extent;
        }
        String element = symbol.name() + subscripts;
        if (remainder == 0 && !isCharacter(symbol)) {
            return Optional.of(element);
        }
        return substring(symbol, remainder).map(s -> element + s);
    }

    private Optional<String> substring(Symbol symbol, long offset) {
        if (!isCharacter(symbol)) {
            return Optional.empty();
        }
        int width = oracle.characterKindWidth(symbol);
        if (offset % width != 0) {
            return Optional.empty();
        }
        long position = offset / width + 1;
        return Optional.of("(" + position + ":" + position + ")");
    }

    private static boolean isCharacter(Symbol symbol) {
        DeclaredType type = symbol.type();
        return type != null && type.category() == TypeCategory.CHARACTER;
    }
}
