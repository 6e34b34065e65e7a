package org.storagelayout.compiler.semantics;

import org.storagelayout.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * One object of an EQUIVALENCE set: a variable, an array element with constant subscripts,
 * or a substring.
 *
 * @param symbol The referenced symbol.
 * @param subscripts The constant subscripts, empty for a whole variable.
 * @param substringStart The constant starting position of a substring, if any.
 * @param source Where the object appears in the EQUIVALENCE statement.
 */
public record EquivalenceObject(Symbol symbol, List<Long> subscripts, OptionalLong substringStart, SourceInfo source) {

    public EquivalenceObject {
        subscripts = List.copyOf(subscripts);
    }

    /**
     * @param symbol The variable.
     * @param source The source location.
     * @return An object referencing the whole variable.
     */
    public static EquivalenceObject of(Symbol symbol, SourceInfo source) {
        return new EquivalenceObject(symbol, List.of(), OptionalLong.empty(), source);
    }

    /**
     * @param symbol The array.
     * @param source The source location.
     * @param subscripts The constant subscripts, first dimension first.
     * @return An object referencing one array element.
     */
    public static EquivalenceObject element(Symbol symbol, SourceInfo source, long... subscripts) {
        List<Long> list = new ArrayList<>(subscripts.length);
        for (long s : subscripts) list.add(s);
        return new EquivalenceObject(symbol, list, OptionalLong.empty(), source);
    }

    /**
     * @param symbol The character variable.
     * @param source The source location.
     * @param start The first character position of the substring.
     * @return An object referencing a substring of the whole variable.
     */
    public static EquivalenceObject substring(Symbol symbol, SourceInfo source, long start) {
        return new EquivalenceObject(symbol, List.of(), OptionalLong.of(start), source);
    }
}
