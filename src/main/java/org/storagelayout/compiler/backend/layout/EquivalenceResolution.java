package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.semantics.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The EQUIVALENCE structure of one scope: for every aliased symbol, the base symbol and
 * the offset from that base; for every base, the extent of its storage sequence.
 * Rebuilt for every scope and discarded after layout.
 */
public final class EquivalenceResolution {

    private static final Comparator<Symbol> BY_ID = Comparator.comparingInt(Symbol::id);

    private final Map<Symbol, SymbolAndOffset> dependents = new TreeMap<>(BY_ID);
    private final Map<Symbol, SizeAndAlignment> blocks = new TreeMap<>(BY_ID);

    /**
     * @return Aliased symbol to (base symbol, offset of the aliased symbol from the base).
     */
    public Map<Symbol, SymbolAndOffset> dependents() {
        return Collections.unmodifiableMap(dependents);
    }

    /**
     * @return Base symbol to the size and alignment of its whole storage sequence.
     */
    public Map<Symbol, SizeAndAlignment> blocks() {
        return Collections.unmodifiableMap(blocks);
    }

    /**
     * Orders the bases by the first declared symbol of their storage sequence. Which member
     * of a sequence becomes its base depends on the order of the EQUIVALENCE sets; its
     * first declared member does not.
     * @return All base symbols, in placement order.
     */
    public List<Symbol> basesInPlacementOrder() {
        Map<Symbol, Integer> firstMember = new HashMap<>();
        for (Symbol base : blocks.keySet()) {
            firstMember.put(base, base.id());
        }
        for (Map.Entry<Symbol, SymbolAndOffset> entry : dependents.entrySet()) {
            firstMember.merge(entry.getValue().symbol(), entry.getKey().id(), Math::min);
        }
        List<Symbol> bases = new ArrayList<>(blocks.keySet());
        bases.sort(Comparator.comparingInt(firstMember::get));
        return bases;
    }

    public Optional<SymbolAndOffset> dependencyOf(Symbol symbol) {
        return Optional.ofNullable(dependents.get(symbol));
    }

    public boolean isDependent(Symbol symbol) {
        return dependents.containsKey(symbol);
    }

    public boolean isBase(Symbol symbol) {
        return blocks.containsKey(symbol);
    }

    public Optional<SizeAndAlignment> blockOf(Symbol base) {
        return Optional.ofNullable(blocks.get(base));
    }

    /**
     * Grows the storage sequence of a base to at least the base's own size.
     * @param base A base symbol that has been placed.
     * @return The updated size and alignment of the sequence.
     */
    public SizeAndAlignment extendBlockBase(Symbol base) {
        SizeAndAlignment block = blocks.get(base);
        if (block == null) {
            throw new IllegalStateException("No EQUIVALENCE block for base " + base);
        }
        if (base.size() > block.size()) {
            block = new SizeAndAlignment(base.size(), block.alignment());
            blocks.put(base, block);
        }
        return block;
    }

    SymbolAndOffset dependent(Symbol symbol) {
        return dependents.get(symbol);
    }

    /**
     * @return The edge already recorded for the symbol, or null if the new edge was recorded.
     */
    SymbolAndOffset putDependentIfAbsent(Symbol symbol, SymbolAndOffset dependency) {
        return dependents.putIfAbsent(symbol, dependency);
    }

    void replaceDependent(Symbol symbol, SymbolAndOffset dependency) {
        dependents.put(symbol, dependency);
    }

    void includeInBlock(Symbol base, long minSize, long alignment) {
        blocks.merge(base, new SizeAndAlignment(minSize, alignment),
                (a, b) -> new SizeAndAlignment(Math.max(a.size(), b.size()), Math.max(a.alignment(), b.alignment())));
    }

    int dependentCount() {
        return dependents.size();
    }
}
