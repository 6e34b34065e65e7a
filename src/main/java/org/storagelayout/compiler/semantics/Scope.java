package org.storagelayout.compiler.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A node of the scope tree. Holds its symbols in declaration order, its EQUIVALENCE sets,
 * its COMMON blocks and its nested scopes. The layout pass writes {@code size} and
 * {@code alignment} once, and tracks its own progress in {@link #status()}.
 */
public final class Scope {

    /**
     * The kind of program unit or construct a scope belongs to.
     */
    public enum Kind {
        GLOBAL,
        MODULE,
        MAIN_PROGRAM,
        SUBPROGRAM,
        BLOCK_DATA,
        DERIVED_TYPE,
        /** A BLOCK construct, where COMMON blocks are not allowed. */
        BLOCK_CONSTRUCT
    }

    private final Kind kind;
    private final Scope parent;
    private final Symbol symbol;
    private final boolean instantiation;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>(); // upper-case name -> symbol
    private final List<EquivalenceSet> equivalenceSets = new ArrayList<>();
    private final Map<String, CommonBlock> commonBlocks = new LinkedHashMap<>();
    private final List<Scope> children = new ArrayList<>();

    private LayoutStatus status = LayoutStatus.UNPROCESSED;
    private long size;
    private long alignment;

    Scope(Kind kind, Scope parent, Symbol symbol, boolean instantiation) {
        this.kind = kind;
        this.parent = parent;
        this.symbol = symbol;
        this.instantiation = instantiation;
    }

    public Kind kind() {
        return kind;
    }

    public Scope parent() {
        return parent;
    }

    /**
     * @return The symbol naming this scope (program unit, derived type), or null.
     */
    public Symbol symbol() {
        return symbol;
    }

    public boolean isDerivedType() {
        return kind == Kind.DERIVED_TYPE;
    }

    /**
     * A kind-parameterized derived type is only laid out through its instantiations.
     * @return {@code true} for the uninstantiated template scope of such a type.
     */
    public boolean isDerivedTypeWithKindParameter() {
        return isDerivedType() && !instantiation && symbol != null
                && symbol.details() instanceof SymbolDetails.DerivedType dt
                && !dt.kindParameters().isEmpty();
    }

    /**
     * @return The symbols of this scope in declaration order.
     */
    public List<Symbol> symbols() {
        return List.copyOf(symbols.values());
    }

    public Optional<Symbol> find(String name) {
        return Optional.ofNullable(symbols.get(name.toUpperCase(Locale.ROOT)));
    }

    public List<EquivalenceSet> equivalenceSets() {
        return Collections.unmodifiableList(equivalenceSets);
    }

    /**
     * @return The COMMON blocks declared in this scope, in declaration order.
     */
    public Collection<CommonBlock> commonBlocks() {
        return Collections.unmodifiableCollection(commonBlocks.values());
    }

    public Optional<CommonBlock> commonBlock(String name) {
        return Optional.ofNullable(commonBlocks.get(name.toUpperCase(Locale.ROOT)));
    }

    public List<Scope> children() {
        return Collections.unmodifiableList(children);
    }

    public LayoutStatus status() {
        return status;
    }

    /**
     * Marks the scope as being laid out.
     * @throws IllegalStateException if the scope is not unprocessed.
     */
    public void markInProgress() {
        if (status != LayoutStatus.UNPROCESSED) {
            throw new IllegalStateException("Scope " + this + " is already " + status);
        }
        status = LayoutStatus.IN_PROGRESS;
    }

    /**
     * Records the final size and alignment of the scope.
     * @param size The total size in bytes.
     * @param alignment The alignment in bytes; the size must be a multiple of it.
     */
    public void finish(long size, long alignment) {
        if (alignment <= 0 || size % alignment != 0) {
            throw new IllegalStateException(
                    "Scope " + this + " size " + size + " is not a multiple of alignment " + alignment);
        }
        this.size = size;
        this.alignment = alignment;
        this.status = LayoutStatus.DONE;
    }

    public long size() {
        return size;
    }

    public long alignment() {
        return alignment;
    }

    boolean contains(String upperName) {
        return symbols.containsKey(upperName);
    }

    void add(Symbol symbol) {
        symbols.put(symbol.name().toUpperCase(Locale.ROOT), symbol);
    }

    void addChild(Scope child) {
        children.add(child);
    }

    void addEquivalenceSet(EquivalenceSet set) {
        equivalenceSets.add(set);
    }

    void addCommonBlock(CommonBlock block) {
        commonBlocks.put(block.name().toUpperCase(Locale.ROOT), block);
    }

    @Override
    public String toString() {
        return kind + (symbol != null ? " " + symbol.name() : "");
    }
}
