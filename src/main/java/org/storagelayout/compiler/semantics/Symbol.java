package org.storagelayout.compiler.semantics;

import org.storagelayout.compiler.api.SourceInfo;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A named entity of a scope. The layout pass writes {@code offset}, {@code size} and,
 * for symbols storage associated into a COMMON block, the owning block.
 * <p>
 * Symbols are identified by a stable id handed out in creation order by the {@link SymbolTable}.
 */
public final class Symbol {

    private final int id;
    private final String name;
    private final SourceInfo source;
    private final Scope owner;
    private final Set<Attr> attrs;
    private final SymbolDetails details;

    private long offset;
    private long size;
    private CommonBlock commonBlock;

    Symbol(int id, String name, SourceInfo source, Scope owner, Set<Attr> attrs, SymbolDetails details) {
        this.id = id;
        this.name = name;
        this.source = source;
        this.owner = owner;
        this.attrs = attrs.isEmpty() ? EnumSet.noneOf(Attr.class) : EnumSet.copyOf(attrs);
        this.details = details;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public SourceInfo source() {
        return source;
    }

    /**
     * @return The scope in which the symbol is declared.
     */
    public Scope owner() {
        return owner;
    }

    public Set<Attr> attrs() {
        return Collections.unmodifiableSet(attrs);
    }

    public boolean has(Attr attr) {
        return attrs.contains(attr);
    }

    public SymbolDetails details() {
        return details;
    }

    public boolean isObjectEntity() {
        return details instanceof SymbolDetails.ObjectEntity;
    }

    public boolean isProcEntity() {
        return details instanceof SymbolDetails.ProcEntity;
    }

    public boolean isProcedurePointer() {
        return isProcEntity() && attrs.contains(Attr.POINTER);
    }

    /**
     * @return {@code true} for subprograms and procedure entities that are not pointers.
     */
    public boolean isProcedure() {
        return details instanceof SymbolDetails.Subprogram || (isProcEntity() && !attrs.contains(Attr.POINTER));
    }

    /**
     * A descriptor entity is a data object whose storage is a runtime descriptor:
     * allocatables, data pointers, polymorphic objects and assumed- or deferred-shape arrays.
     * @return {@code true} if this symbol is laid out as a descriptor.
     */
    public boolean isDescriptor() {
        if (!(details instanceof SymbolDetails.ObjectEntity object)) {
            return false;
        }
        if (attrs.contains(Attr.ALLOCATABLE) || attrs.contains(Attr.POINTER)) {
            return true;
        }
        if (object.type() != null && object.type().polymorphic()) {
            return true;
        }
        return object.shape().isAssumedOrDeferredShape();
    }

    /**
     * @return The declared type of a data object, or null for other symbols.
     */
    public DeclaredType type() {
        return details instanceof SymbolDetails.ObjectEntity object ? object.type() : null;
    }

    /**
     * @return The declared shape of a data object; scalars and non-objects have rank 0.
     */
    public ArraySpec shape() {
        return details instanceof SymbolDetails.ObjectEntity object ? object.shape() : ArraySpec.SCALAR;
    }

    public int rank() {
        return shape().rank();
    }

    public long offset() {
        return offset;
    }

    public void setOffset(long offset) {
        this.offset = offset;
    }

    public long size() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    /**
     * @return The COMMON block containing this symbol, or null.
     */
    public CommonBlock commonBlock() {
        return commonBlock;
    }

    public void setCommonBlock(CommonBlock commonBlock) {
        this.commonBlock = commonBlock;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
