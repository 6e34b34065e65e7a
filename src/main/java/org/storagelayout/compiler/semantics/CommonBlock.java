package org.storagelayout.compiler.semantics;

import org.storagelayout.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A COMMON block of a scope. Members are kept in declaration order, which determines their offsets.
 * Blank COMMON has the empty name.
 */
public final class CommonBlock {

    private final String name;
    private final SourceInfo source;
    private final Scope owner;
    private final List<Symbol> objects = new ArrayList<>();
    private boolean initialized;

    private long size;
    private long alignment;

    CommonBlock(String name, SourceInfo source, Scope owner) {
        this.name = name;
        this.source = source;
        this.owner = owner;
    }

    public String name() {
        return name;
    }

    public boolean isBlank() {
        return name.isEmpty();
    }

    public SourceInfo source() {
        return source;
    }

    public Scope owner() {
        return owner;
    }

    public List<Symbol> objects() {
        return Collections.unmodifiableList(objects);
    }

    void add(Symbol symbol) {
        objects.add(symbol);
    }

    /**
     * @return {@code true} if a DATA statement or BLOCK DATA initializes this occurrence.
     */
    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public long size() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public long alignment() {
        return alignment;
    }

    public void setAlignment(long alignment) {
        this.alignment = alignment;
    }

    @Override
    public String toString() {
        return "/" + name + "/";
    }
}
