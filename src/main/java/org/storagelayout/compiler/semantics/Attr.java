package org.storagelayout.compiler.semantics;

/**
 * Attributes of a symbol that are relevant to storage layout.
 */
public enum Attr {
    ALLOCATABLE,
    POINTER,
    BIND_C,
    DUMMY,
    SAVE
}
