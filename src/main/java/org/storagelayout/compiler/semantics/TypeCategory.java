package org.storagelayout.compiler.semantics;

/**
 * The category of a declared type.
 */
public enum TypeCategory {
    INTEGER,
    REAL,
    COMPLEX,
    CHARACTER,
    LOGICAL,
    DERIVED;

    /**
     * @return {@code true} for REAL and COMPLEX, the floating-point categories.
     */
    public boolean isFloatingPoint() {
        return this == REAL || this == COMPLEX;
    }
}
