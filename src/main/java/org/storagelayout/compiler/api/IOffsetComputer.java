package org.storagelayout.compiler.api;

import org.storagelayout.compiler.semantics.Scope;

/**
 * Defines the public interface of the offset assignment stage.
 */
public interface IOffsetComputer {

    /**
     * Assigns offsets, sizes and alignments to the storage entities of the given scope
     * and of all its nested scopes. Diagnostics are reported, not thrown; calling this
     * again on a scope that was already laid out has no effect.
     *
     * @param scope The scope to lay out.
     */
    void compute(Scope scope);
}
