package org.storagelayout.compiler.backend.layout.alignment;

import java.util.OptionalLong;

/**
 * Outcome of looking up a target-specific alignment for a symbol.
 */
public sealed interface AlignmentOverride permits AlignmentOverride.None, AlignmentOverride.Value, AlignmentOverride.Malformed {

    /** The symbol keeps its natural alignment. */
    record None() implements AlignmentOverride {}

    /**
     * The symbol is aligned to {@code bytes} instead of its natural alignment.
     * @param bytes The alignment in bytes.
     */
    record Value(long bytes) implements AlignmentOverride {}

    /**
     * The type could not be inspected; the symbol keeps its natural alignment.
     * @param reason What went wrong, for tracing.
     */
    record Malformed(String reason) implements AlignmentOverride {}

    AlignmentOverride NONE = new None();

    static AlignmentOverride of(long alignment) {
        return new Value(alignment);
    }

    /**
     * @return The overriding alignment, or empty if the natural alignment applies.
     */
    default OptionalLong alignment() {
        return this instanceof Value v ? OptionalLong.of(v.bytes()) : OptionalLong.empty();
    }
}
