package org.storagelayout.compiler.backend.layout;

/**
 * A size and an alignment, both in bytes.
 *
 * @param size The size.
 * @param alignment The alignment.
 */
public record SizeAndAlignment(long size, long alignment) {

    /** The size and alignment of something that occupies no storage. */
    public static final SizeAndAlignment EMPTY = new SizeAndAlignment(0, 0);

    public boolean isEmpty() {
        return size == 0;
    }
}
