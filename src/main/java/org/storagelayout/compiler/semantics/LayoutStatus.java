package org.storagelayout.compiler.semantics;

/**
 * Tracks whether the layout of a scope has been computed.
 */
public enum LayoutStatus {
    /** Layout has not started. */
    UNPROCESSED,
    /** Layout is running; reentrant requests for this scope are ignored. */
    IN_PROGRESS,
    /** Size and alignment are final. */
    DONE
}
