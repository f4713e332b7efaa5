package org.ronjava.runtime.runtimetypes;

/**
 * Aliasing classification of a value. In-place mutation is legal below SHARED.
 */
public enum SharingLevel {
    /** Only reachable from the operand stack or from the primitive that created it. */
    UNSHARED,
    /** Reachable from exactly one binding or container slot. */
    BOUND_ONCE,
    /** Possibly reachable from several places; must be duplicated before mutation. */
    SHARED;

    /**
     * Saturating increment.
     */
    public SharingLevel next() {
        return this == UNSHARED ? BOUND_ONCE : SHARED;
    }
}
