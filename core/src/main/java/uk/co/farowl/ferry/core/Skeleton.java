// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import uk.co.farowl.ferry.rt.PyType;

/**
 * Handle on a class being rebuilt from a pickle, returned by
 * {@link SkeletonBuilder#begin(ClassShape)}. The class may be a new
 * shell awaiting its body, or an existing class with the same tracking
 * id, in which case it is {@linkplain #isReused() reused} and its body
 * is never touched.
 */
public final class Skeleton {

    /** Progress of a shell towards a complete class. */
    public enum State {
        /** Referenceable, but the body is still to come. */
        SKELETON,
        /** The body has been filled in. */
        FILLED
    }

    private final PyType type;
    private final boolean reused;
    private volatile State state;

    Skeleton(PyType type, boolean reused, State state) {
        this.type = type;
        this.reused = reused;
        this.state = state;
    }

    /** @return the class (shell or existing) */
    public PyType getType() { return type; }

    /** @return true if an existing class was found for the id */
    public boolean isReused() { return reused; }

    /** @return the current state */
    public State getState() { return state; }

    void filled() { state = State.FILLED; }

    @Override
    public String toString() {
        return String.format("Skeleton[%s, %s%s]", type, state,
                reused ? ", reused" : "");
    }
}
