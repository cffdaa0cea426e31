// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyTuple;

/**
 * How to rebuild an object: call {@code constructor(*args)} and then, if
 * there is state, either {@code setter(obj, state)} or (when there is no
 * setter) the default application of the state to the object. This is
 * the whole protocol between the strategies that reduce objects and the
 * stream that records and replays them.
 * <p>
 * The constructor and setter are either a {@link Reconstructor}
 * (recorded by name) or any callable object that can itself be pickled.
 */
public final class Reduction {

    private final Object constructor;
    private final PyTuple args;
    private final Object state;
    private final Object setter;

    /**
     * A reduction with state.
     *
     * @param constructor to call
     * @param args for the constructor
     * @param state to apply or {@code null}
     * @param setter to apply the state or {@code null} for the default
     */
    public Reduction(Object constructor, PyTuple args, Object state,
            Object setter) {
        assert constructor != null && args != null;
        this.constructor = constructor;
        this.args = args;
        this.state = state;
        this.setter = setter;
    }

    /**
     * A reduction without state.
     *
     * @param constructor to call
     * @param args for the constructor
     */
    public Reduction(Object constructor, PyTuple args) {
        this(constructor, args, null, null);
    }

    /** @return the constructor */
    public Object getConstructor() { return constructor; }

    /** @return the arguments to the constructor */
    public PyTuple getArgs() { return args; }

    /** @return the state or {@code null} */
    public Object getState() { return state; }

    /** @return the state setter or {@code null} */
    public Object getSetter() { return setter; }
}
