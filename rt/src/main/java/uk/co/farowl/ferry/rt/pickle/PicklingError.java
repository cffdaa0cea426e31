// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyType;

/**
 * An object cannot be pickled: it has no reference path and no way
 * to be pickled by value.
 */
public class PicklingError extends PickleError {
    private static final long serialVersionUID = 1L;

    /** The type object of {@code PicklingError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("PicklingError", "pickle",
                    PickleError.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected PicklingError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PicklingError(String msg, Object... args) { this(TYPE, msg, args); }
}
