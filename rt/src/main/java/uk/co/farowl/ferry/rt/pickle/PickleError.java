// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.PyException;

/** Common base of the errors raised while pickling and unpickling. */
public class PickleError extends PyException {
    private static final long serialVersionUID = 1L;

    /** The type object of {@code PickleError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("PickleError", "pickle",
                    PyException.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected PickleError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PickleError(String msg, Object... args) { this(TYPE, msg, args); }
}
