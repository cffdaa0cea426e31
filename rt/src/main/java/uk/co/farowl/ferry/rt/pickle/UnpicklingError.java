// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyType;

/**
 * The pickle stream is malformed, or cannot be reconstructed in this
 * interpreter.
 */
public class UnpicklingError extends PickleError {
    private static final long serialVersionUID = 1L;

    /** The type object of {@code UnpicklingError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("UnpicklingError", "pickle",
                    PickleError.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected UnpicklingError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public UnpicklingError(String msg, Object... args) { this(TYPE, msg, args); }
}
