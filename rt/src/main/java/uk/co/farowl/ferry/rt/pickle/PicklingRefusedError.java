// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyType;

/**
 * Pickling an object was refused before anything was written for it,
 * because what it would mean at the destination cannot be reproduced
 * (such as a stream open for writing or a held lock).
 */
public class PicklingRefusedError extends PicklingError {
    private static final long serialVersionUID = 1L;

    /** The type object of {@code PicklingRefusedError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("PicklingRefusedError", "pickle",
                    PicklingError.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected PicklingRefusedError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PicklingRefusedError(String msg, Object... args) { this(TYPE, msg, args); }
}
