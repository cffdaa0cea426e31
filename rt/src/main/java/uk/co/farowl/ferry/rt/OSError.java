// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.io.IOException;

/** The Python {@code OSError} exception. */
public class OSError extends PyException {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code OSError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("OSError", "builtins", PyException.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected OSError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public OSError(String msg, Object... args) { this(TYPE, msg, args); }

    /**
     * Wrap a Java {@code IOException} as the cause.
     *
     * @param ioe the Java exception
     */
    public OSError(IOException ioe) {
        this(TYPE, "%s", ioe.getMessage());
        initCause(ioe);
    }
}
