// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** The Python {@code ImportError} exception. */
public class ImportError extends PyException {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code ImportError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("ImportError", "builtins", PyException.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected ImportError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ImportError(String msg, Object... args) { this(TYPE, msg, args); }
}
