// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** The Python {@code Exception} exception. */
public class PyException extends BaseException {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code Exception} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("Exception", "builtins", BaseException.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected PyException(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public PyException(String msg, Object... args) { this(TYPE, msg, args); }
}
