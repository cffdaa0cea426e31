// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** The Python {@code AttributeError} exception. */
public class AttributeError extends PyException {
    private static final long serialVersionUID = 1L;

    /** The type object of Python {@code AttributeError} exceptions. */
    @SuppressWarnings("hiding")
    public static final PyType TYPE =
            PyType.fromSpec("AttributeError", "builtins", PyException.TYPE);

    /**
     * Constructor for sub-class use specifying the type.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected AttributeError(PyType type, String msg, Object... args) {
        super(type, msg, args);
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public AttributeError(String msg, Object... args) { this(TYPE, msg, args); }
}
