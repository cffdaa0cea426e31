// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** The Python {@code BaseException} exception. */
public class BaseException extends RuntimeException implements PyObject {
    private static final long serialVersionUID = 1L;

    /** The type of Python object this class implements. */
    public static final PyType TYPE =
            PyType.fromSpec("BaseException", "builtins");

    private final PyType type;

    /**
     * Constructor for sub-class use specifying {@link #type}.
     *
     * @param type object being constructed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected BaseException(PyType type, String msg, Object... args) {
        super(String.format(msg, args));
        this.type = type;
    }

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public BaseException(String msg, Object... args) {
        this(TYPE, msg, args);
    }

    @Override
    public PyType getType() { return type; }

    @Override
    public String toString() {
        return String.format("%s: %s", type.getName(), getMessage());
    }
}
