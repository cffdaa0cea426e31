// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * The Python {@code staticmethod} descriptor: the wrapped callable is
 * returned unbound from both the class and its instances.
 */
public class PyStaticMethod implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("staticmethod",
            "builtins").withFactory(args -> new PyStaticMethod(args[0]));

    private final Object callable;

    /**
     * Wrap a callable.
     *
     * @param callable to wrap
     */
    public PyStaticMethod(Object callable) { this.callable = callable; }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the wrapped callable ({@code __func__}) */
    public Object getCallable() { return callable; }
}
