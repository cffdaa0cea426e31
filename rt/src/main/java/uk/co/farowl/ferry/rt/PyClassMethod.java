// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * The Python {@code classmethod} descriptor: the wrapped callable is
 * bound to the class, whether accessed on the class or an instance.
 */
public class PyClassMethod implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("classmethod",
            "builtins").withFactory(args -> new PyClassMethod(args[0]));

    private final Object callable;

    /**
     * Wrap a callable.
     *
     * @param callable to wrap
     */
    public PyClassMethod(Object callable) { this.callable = callable; }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the wrapped callable ({@code __func__}) */
    public Object getCallable() { return callable; }
}
