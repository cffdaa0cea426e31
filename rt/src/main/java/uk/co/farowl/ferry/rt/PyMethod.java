// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * A bound method: a callable pairing an object ({@code __self__}) with
 * a function ({@code __func__}) that will receive it as its first
 * argument.
 */
public class PyMethod implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("MethodType",
            "types").withFactory(args -> new PyMethod(args[1], args[0]));

    /** The object to which the function is bound. */
    private final Object self;

    /** The function (or other callable) bound. */
    private final Object func;

    /**
     * Bind a function to an object.
     *
     * @param self the first argument of every call
     * @param func the callable
     */
    public PyMethod(Object self, Object func) {
        this.self = self;
        this.func = func;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return {@code __self__} */
    public Object getSelf() { return self; }

    /** @return {@code __func__} */
    public Object getFunction() { return func; }

    /**
     * Call the bound function with {@code self} prepended to the
     * arguments.
     *
     * @param args positional arguments
     * @param kwargs keyword arguments or {@code null}
     * @return the result
     */
    public Object call(Object[] args, PyDict kwargs) {
        Object[] a = new Object[args.length + 1];
        a[0] = self;
        System.arraycopy(args, 0, a, 1, args.length);
        return Callables.call(func, a, kwargs);
    }

    @Override
    public String toString() {
        return String.format("<bound method %s of %s>",
                Abstract.getAttr(func, "__qualname__"), self);
    }
}
