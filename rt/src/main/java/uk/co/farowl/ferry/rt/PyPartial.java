// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Arrays;

/**
 * The {@code functools.partial} object: a callable with some leading
 * positional arguments and some keyword arguments supplied in advance.
 */
public class PyPartial implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("partial",
            "functools").withFactory(args -> new PyPartial(args[0],
                    new PyTuple(Arrays.copyOfRange(args, 1, args.length)),
                    null));

    private final Object func;
    private final PyTuple args;
    private final PyDict keywords;

    /**
     * Create a partial application.
     *
     * @param func to call
     * @param args leading positional arguments
     * @param keywords keyword arguments or {@code null}
     */
    public PyPartial(Object func, PyTuple args, PyDict keywords) {
        this.func = func;
        this.args = args;
        this.keywords = keywords == null ? new PyDict() : keywords;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the function called */
    public Object getFunction() { return func; }

    /** @return the leading positional arguments */
    public PyTuple getArgs() { return args; }

    /** @return the keyword arguments (not a copy) */
    public PyDict getKeywords() { return keywords; }

    /**
     * Call the function with the stored and the given arguments.
     *
     * @param a positional arguments to follow the stored ones
     * @param kw keyword arguments overriding the stored ones or
     *     {@code null}
     * @return result of the call
     */
    public Object call(Object[] a, PyDict kw) {
        Object[] all = Arrays.copyOf(args.value, args.value.length + a.length);
        System.arraycopy(a, 0, all, args.value.length, a.length);
        PyDict k = new PyDict(keywords);
        if (kw != null) { k.putAll(kw); }
        return Callables.call(func, all, k.isEmpty() ? null : k);
    }
}
