// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.ArrayList;
import java.util.Collection;

/** The Python {@code list} object. */
public class PyList extends ArrayList<Object> implements PyObject {
    private static final long serialVersionUID = 1L;

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("list", "builtins")
            .withFactory(args -> args.length == 0 ? new PyList()
                    : new PyList((Collection<?>)args[0]));

    /** Construct an empty {@code list}. */
    public PyList() {}

    /**
     * Construct a {@code list} with a copy of the given elements.
     *
     * @param c elements to copy
     */
    public PyList(Collection<?> c) { super(c); }

    @Override
    public PyType getType() { return TYPE; }
}
