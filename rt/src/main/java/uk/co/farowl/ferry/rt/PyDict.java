// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The Python {@code dict} object, which keeps its keys in insertion
 * order. Keys are compared with Java {@code equals()}, which is exact
 * for the key types used in practice ({@code str} and {@code int}).
 */
public class PyDict extends LinkedHashMap<Object, Object>
        implements PyObject {
    private static final long serialVersionUID = 1L;

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("dict", "builtins")
            .withFactory(args -> {
                PyDict d = new PyDict();
                if (args.length > 0) { d.putAll((Map<?, ?>)args[0]); }
                return d;
            });

    /** Construct an empty {@code dict}. */
    public PyDict() {}

    /**
     * Construct a {@code dict} with a copy of the given entries.
     *
     * @param m entries to copy
     */
    public PyDict(Map<?, ?> m) { super(m); }

    @Override
    public PyType getType() { return TYPE; }
}
