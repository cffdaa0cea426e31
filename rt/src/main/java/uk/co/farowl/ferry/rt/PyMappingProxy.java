// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Collections;
import java.util.Map;

/**
 * The {@code types.MappingProxyType}: a read-only view of a mapping,
 * such as the {@code __dict__} of a class.
 */
public class PyMappingProxy implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("MappingProxyType",
            "types").withFactory(
                    args -> new PyMappingProxy((Map<?, ?>)args[0]));

    private final Map<?, ?> mapping;

    /**
     * Create a view of the given mapping, which is not copied.
     *
     * @param mapping to view
     */
    public PyMappingProxy(Map<?, ?> mapping) { this.mapping = mapping; }

    @Override
    public PyType getType() { return TYPE; }

    /** @return an unmodifiable view of the mapping */
    public Map<?, ?> getMapping() {
        return Collections.unmodifiableMap(mapping);
    }

    /** @return a {@code dict} copy of the current content */
    public PyDict copy() { return new PyDict(mapping); }
}
