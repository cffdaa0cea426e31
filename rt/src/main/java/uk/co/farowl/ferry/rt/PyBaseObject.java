// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import uk.co.farowl.ferry.rt.pickle.Reconstructors;
import uk.co.farowl.ferry.rt.pickle.Reducible;
import uk.co.farowl.ferry.rt.pickle.Reduction;

/**
 * An instance of a class defined in Python. Its attributes live in its
 * instance dictionary, and it reduces for pickling to a bare instance
 * of its class (without calling {@code __init__}) plus that dictionary
 * as state.
 */
public class PyBaseObject implements DictPyObject, Reducible {

    private final PyType type;

    private final PyDict dict = new PyDict();

    /**
     * Create an instance with an empty dictionary.
     *
     * @param type of the new object
     */
    public PyBaseObject(PyType type) { this.type = type; }

    @Override
    public PyType getType() { return type; }

    @Override
    public PyDict getDict() { return dict; }

    // Compare CPython object___reduce_ex___impl in typeobject.c
    @Override
    public Reduction reduce() {
        return new Reduction(Reconstructors.OBJECT_NEW, Py.tuple(type),
                dict.isEmpty() ? null : dict, null);
    }

    @Override
    public String toString() {
        return String.format("<%s object at %#x>", type.getQualname(),
                System.identityHashCode(this));
    }
}
