// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * An object that has an instance dictionary ({@code __dict__}) that
 * attribute access consults before the type.
 */
public interface DictPyObject extends PyObject {

    /**
     * The instance dictionary. This is the object itself, not a copy,
     * and may be updated in place.
     *
     * @return instance dictionary (not {@code null})
     */
    PyDict getDict();
}
