// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyEnumType;
import uk.co.farowl.ferry.rt.PyObject;
import uk.co.farowl.ferry.rt.PyType;

/**
 * The kinds of type object value pickling distinguishes. The decision is
 * made on what a type can do, not on its exact Java class.
 */
public enum TypeKind {
    /** A class with bases and a dictionary. */
    PLAIN,
    /** An enumeration, whose members are made with the class. */
    ENUM,
    /** The type of one of the special singletons. */
    SINGLETON;

    private static final PyObject[] SINGLETONS =
            {Py.None, Py.Ellipsis, Py.NotImplemented};

    /**
     * Classify a type.
     *
     * @param type to classify
     * @return its kind
     */
    public static TypeKind of(PyType type) {
        if (singletonOf(type) != null) {
            return SINGLETON;
        } else if (type instanceof PyEnumType) {
            return ENUM;
        }
        return PLAIN;
    }

    /**
     * The single instance of the type, if it is the type of one of the
     * special singletons {@code None}, {@code Ellipsis} or
     * {@code NotImplemented}.
     *
     * @param type to test
     * @return the instance or {@code null}
     */
    public static PyObject singletonOf(PyType type) {
        for (PyObject s : SINGLETONS) {
            if (s.getType() == type) { return s; }
        }
        return null;
    }
}
