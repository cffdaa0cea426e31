// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import uk.co.farowl.ferry.rt.pickle.Reconstructors;
import uk.co.farowl.ferry.rt.pickle.Reducible;
import uk.co.farowl.ferry.rt.pickle.Reduction;

/**
 * A member of an enumeration. Members are unique: they are found again
 * (for pickling too) by name in their class.
 */
public class PyEnumMember implements PyObject, Reducible {

    private final PyEnumType type;
    private final String name;
    private final Object value;

    PyEnumMember(PyEnumType type, String name, Object value) {
        this.type = type;
        this.name = name;
        this.value = value;
    }

    @Override
    public PyType getType() { return type; }

    /** @return the {@code name} of the member */
    public String getName() { return name; }

    /** @return the {@code value} of the member */
    public Object getValue() { return value; }

    @Override
    public Reduction reduce() {
        return new Reduction(Reconstructors.ENUM_MEMBER,
                Py.tuple(type, name));
    }

    @Override
    public String toString() {
        return String.format("%s.%s", type.getName(), name);
    }
}
