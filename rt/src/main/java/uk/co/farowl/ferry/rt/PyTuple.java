// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.RandomAccess;
import java.util.StringJoiner;

/** The Python {@code tuple} object. */
public class PyTuple extends AbstractList<Object>
        implements PyObject, RandomAccess {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType
            .fromSpec("tuple", "builtins")
            .withFactory(args -> args.length == 0 ? PyTuple.EMPTY
                    : PyTuple.from((Collection<?>)args[0]));

    /** Convenient constant for a {@code tuple} with zero elements. */
    public static final PyTuple EMPTY = new PyTuple();

    /** The elements of the {@code tuple}. */
    final Object[] value;

    /**
     * Construct a {@code PyTuple} from an array of objects or zero or
     * more arguments. The argument is copied for use, so it is safe to
     * modify an array passed in.
     *
     * @param value source of element values for this {@code tuple}
     */
    public PyTuple(Object... value) {
        this.value = Arrays.copyOf(value, value.length, Object[].class);
    }

    /**
     * Construct a {@code PyTuple} from the elements of a collection, or
     * if the collection is empty, return {@link #EMPTY}.
     *
     * @param c value of new tuple
     * @return a tuple with the given contents or {@link #EMPTY}
     */
    public static PyTuple from(Collection<?> c) {
        return c.isEmpty() ? EMPTY : new PyTuple(c.toArray());
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public Object get(int i) { return value[i]; }

    @Override
    public int size() { return value.length; }

    @Override
    public Object[] toArray() { return value.clone(); }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "(",
                value.length == 1 ? ",)" : ")");
        for (Object v : value) { sj.add(Abstract.repr(v)); }
        return sj.toString();
    }
}
