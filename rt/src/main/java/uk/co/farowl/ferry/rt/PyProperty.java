// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * The Python {@code property} descriptor. Attribute access on an
 * instance of a class that has a {@code property} in its dictionary
 * calls the getter (or setter) with the instance.
 */
public class PyProperty implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("property",
            "builtins").withFactory(args -> new PyProperty(arg(args, 0),
                    arg(args, 1), arg(args, 2), arg(args, 3)));

    private final Object fget, fset, fdel, doc;

    /**
     * Create a property from its accessor functions. Any argument may
     * be {@code None} (or {@code null}).
     *
     * @param fget getter
     * @param fset setter
     * @param fdel deleter
     * @param doc documentation
     */
    public PyProperty(Object fget, Object fset, Object fdel, Object doc) {
        this.fget = Py.noneIfNull(fget);
        this.fset = Py.noneIfNull(fset);
        this.fdel = Py.noneIfNull(fdel);
        this.doc = Py.noneIfNull(doc);
    }

    private static Object arg(Object[] args, int i) {
        return i < args.length ? args[i] : Py.None;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return {@code fget} */
    public Object getGetter() { return fget; }

    /** @return {@code fset} */
    public Object getSetter() { return fset; }

    /** @return {@code fdel} */
    public Object getDeleter() { return fdel; }

    /** @return {@code __doc__} */
    public Object getDoc() { return doc; }

    /**
     * Get the value for the given instance.
     *
     * @param obj instance
     * @return value
     */
    Object get(Object obj) {
        if (fget == Py.None) {
            throw new AttributeError("unreadable attribute");
        }
        return Callables.call(fget, obj);
    }

    /**
     * Set the value for the given instance.
     *
     * @param obj instance
     * @param v value
     */
    void set(Object obj, Object v) {
        if (fset == Py.None) {
            throw new AttributeError("can't set attribute");
        }
        Callables.call(fset, obj, v);
    }
}
