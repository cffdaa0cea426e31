// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * The Python {@code type} object. A {@code PyType} is either built-in,
 * in which case it is created once by the run-time system with
 * {@link #fromSpec(String, String)} and cannot be changed by Python
 * code, or it is defined by a class statement (or reconstructed from a
 * pickle), in which case it has a mutable dictionary and bases that are
 * other {@code PyType}s.
 * <p>
 * The implementation is deliberately plain: attribute look-up follows
 * a depth-first linearisation of the bases, with {@code object} last,
 * and calling a class creates a {@link PyBaseObject} and runs any
 * {@code __init__} found along that linearisation.
 */
public class PyType implements DictPyObject {

    /** The type object of {@code object} objects. */
    public static final PyType OBJECT =
            new PyType("object", "builtins", null);

    /** The type object of {@code type} objects. */
    public static final PyType TYPE = new PyType("type", "builtins", null);

    private static final PyType[] NO_BASES = new PyType[0];

    /** The {@code __name__} attribute. */
    private final String name;

    /** The {@code __qualname__} attribute. */
    private String qualname;

    /**
     * The bases of this type or {@code null} meaning just
     * {@code object}. (Built-in types are created too early to refer
     * to {@link #OBJECT} reliably.)
     */
    private final PyType[] bases;

    /** The dictionary of the type ({@code __dict__}). */
    final PyDict dict;

    /** True for types created by the run-time system. */
    private final boolean builtin;

    /** Implementation of {@code __call__} for built-in types. */
    private Function<Object[], Object> factory;

    /** Cached method resolution order. */
    private PyType[] mro;

    /**
     * Construct a built-in type.
     *
     * @param name of the type
     * @param module name of the module that exposes it
     * @param base single base or {@code null} meaning {@code object}
     */
    private PyType(String name, String module, PyType base) {
        this.name = name;
        this.qualname = name;
        this.bases = base == null ? null : new PyType[] {base};
        this.dict = new PyDict();
        this.dict.put("__module__", module);
        this.builtin = true;
    }

    /**
     * Construct a type defined in Python. The dictionary is copied.
     * {@code __qualname__} is taken from the dictionary if present
     * there (and removed from it), and defaults to the name.
     *
     * @param name of the type
     * @param bases of the type (empty means {@code object})
     * @param dict initial content of {@code __dict__}
     */
    public PyType(String name, PyType[] bases, PyDict dict) {
        this.name = name;
        this.bases = bases.length == 0 ? null : bases.clone();
        this.dict = new PyDict();
        this.dict.putAll(dict);
        Object q = this.dict.remove("__qualname__");
        this.qualname = q instanceof String ? (String)q : name;
        this.builtin = false;
    }

    /**
     * Create a built-in type that has {@code object} as its base.
     *
     * @param name of the type
     * @param module name of the module that exposes it
     * @return the new type
     */
    public static PyType fromSpec(String name, String module) {
        return new PyType(name, module, null);
    }

    /**
     * Create a built-in type with the given base.
     *
     * @param name of the type
     * @param module name of the module that exposes it
     * @param base of the new type
     * @return the new type
     */
    public static PyType fromSpec(String name, String module,
            PyType base) {
        return new PyType(name, module, base);
    }

    /**
     * Give this built-in type an implementation of {@code __call__}.
     *
     * @param f the implementation taking positional arguments
     * @return {@code this}
     */
    public PyType withFactory(Function<Object[], Object> f) {
        this.factory = f;
        return this;
    }

    /**
     * The Python type of any object the run-time system deals in.
     *
     * @param o object
     * @return its type
     */
    public static PyType of(Object o) {
        if (o instanceof PyObject) {
            return ((PyObject)o).getType();
        } else if (o instanceof Boolean) {
            return Py.BOOL;
        } else if (o instanceof Integer
                || o instanceof java.math.BigInteger) {
            return Py.INT;
        } else if (o instanceof Double) {
            return Py.FLOAT;
        } else if (o instanceof String) {
            return Py.STR;
        } else if (o instanceof byte[]) {
            return Py.BYTES;
        }
        throw new InterpreterError("no Python type for Java %s",
                o == null ? "null" : o.getClass().getName());
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public PyDict getDict() { return dict; }

    /** @return {@code __name__} */
    public String getName() { return name; }

    /** @return {@code __qualname__} */
    public String getQualname() { return qualname; }

    /**
     * The {@code __module__} of the type or {@code null} if it is not
     * a string.
     *
     * @return {@code __module__}
     */
    public String getModule() {
        Object m = dict.get("__module__");
        return m instanceof String ? (String)m : null;
    }

    /** @return true if created by the run-time system */
    public boolean isBuiltin() { return builtin; }

    /** @return a copy of {@code __bases__} */
    public PyType[] getBases() {
        if (bases != null) {
            return bases.clone();
        } else if (this == OBJECT) {
            return NO_BASES;
        } else {
            return new PyType[] {OBJECT};
        }
    }

    /**
     * The method resolution order: this type, then a depth-first
     * walk of the bases taking each type once, then {@code object}.
     *
     * @return the linearised bases
     */
    public PyType[] getMRO() {
        PyType[] m = mro;
        if (m == null) {
            List<PyType> list = new ArrayList<>();
            addBases(list, this);
            list.remove(OBJECT);
            list.add(OBJECT);
            mro = m = list.toArray(NO_BASES);
        }
        return m;
    }

    private static void addBases(List<PyType> list, PyType t) {
        if (!list.contains(t)) {
            list.add(t);
            for (PyType b : t.getBases()) { addBases(list, b); }
        }
    }

    /**
     * Look for a name along the MRO of this type, returning the entry
     * from the first dictionary that has it.
     *
     * @param attr to look up
     * @return entry found or {@code null}
     */
    public Object lookup(String attr) {
        for (PyType t : getMRO()) {
            Object v = t.dict.get(attr);
            if (v != null) { return v; }
        }
        return null;
    }

    /**
     * Whether this type is {@code t} or derives from it.
     *
     * @param t possible base
     * @return {@code true} if {@code t} is on the MRO
     */
    public boolean isSubTypeOf(PyType t) {
        return Arrays.asList(getMRO()).contains(t);
    }

    /**
     * Get an attribute of the type, as {@code getattr(type, name)}.
     * Class methods are bound to the type and static methods yield the
     * wrapped callable.
     *
     * @param attr name of the attribute
     * @return the value
     * @throws AttributeError if there is no such attribute
     */
    public Object getAttribute(String attr) throws AttributeError {
        switch (attr) {
            case "__name__":
                return name;
            case "__qualname__":
                return qualname;
            case "__dict__":
                return new PyMappingProxy(dict);
            case "__bases__":
                return new PyTuple((Object[])getBases());
            case "__class__":
                return getType();
            default:
        }
        Object v = lookup(attr);
        if (v == null) {
            // Finally, the meta-type may supply it
            v = getType() == this ? null : getType().lookup(attr);
            if (v == null) {
                throw new AttributeError(
                        "type object '%s' has no attribute '%s'",
                        qualname, attr);
            }
        }
        if (v instanceof PyClassMethod) {
            return new PyMethod(this, ((PyClassMethod)v).getCallable());
        } else if (v instanceof PyStaticMethod) {
            return ((PyStaticMethod)v).getCallable();
        }
        return v;
    }

    /**
     * Set an attribute of the type, as {@code setattr(type, name, v)}.
     *
     * @param attr name of the attribute
     * @param v new value
     * @throws TypeError if the type is built-in or the attribute
     *     read-only
     */
    public void setAttribute(String attr, Object v) throws TypeError {
        if (builtin) {
            throw new TypeError(
                    "cannot set '%s' attribute of immutable type '%s'",
                    attr, name);
        }
        switch (attr) {
            case "__qualname__":
                if (!(v instanceof String)) {
                    throw new TypeError(
                            "can only assign string to %s.__qualname__",
                            name);
                }
                qualname = (String)v;
                break;
            case "__name__":
            case "__dict__":
            case "__bases__":
                throw new TypeError("cannot set '%s' attribute of '%s'",
                        attr, name);
            default:
                dict.put(attr, v);
        }
    }

    /**
     * Call the type, which creates an instance.
     *
     * @param args positional arguments
     * @param kwargs keyword arguments or {@code null}
     * @return the new instance
     * @throws TypeError if instances cannot be created or the
     *     arguments are wrong
     */
    public Object call(Object[] args, PyDict kwargs) throws TypeError {
        if (factory != null) {
            if (kwargs != null && !kwargs.isEmpty()) {
                throw new TypeError("%s() takes no keyword arguments",
                        name);
            }
            return factory.apply(args);
        } else if (builtin) {
            throw new TypeError("cannot create '%s' instances", name);
        }
        PyBaseObject self = new PyBaseObject(this);
        Object init = lookup("__init__");
        if (init != null) {
            Object[] a = new Object[args.length + 1];
            a[0] = self;
            System.arraycopy(args, 0, a, 1, args.length);
            Callables.call(init, a, kwargs);
        } else if (args.length > 0
                || (kwargs != null && !kwargs.isEmpty())) {
            throw new TypeError("%s() takes no arguments", name);
        }
        return self;
    }

    @Override
    public String toString() {
        String module = getModule();
        if (module == null || "builtins".equals(module)) {
            return String.format("<class '%s'>", qualname);
        }
        return String.format("<class '%s.%s'>", module, qualname);
    }
}
