// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * The "abstract object API": attribute access, truth, arithmetic and
 * comparison on any object the run-time system deals in. The
 * interpreter and the pickling machinery go through these methods
 * rather than depend on the implementation class of an object.
 */
public class Abstract {

    private Abstract() {} // only static methods here

    /**
     * {@code o.name}: get an attribute from the object.
     *
     * @param o object to operate on
     * @param name of attribute
     * @return the attribute value
     * @throws AttributeError if there is no such attribute
     */
    // Compare CPython PyObject_GenericGetAttr in object.c
    public static Object getAttr(Object o, String name)
            throws AttributeError {
        if (o instanceof PyType) {
            return ((PyType)o).getAttribute(name);
        } else if (o instanceof PyModule) {
            return ((PyModule)o).getAttribute(name);
        }

        Object v = specialAttr(o, name);
        if (v != null) { return v; }

        PyType type = PyType.of(o);
        Object typeAttr = type.lookup(name);
        if (typeAttr instanceof PyProperty) {
            // A data descriptor takes precedence over the instance
            return ((PyProperty)typeAttr).get(o);
        }
        if (o instanceof DictPyObject) {
            PyDict dict = ((DictPyObject)o).getDict();
            v = dict.get(name);
            if (v != null) {
                return v;
            } else if ("__dict__".equals(name)) { return dict; }
        }
        if (typeAttr != null) {
            return bind(typeAttr, o, type);
        } else if ("__class__".equals(name)) { return type; }
        throw noAttributeError(o, name);
    }

    /** Bind a non-data descriptor found on the type to an instance. */
    private static Object bind(Object typeAttr, Object o, PyType type) {
        if (typeAttr instanceof PyFunction) {
            return new PyMethod(o, typeAttr);
        } else if (typeAttr instanceof PyClassMethod) {
            return new PyMethod(type,
                    ((PyClassMethod)typeAttr).getCallable());
        } else if (typeAttr instanceof PyStaticMethod) {
            return ((PyStaticMethod)typeAttr).getCallable();
        }
        return typeAttr;
    }

    /**
     * Attributes implemented by fields of specific object
     * implementations, or {@code null} if {@code name} is not one.
     */
    private static Object specialAttr(Object o, String name) {
        if (o instanceof PyFunction) {
            PyFunction f = (PyFunction)o;
            switch (name) {
                case "__name__":
                    return f.name;
                case "__qualname__":
                    return f.qualname;
                case "__module__":
                    return f.module;
                case "__doc__":
                    return f.doc;
                case "__code__":
                    return f.code;
                case "__globals__":
                    return f.globals;
                case "__defaults__":
                    return f.defaults == null ? Py.None
                            : new PyTuple(f.defaults);
                case "__kwdefaults__":
                    return Py.noneIfNull(f.kwdefaults);
                case "__closure__":
                    return f.closure == null ? Py.None
                            : new PyTuple((Object[])f.closure);
                case "__annotations__":
                    return f.getAnnotations();
                default:
                    return null;
            }
        } else if (o instanceof PyMethod) {
            PyMethod m = (PyMethod)o;
            switch (name) {
                case "__self__":
                    return m.getSelf();
                case "__func__":
                    return m.getFunction();
                case "__name__":
                case "__qualname__":
                case "__doc__":
                    return getAttr(m.getFunction(), name);
                default:
                    return null;
            }
        } else if (o instanceof PyJavaFunction) {
            PyJavaFunction f = (PyJavaFunction)o;
            switch (name) {
                case "__name__":
                case "__qualname__":
                    return f.getName();
                case "__module__":
                    return Py.noneIfNull(f.getModule());
                default:
                    return null;
            }
        } else if (o instanceof PyCell && "cell_contents".equals(name)) {
            return ((PyCell)o).getContents();
        } else if (o instanceof PyEnumMember) {
            PyEnumMember m = (PyEnumMember)o;
            if ("name".equals(name)) {
                return m.getName();
            } else if ("value".equals(name)) { return m.getValue(); }
        } else if (o instanceof PyCode) {
            PyCode c = (PyCode)o;
            if ("co_name".equals(name)) {
                return c.name;
            } else if ("co_qualname".equals(name)) { return c.qualname; }
        }
        return null;
    }

    /**
     * {@code o.name = value}: set an attribute on the object.
     *
     * @param o object to operate on
     * @param name of attribute
     * @param value to set
     * @throws AttributeError if the attribute cannot be set
     * @throws TypeError if the value is not suitable
     */
    // Compare CPython PyObject_GenericSetAttr in object.c
    public static void setAttr(Object o, String name, Object value)
            throws AttributeError, TypeError {
        if (o instanceof PyType) {
            ((PyType)o).setAttribute(name, value);
            return;
        } else if (o instanceof PyFunction
                && setFunctionAttr((PyFunction)o, name, value)) {
            return;
        } else if (o instanceof PyCell && "cell_contents".equals(name)) {
            ((PyCell)o).set(value);
            return;
        }
        Object typeAttr = PyType.of(o).lookup(name);
        if (typeAttr instanceof PyProperty) {
            ((PyProperty)typeAttr).set(o, value);
        } else if (o instanceof DictPyObject) {
            ((DictPyObject)o).getDict().put(name, value);
        } else {
            throw noAttributeError(o, name);
        }
    }

    private static boolean setFunctionAttr(PyFunction f, String name,
            Object v) {
        switch (name) {
            case "__name__":
                f.setName(checkStr(name, v));
                return true;
            case "__qualname__":
                f.setQualname(checkStr(name, v));
                return true;
            case "__module__":
                f.setModule(v);
                return true;
            case "__doc__":
                f.setDoc(v);
                return true;
            case "__defaults__":
                f.setDefaults(v == Py.None ? null : (PyTuple)v);
                return true;
            case "__kwdefaults__":
                f.setKwdefaults(v == Py.None ? null : (PyDict)v);
                return true;
            case "__annotations__":
                f.setAnnotations(v == Py.None ? null : (PyDict)v);
                return true;
            case "__code__":
            case "__globals__":
            case "__closure__":
                throw new AttributeError("readonly attribute");
            default:
                return false;
        }
    }

    private static String checkStr(String name, Object v) {
        if (v instanceof String) { return (String)v; }
        throw new TypeError("%s must be set to a string object", name);
    }

    /**
     * {@code del o.name}: delete an attribute from the instance
     * dictionary of an object or from a class.
     *
     * @param o object to operate on
     * @param name of attribute
     * @throws AttributeError if there is no such attribute
     */
    public static void delAttr(Object o, String name)
            throws AttributeError {
        PyDict dict = o instanceof DictPyObject
                ? ((DictPyObject)o).getDict() : null;
        if (dict == null || dict.remove(name) == null) {
            throw noAttributeError(o, name);
        }
    }

    /**
     * Follow a dotted path of attribute names from an object, for
     * example the {@code __qualname__} of a nested class from its
     * module. A path through {@code <locals>} cannot be followed.
     *
     * @param root object at which to start
     * @param dotted path of attribute names
     * @return the object reached
     * @throws AttributeError if some attribute does not exist
     */
    public static Object lookupDotted(Object root, String dotted)
            throws AttributeError {
        Object o = root;
        for (String part : dotted.split("\\.")) {
            if ("<locals>".equals(part)) {
                throw new AttributeError(
                        "Can't get local attribute '%s' on %s", dotted,
                        root);
            }
            o = getAttr(o, part);
        }
        return o;
    }

    /**
     * Create an {@link AttributeError} with a message along the lines
     * "'T' object has no attribute N".
     *
     * @param o object of which attribute was sought
     * @param name of the attribute
     * @return exception to throw
     */
    public static AttributeError noAttributeError(Object o, String name) {
        return new AttributeError("'%.50s' object has no attribute '%.50s'",
                PyType.of(o).getName(), name);
    }

    /**
     * Test an object for truth, as {@code bool(v)}.
     *
     * @param v to test
     * @return truth of {@code v}
     */
    public static boolean isTrue(Object v) {
        if (v instanceof Boolean) {
            return (Boolean)v;
        } else if (v == Py.None) {
            return false;
        } else if (v instanceof Integer) {
            return (Integer)v != 0;
        } else if (v instanceof BigInteger) {
            return ((BigInteger)v).signum() != 0;
        } else if (v instanceof Double) {
            return (Double)v != 0.0;
        } else if (v instanceof String) {
            return !((String)v).isEmpty();
        } else if (v instanceof Collection) {
            return !((Collection<?>)v).isEmpty();
        } else if (v instanceof Map) {
            return !((Map<?, ?>)v).isEmpty();
        }
        return true;
    }

    /**
     * {@code v + w}.
     *
     * @param v left operand
     * @param w right operand
     * @return sum
     */
    public static Object add(Object v, Object w) {
        if (isInt(v) && isInt(w)) {
            if (v instanceof Integer && w instanceof Integer) {
                long r = (long)(Integer)v + (Integer)w;
                return Py.val(BigInteger.valueOf(r));
            }
            return Py.val(toBig(v).add(toBig(w)));
        } else if (isNumber(v) && isNumber(w)) {
            return asDouble(v) + asDouble(w);
        } else if (v instanceof String && w instanceof String) {
            return (String)v + (String)w;
        } else if (v instanceof PyTuple && w instanceof PyTuple) {
            PyList l = new PyList((PyTuple)v);
            l.addAll((PyTuple)w);
            return PyTuple.from(l);
        } else if (v instanceof PyList && w instanceof PyList) {
            PyList l = new PyList((PyList)v);
            l.addAll((PyList)w);
            return l;
        }
        throw operandError("+", v, w);
    }

    /**
     * {@code v - w}.
     *
     * @param v left operand
     * @param w right operand
     * @return difference
     */
    public static Object subtract(Object v, Object w) {
        if (isInt(v) && isInt(w)) {
            return Py.val(toBig(v).subtract(toBig(w)));
        } else if (isNumber(v) && isNumber(w)) {
            return asDouble(v) - asDouble(w);
        }
        throw operandError("-", v, w);
    }

    /**
     * {@code v * w}.
     *
     * @param v left operand
     * @param w right operand
     * @return product
     */
    public static Object multiply(Object v, Object w) {
        if (isInt(v) && isInt(w)) {
            return Py.val(toBig(v).multiply(toBig(w)));
        } else if (isNumber(v) && isNumber(w)) {
            return asDouble(v) * asDouble(w);
        } else if (v instanceof String && isInt(w)) {
            return ((String)v).repeat(Math.max(0, toBig(w).intValue()));
        }
        throw operandError("*", v, w);
    }

    private static TypeError operandError(String op, Object v, Object w) {
        return new TypeError(
                "unsupported operand type(s) for %s: '%.100s' and '%.100s'",
                op, PyType.of(v).getName(), PyType.of(w).getName());
    }

    /** Comparison operators in the order of {@code COMPARE_OP}. */
    private static final String[] COMPARE_OPS =
            {"<", "<=", "==", "!=", ">", ">="};

    /**
     * Compare two objects using the operator numbered {@code op} as
     * for {@code COMPARE_OP}: {@code <, <=, ==, !=, >, >=}.
     *
     * @param v left operand
     * @param w right operand
     * @param op operator number 0 to 5
     * @return {@code Boolean} result
     */
    public static Object richCompare(Object v, Object w, int op) {
        if (op == 2) {
            return equals(v, w);
        } else if (op == 3) {
            return !equals(v, w);
        } else if (op < 0 || op > 5) {
            throw new InterpreterError("bad comparison %d", op);
        }
        int c;
        if (isInt(v) && isInt(w)) {
            c = toBig(v).compareTo(toBig(w));
        } else if (isNumber(v) && isNumber(w)) {
            c = Double.compare(asDouble(v), asDouble(w));
        } else if (v instanceof String && w instanceof String) {
            c = ((String)v).compareTo((String)w);
        } else {
            throw new TypeError(
                    "'%s' not supported between instances of '%.100s' and '%.100s'",
                    COMPARE_OPS[op], PyType.of(v).getName(),
                    PyType.of(w).getName());
        }
        switch (op) {
            case 0:
                return c < 0;
            case 1:
                return c <= 0;
            case 4:
                return c > 0;
            default:
                return c >= 0;
        }
    }

    /**
     * Python equality, which treats numbers of different Java
     * representation as equal when their values are.
     *
     * @param v left operand
     * @param w right operand
     * @return {@code v == w}
     */
    public static boolean equals(Object v, Object w) {
        if (isInt(v) && isInt(w)) {
            return toBig(v).equals(toBig(w));
        } else if (isNumber(v) && isNumber(w)) {
            return asDouble(v) == asDouble(w);
        }
        return Objects.equals(v, w);
    }

    private static boolean isInt(Object v) {
        return v instanceof Integer || v instanceof BigInteger
                || v instanceof Boolean;
    }

    private static boolean isNumber(Object v) {
        return isInt(v) || v instanceof Double;
    }

    private static BigInteger toBig(Object v) {
        if (v instanceof BigInteger) {
            return (BigInteger)v;
        } else if (v instanceof Boolean) {
            return (Boolean)v ? BigInteger.ONE : BigInteger.ZERO;
        }
        return BigInteger.valueOf((Integer)v);
    }

    /**
     * Convert to {@code int} as Python {@code int(v)} would.
     *
     * @param v to convert
     * @return {@code Integer} or {@code BigInteger}
     */
    public static Object asInt(Object v) {
        if (isInt(v)) {
            return Py.val(toBig(v));
        } else if (v instanceof Double) {
            return Py.val(java.math.BigDecimal.valueOf((Double)v)
                    .toBigInteger());
        } else if (v instanceof String) {
            try {
                return Py.val(new BigInteger(((String)v).trim()));
            } catch (NumberFormatException e) {
                throw new ValueError(
                        "invalid literal for int() with base 10: %s",
                        repr(v));
            }
        }
        throw new TypeError("int() argument must be a string or a number,"
                + " not '%s'", PyType.of(v).getName());
    }

    /**
     * Convert to {@code float} as Python {@code float(v)} would.
     *
     * @param v to convert
     * @return value as a {@code double}
     */
    public static double asDouble(Object v) {
        if (v instanceof Double) {
            return (Double)v;
        } else if (isInt(v)) {
            return toBig(v).doubleValue();
        } else if (v instanceof String) {
            try {
                return Double.parseDouble(((String)v).trim());
            } catch (NumberFormatException e) {
                throw new ValueError(
                        "could not convert string to float: %s", repr(v));
            }
        }
        throw new TypeError("float() argument must be a string or a number,"
                + " not '%s'", PyType.of(v).getName());
    }

    /**
     * {@code str(v)}.
     *
     * @param v object
     * @return string form
     */
    public static String str(Object v) {
        if (v instanceof Boolean) { return (Boolean)v ? "True" : "False"; }
        return String.valueOf(v);
    }

    /**
     * {@code repr(v)}.
     *
     * @param v object
     * @return printable representation
     */
    public static String repr(Object v) {
        if (v instanceof String) {
            return "'" + ((String)v).replace("'", "\\'") + "'";
        }
        return str(v);
    }
}
