// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.math.BigInteger;

/**
 * Common run-time constants and the types of objects the run-time
 * system represents with plain Java classes.
 */
public final class Py {

    private Py() {} // no instances

    /** Python {@code int}: {@code Integer} or {@code BigInteger}. */
    public static final PyType INT =
            PyType.fromSpec("int", "builtins").withFactory(
                    args -> args.length == 0 ? Integer.valueOf(0)
                            : Abstract.asInt(args[0]));

    /** Python {@code bool}: {@code Boolean}. */
    public static final PyType BOOL = PyType.fromSpec("bool", "builtins",
            INT).withFactory(args -> args.length == 0 ? Boolean.FALSE
                    : Abstract.isTrue(args[0]));

    /** Python {@code float}: {@code Double}. */
    public static final PyType FLOAT = PyType.fromSpec("float",
            "builtins").withFactory(args -> args.length == 0 ? 0.0
                    : Abstract.asDouble(args[0]));

    /** Python {@code str}: {@code String}. */
    public static final PyType STR = PyType.fromSpec("str", "builtins")
            .withFactory(args -> args.length == 0 ? ""
                    : Abstract.str(args[0]));

    /** Python {@code bytes}: {@code byte[]}. */
    public static final PyType BYTES =
            PyType.fromSpec("bytes", "builtins");

    /**
     * An object with exactly one instance, such as {@code None}. The
     * type of each is a special type not exposed by any module.
     */
    static final class Singleton implements PyObject {

        private final PyType type;
        private final String name;

        Singleton(String typeName, String name) {
            this.type = PyType.fromSpec(typeName, "builtins");
            this.type.withFactory(args -> this);
            this.name = name;
        }

        @Override
        public PyType getType() { return type; }

        @Override
        public String toString() { return name; }
    }

    /** Python {@code None}. */
    public static final PyObject None = new Singleton("NoneType", "None");

    /** Python {@code Ellipsis}. */
    public static final PyObject Ellipsis =
            new Singleton("ellipsis", "Ellipsis");

    /** Python {@code NotImplemented}. */
    public static final PyObject NotImplemented =
            new Singleton("NotImplementedType", "NotImplemented");

    /**
     * Return a {@code tuple} of the arguments.
     *
     * @param values elements
     * @return tuple
     */
    public static PyTuple tuple(Object... values) {
        return new PyTuple(values);
    }

    /**
     * Return an {@code int} in its canonical representation: an
     * {@code Integer} if it fits, otherwise a {@code BigInteger}.
     *
     * @param v the value
     * @return canonical {@code int}
     */
    public static Object val(BigInteger v) {
        return v.bitLength() < 32 ? (Object)v.intValue() : v;
    }

    /**
     * Map Java {@code null} to {@code None}.
     *
     * @param o object or {@code null}
     * @return {@code o} or {@code None}
     */
    public static Object noneIfNull(Object o) {
        return o == null ? None : o;
    }

    /**
     * Map {@code None} to Java {@code null}.
     *
     * @param o object or {@code None}
     * @return {@code o} or {@code null}
     */
    public static Object nullIfNone(Object o) {
        return o == None ? null : o;
    }
}
