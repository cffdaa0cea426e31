// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import static org.junit.jupiter.api.Assertions.fail;

import java.math.BigInteger;

/**
 * A base class for unit tests that defines some common convenience
 * functions for which the need recurs: modules to define things in, and
 * the code of small functions.
 */
public class UnitTestSupport {

    /**
     * The {@code __main__} module of an interpreter, created if
     * necessary.
     *
     * @param interp in which to find or create it
     * @return the module
     */
    public static PyModule mainModule(Interpreter interp) {
        PyModule m = interp.getModule("__main__");
        if (m == null) {
            m = new PyModule("__main__");
            interp.addModule(m);
        }
        return m;
    }

    /**
     * Add a module to the interpreter as if loaded from a file.
     *
     * @param interp to receive it
     * @param name of the module
     * @return the module
     */
    public static PyModule libraryModule(Interpreter interp, String name) {
        PyModule m = new PyModule(name);
        m.add("__file__", name.replace('.', '/') + ".py");
        interp.addModule(m);
        return m;
    }

    /**
     * Define a function in a module (its globals) under its name.
     *
     * @param interp owning the module
     * @param module in which to define it
     * @param code of the function
     * @return the function
     */
    public static PyFunction define(Interpreter interp, PyModule module,
            PyCode code) {
        PyFunction f = new PyFunction(interp, code, module.getDict(), null,
                null, null);
        module.add(code.name, f);
        return f;
    }

    /**
     * Code of {@code inc()}, which returns its free variable
     * {@code count} and increments it.
     *
     * @param qualname of the function
     * @return the code
     */
    public static PyCode counterCode(String qualname) {
        return new Assembler("inc").qualname(qualname).freevars("count")
                .loadDeref("count").op(Opcode.DUP_TOP).loadConst(1)
                .op(Opcode.BINARY_ADD).storeDeref("count")
                .op(Opcode.RETURN_VALUE).assemble();
    }

    /**
     * Code of {@code make_counter(start)}, which returns a new
     * {@code inc()} closing over a counter set to {@code start}.
     *
     * @return the code
     */
    public static PyCode makeCounterCode() {
        return new Assembler("make_counter").args("start")
                .cellvars("count").loadFast("start").storeDeref("count")
                .makeFunction(counterCode("make_counter.<locals>.inc"),
                        "count")
                .op(Opcode.RETURN_VALUE).assemble();
    }

    /**
     * Code of {@code get()}, which returns its free variable
     * {@code count}.
     *
     * @param qualname of the function
     * @return the code
     */
    public static PyCode getterCode(String qualname) {
        return new Assembler("get").qualname(qualname).freevars("count")
                .loadDeref("count").op(Opcode.RETURN_VALUE).assemble();
    }

    /**
     * Convert a Python {@code int} to a Java {@code int}.
     *
     * @param v to convert
     * @return the value
     */
    public static int toInt(Object v) {
        if (v instanceof Integer) {
            return (Integer)v;
        } else if (v instanceof BigInteger) {
            return ((BigInteger)v).intValueExact();
        } else if (v instanceof Boolean) { return (Boolean)v ? 1 : 0; }
        return fail(String.format("cannot convert '%s' to int", v));
    }
}
