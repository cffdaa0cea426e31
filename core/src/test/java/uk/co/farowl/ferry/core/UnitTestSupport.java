// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.fail;

import java.math.BigInteger;

import uk.co.farowl.ferry.rt.Assembler;
import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.Opcode;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyType;

/**
 * A base class for value pickling tests: a source and a destination
 * interpreter, each with a {@code __main__}, and the means to define
 * functions and classes in them.
 */
public class UnitTestSupport {

    /** Where objects are pickled. */
    protected final Interpreter source = new Interpreter();
    /** Where objects are unpickled ("another process"). */
    protected final Interpreter destination = new Interpreter();

    /** The {@code __main__} module of {@link #source}. */
    protected final PyModule main = mainModule(source);

    /**
     * Pickle an object in {@link #source} and load it in
     * {@link #destination}.
     *
     * @param obj to copy
     * @return the copy
     */
    protected Object roundTrip(Object obj) {
        return ValuePickling.loads(destination,
                ValuePickling.dumps(source, obj));
    }

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
     * Make a function in a module closing over the given cells, without
     * binding it in the module.
     *
     * @param interp owning the module
     * @param module whose dictionary is the globals
     * @param code of the function
     * @param cells the closure
     * @return the function
     */
    public static PyFunction closure(Interpreter interp, PyModule module,
            PyCode code, PyCell... cells) {
        return new PyFunction(interp, code, module.getDict(), null, null,
                cells);
    }

    /**
     * Define a plain class in a module.
     *
     * @param module in which to define it
     * @param name of the class
     * @param bases of the class
     * @return the class
     */
    public static PyType defineClass(PyModule module, String name,
            PyType... bases) {
        PyDict dict = new PyDict();
        dict.put("__module__", module.getName());
        PyType t = new PyType(name, bases, dict);
        module.add(t);
        return t;
    }

    /**
     * Code of a function that returns a constant.
     *
     * @param name of the function
     * @param value to return
     * @param args names of the (ignored) arguments
     * @return the code
     */
    public static PyCode constantCode(String name, Object value,
            String... args) {
        return new Assembler(name).args(args).loadConst(value)
                .op(Opcode.RETURN_VALUE).assemble();
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
        }
        return fail(String.format("cannot convert '%s' to int", v));
    }
}
