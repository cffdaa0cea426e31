// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.function.Function;

/**
 * A function implemented in Java, as found in built-in modules. Its
 * body is opaque to Python: it has no code object, globals or closure.
 */
public class PyJavaFunction implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE =
            PyType.fromSpec("BuiltinFunctionType", "types");

    private final String module;
    private final String name;
    private final Function<Object[], Object> body;

    /**
     * Create a function for a named module.
     *
     * @param module name of module that defines the function
     * @param name of the function
     * @param body implementation taking positional arguments
     */
    public PyJavaFunction(String module, String name,
            Function<Object[], Object> body) {
        this.module = module;
        this.name = name;
        this.body = body;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return {@code __module__} */
    public String getModule() { return module; }

    /** @return {@code __name__} (also the {@code __qualname__}) */
    public String getName() { return name; }

    /**
     * Call the function.
     *
     * @param args positional arguments
     * @param kwargs must be {@code null} or empty
     * @return the result
     */
    public Object call(Object[] args, PyDict kwargs) {
        if (kwargs != null && !kwargs.isEmpty()) {
            throw new TypeError("%s() takes no keyword arguments", name);
        }
        return body.apply(args);
    }

    @Override
    public String toString() {
        return String.format("<built-in function %s>", name);
    }
}
