// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** Compare CPython {@code Objects/call.c}: the ways to call an object. */
public class Callables {

    private Callables() {} // only static methods here

    /**
     * Call an object with positional and keyword arguments.
     *
     * @param callable target
     * @param args positional arguments
     * @param kwargs keyword arguments or {@code null}
     * @return the return from the call to the object
     * @throws TypeError if the target is not callable
     */
    // Compare CPython PyObject_Call in call.c
    public static Object call(Object callable, Object[] args,
            PyDict kwargs) throws TypeError {
        if (callable instanceof PyFunction) {
            return ((PyFunction)callable).call(args, kwargs);
        } else if (callable instanceof PyMethod) {
            return ((PyMethod)callable).call(args, kwargs);
        } else if (callable instanceof PyJavaFunction) {
            return ((PyJavaFunction)callable).call(args, kwargs);
        } else if (callable instanceof PyType) {
            return ((PyType)callable).call(args, kwargs);
        } else if (callable instanceof PyPartial) {
            return ((PyPartial)callable).call(args, kwargs);
        }
        throw new TypeError("'%.200s' object is not callable",
                PyType.of(callable).getName());
    }

    /**
     * Call an object with positional arguments only.
     *
     * @param callable target
     * @param args positional arguments
     * @return the return from the call to the object
     * @throws TypeError if the target is not callable
     */
    public static Object call(Object callable, Object... args)
            throws TypeError {
        return call(callable, args, null);
    }
}
