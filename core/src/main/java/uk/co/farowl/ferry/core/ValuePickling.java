// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.io.ByteArrayOutputStream;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.pickle.PicklingError;
import uk.co.farowl.ferry.rt.pickle.Unpickler;
import uk.co.farowl.ferry.rt.pickle.UnpicklingError;

/**
 * Value pickling to and from byte arrays, and the policy of which
 * modules to pickle by value, whatever pickler is selected for
 * {@link uk.co.farowl.ferry.rt.pickle.Pickling}.
 */
public final class ValuePickling {

    private ValuePickling() {} // only static methods here

    /**
     * Pickle an object with a {@link ValuePickler}.
     *
     * @param interpreter in which objects are resolved
     * @param obj to pickle
     * @return the pickle
     * @throws PicklingError if some object reached cannot be pickled
     */
    public static byte[] dumps(Interpreter interpreter, Object obj)
            throws PicklingError {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ValuePickler(interpreter, out).dump(obj);
        return out.toByteArray();
    }

    /**
     * Rebuild an object from a pickle.
     *
     * @param interpreter in which to rebuild it
     * @param data the pickle
     * @return the object
     * @throws UnpicklingError if the pickle is malformed
     */
    public static Object loads(Interpreter interpreter, byte[] data)
            throws UnpicklingError {
        ValuePicklerProvider.registerReconstructors();
        return new Unpickler(interpreter, data).load();
    }

    /**
     * Pickle the classes and functions of a module by value from now
     * on, in the given interpreter.
     *
     * @param interpreter owning the policy
     * @param module to register
     */
    public static void registerByValue(Interpreter interpreter,
            Object module) {
        PickleContext.of(interpreter).getByValueModules()
                .registerByValue(module);
    }

    /**
     * Stop pickling the classes and functions of a module by value.
     *
     * @param interpreter owning the policy
     * @param module to unregister
     */
    public static void unregisterByValue(Interpreter interpreter,
            Object module) {
        PickleContext.of(interpreter).getByValueModules()
                .unregisterByValue(module);
    }
}
