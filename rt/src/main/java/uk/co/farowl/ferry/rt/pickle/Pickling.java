// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import java.io.ByteArrayOutputStream;

import uk.co.farowl.ferry.rt.Interpreter;

/**
 * Pickle to and from byte arrays, with the pickler chosen by
 * {@link PicklerSelection}.
 */
public final class Pickling {

    private Pickling() {} // only static methods here

    /**
     * Pickle an object.
     *
     * @param interpreter in which objects are resolved
     * @param obj to pickle
     * @return the pickle
     * @throws PicklingError if some object reached cannot be pickled
     */
    public static byte[] dumps(Interpreter interpreter, Object obj)
            throws PicklingError {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PicklerSelection.newPickler(interpreter, out).dump(obj);
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
        return new Unpickler(interpreter, data).load();
    }
}
