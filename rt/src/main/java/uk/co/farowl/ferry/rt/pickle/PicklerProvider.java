// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import java.io.OutputStream;
import java.util.function.BiConsumer;

import uk.co.farowl.ferry.rt.Interpreter;

/**
 * A pickling strategy available to {@link PicklerSelection}, found by
 * {@link java.util.ServiceLoader}. A provider makes picklers and
 * contributes the {@link Reconstructor}s its picklers write into
 * streams, so that any process with the provider on its class path can
 * load them.
 */
public interface PicklerProvider {

    /** @return the name by which the strategy is selected */
    String name();

    /**
     * Create a pickler writing to the given stream.
     *
     * @param interpreter in which objects are resolved
     * @param out destination of the pickle
     * @return a pickler
     */
    Pickler newPickler(Interpreter interpreter, OutputStream out);

    /**
     * Declare the reconstructors by name.
     *
     * @param register action to call with each name and reconstructor
     */
    void reconstructors(BiConsumer<String, Reconstructor> register);
}
