// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import uk.co.farowl.ferry.rt.PyTuple;

/**
 * A named constructor or state setter known to every process that
 * might load a pickle. The stream records only the name, which the
 * {@link Unpickler} resolves through {@link Reconstructors}.
 */
@FunctionalInterface
public interface Reconstructor {

    /**
     * Build an object (or, as a state setter, update one).
     *
     * @param u the unpickler, which provides the destination context
     * @param args as recorded in the stream
     * @return the object built (or updated)
     */
    Object construct(Unpickler u, PyTuple args);
}
