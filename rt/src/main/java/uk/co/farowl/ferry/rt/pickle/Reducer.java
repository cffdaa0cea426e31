// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

/**
 * A pickling strategy for objects of one Java class, registered in the
 * table of a {@link Pickler} by that class.
 */
@FunctionalInterface
public interface Reducer {

    /**
     * Reduce an object of the class for which this is registered.
     *
     * @param obj to reduce
     * @param pickler in which the object is being pickled
     * @return how to rebuild the object (never {@code null})
     * @throws PicklingError if the object cannot be pickled
     */
    Reduction reduce(Object obj, Pickler pickler) throws PicklingError;
}
