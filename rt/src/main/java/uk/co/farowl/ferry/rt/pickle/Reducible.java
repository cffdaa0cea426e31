// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

/**
 * An object that knows how to reduce itself for pickling (as a Python
 * object with {@code __reduce__}). A {@link Pickler} asks the object
 * only after its override hook and its table of {@link Reducer}s have
 * declined.
 */
public interface Reducible {

    /** @return how to rebuild this object */
    Reduction reduce();
}
