// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import uk.co.farowl.ferry.rt.PyObject;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.pickle.Reconstructor;
import uk.co.farowl.ferry.rt.pickle.Reducible;
import uk.co.farowl.ferry.rt.pickle.Reduction;

/**
 * Stands for the contents of an empty cell in a pickle, where the cell
 * contents are recorded as a value. It never becomes the contents of a
 * cell: the cell is emptied instead.
 */
public final class EmptyCell implements PyObject, Reducible {

    /** The type of the sentinel. */
    public static final PyType TYPE =
            PyType.fromSpec("_empty_cell_value", "ferry");

    /** The sentinel. */
    public static final EmptyCell INSTANCE = new EmptyCell();

    /** {@code empty_cell_value()}: the sentinel again. */
    public static final Reconstructor EMPTY_CELL_VALUE =
            (u, args) -> INSTANCE;

    private EmptyCell() {}

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public Reduction reduce() {
        return new Reduction(EMPTY_CELL_VALUE, PyTuple.EMPTY);
    }

    @Override
    public String toString() { return "<empty cell value>"; }
}
