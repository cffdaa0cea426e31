// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.function.Supplier;

/**
 * Holder for objects appearing in the closure of a function. A cell
 * may be shared by several functions, and by the frame that created
 * it, so that an assignment through one is seen by all.
 */
public class PyCell implements Supplier<Object>, PyObject {

    /** The Python type {@code cell}. */
    public static final PyType TYPE =
            PyType.fromSpec("CellType", "types");

    /** The object currently held ({@code null} when empty). */
    Object obj;

    /** Handy constant where no cells are needed in a frame. */
    static final PyCell[] EMPTY_ARRAY = new PyCell[0];

    /** Create an empty cell. */
    public PyCell() {}

    /**
     * Create a cell holding the given object.
     *
     * @param obj to hold ({@code null} means empty)
     */
    public PyCell(Object obj) { this.obj = obj; }

    @Override
    public PyType getType() { return TYPE; }

    /**
     * The {@code cell_contents} attribute.
     *
     * @return the content
     * @throws ValueError if the cell is empty
     */
    public Object getContents() throws ValueError {
        if (obj == null) { throw new ValueError("Cell is empty"); }
        return obj;
    }

    @Override
    public Object get() { return obj; }

    /**
     * Set the content.
     *
     * @param v new content ({@code null} means empty)
     */
    public void set(Object v) { obj = v; }

    /** Make the cell empty. */
    public void del() { obj = null; }

    /** @return {@code true} if the cell has no content */
    public boolean isEmpty() { return obj == null; }

    // Compare CPython cell_repr in cellobject.c
    @Override
    public String toString() {
        if (obj == null) {
            return String.format("<cell at %#x: empty>",
                    System.identityHashCode(this));
        } else {
            return String.format("<cell at %#x: %.80s object>",
                    System.identityHashCode(this),
                    PyType.of(obj).getName());
        }
    }
}
