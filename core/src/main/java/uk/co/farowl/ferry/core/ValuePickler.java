// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.io.OutputStream;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyJavaFunction;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.pickle.Pickler;
import uk.co.farowl.ferry.rt.pickle.PicklingError;
import uk.co.farowl.ferry.rt.pickle.Reduction;

/**
 * A {@link Pickler} that pickles by value the classes and functions
 * that cannot be found again by name at the destination (those defined
 * in {@code __main__}, inside other functions, or in modules registered
 * to be pickled by value), as well as the objects of the run-time system
 * the generic pickler does not know.
 * <p>
 * Every object that is not plain data is offered first to
 * {@link #reducerOverride(Object)}, which takes type objects and
 * functions. Anything it declines goes to the table of reducers filled
 * by {@link CatalogReducers}, and only then to the generic strategies.
 * <p>
 * A {@code ValuePickler} is for one pickle on one thread.
 */
public class ValuePickler extends Pickler {

    private final PickleContext context;

    /**
     * The module identity globals made for each globals dictionary, so
     * that functions sharing a module share their globals after
     * loading.
     */
    private final Map<PyDict, PyDict> baseGlobals = new IdentityHashMap<>();

    /** Cells whose contents are restored with a function. */
    private final Set<PyCell> closureShells =
            Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Create a pickler onto the given stream.
     *
     * @param interpreter in which objects are resolved
     * @param out destination of the pickle
     */
    public ValuePickler(Interpreter interpreter, OutputStream out) {
        super(interpreter, out);
        this.context = PickleContext.of(interpreter);
        ValuePicklerProvider.registerReconstructors();
        CatalogReducers.installIn(this);
    }

    /** @return the value pickling state of the interpreter */
    public PickleContext getContext() { return context; }

    @Override
    protected Reduction reducerOverride(Object obj) throws PicklingError {
        if (obj instanceof PyType) {
            return ClassReducer.reduce((PyType)obj, this);
        } else if (obj instanceof PyFunction) {
            PyFunction f = (PyFunction)obj;
            if (context.getResolver()
                    .decide(f) == ReferenceResolver.Decision.VALUE) {
                return FunctionCapsule.reduce(f, this);
            }
        } else if (obj instanceof PyJavaFunction) {
            PyJavaFunction f = (PyJavaFunction)obj;
            if (f.getModule() != null && context.getResolver()
                    .decide(f) == ReferenceResolver.Decision.VALUE) {
                return FunctionCapsule.reduce(f);
            }
        }
        return null;
    }

    /**
     * The globals with which a function pickled by value is made: only
     * those of {@link FunctionCapsule#BASE_GLOBALS} that its globals
     * contain. The same dictionary is returned for every function with
     * the same globals.
     *
     * @param globals of a function
     * @return the base globals
     */
    PyDict baseGlobalsFor(PyDict globals) {
        return baseGlobals.computeIfAbsent(globals, g -> {
            PyDict base = new PyDict();
            for (String k : FunctionCapsule.BASE_GLOBALS) {
                Object v = g.get(k);
                if (v != null) { base.put(k, v); }
            }
            return base;
        });
    }

    /**
     * Note that a cell belongs to the closure of a function being
     * pickled, so that its contents are written with the function.
     *
     * @param cell of the closure
     */
    void markClosureShell(PyCell cell) { closureShells.add(cell); }

    /**
     * Whether a cell belongs to the closure of a function being
     * pickled.
     *
     * @param cell to test
     * @return {@code true} if marked
     */
    boolean isClosureShell(PyCell cell) {
        return closureShells.contains(cell);
    }
}
