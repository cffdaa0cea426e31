// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static uk.co.farowl.ferry.rt.pickle.Reconstructors.arg;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyCode.Trait;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyJavaFunction;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.pickle.PicklingRefusedError;
import uk.co.farowl.ferry.rt.pickle.Reconstructor;
import uk.co.farowl.ferry.rt.pickle.Reduction;
import uk.co.farowl.ferry.rt.pickle.UnpicklingError;

/**
 * Capture and restore of a function by value.
 * <p>
 * The function is made at the destination from its code, a globals
 * dictionary holding only the module identity ({@code __name__} and
 * friends), and its closure cells, still empty. Everything else is
 * state, applied once the function exists and has its memo entry, so
 * that the function may be reached again from its own globals, defaults
 * or closure. The state is a pair: the function {@code __dict__}, and a
 * dictionary of the attributes that need more than assignment to the
 * {@code __dict__}, including only those globals the code uses, and the
 * contents of the closure cells.
 */
final class FunctionCapsule {

    static final Logger logger =
            LoggerFactory.getLogger(FunctionCapsule.class);

    private FunctionCapsule() {} // only static methods here

    /** Globals that identify the module of a function. */
    static final String[] BASE_GLOBALS =
            {"__package__", "__name__", "__path__", "__file__"};

    /** Code with these traits makes coroutines, which we refuse. */
    private static final Set<Trait> REFUSED =
            EnumSet.of(Trait.COROUTINE, Trait.ITERABLE_COROUTINE);

    /**
     * {@code make_function(code, globals, name, closure)}: a function
     * with the given globals dictionary (not a copy) and closure cells.
     */
    static final Reconstructor MAKE_FUNCTION = (u, args) -> {
        PyCode code = arg(args, 0, PyCode.class);
        PyDict globals = arg(args, 1, PyDict.class);
        String name = arg(args, 2, String.class);
        PyCell[] closure = null;
        if (args.size() > 3 && args.get(3) != Py.None) {
            PyTuple cells = arg(args, 3, PyTuple.class);
            closure = new PyCell[cells.size()];
            for (int i = 0; i < closure.length; i++) {
                closure[i] = arg(cells, i, PyCell.class);
            }
        }
        PyFunction f = new PyFunction(u.getInterpreter(), code, globals,
                null, null, closure);
        f.setName(name);
        return f;
    };

    /**
     * {@code function_setstate(func, (dict, slots))}: apply the state
     * captured by {@link #reduce(PyFunction, ValuePickler)}.
     */
    static final Reconstructor FUNCTION_SETSTATE = (u, args) -> {
        PyFunction f = arg(args, 0, PyFunction.class);
        PyTuple state = arg(args, 1, PyTuple.class);
        f.getDict().putAll(arg(state, 0, PyDict.class));
        PyDict slots = arg(state, 1, PyDict.class);
        for (Map.Entry<Object, Object> e : slots.entrySet()) {
            setSlot(f, (String)e.getKey(), e.getValue());
        }
        f.getGlobals().putIfAbsent("__builtins__",
                u.getInterpreter().getBuiltins());
        return f;
    };

    /**
     * {@code java_function(module, name)}: a function implemented in
     * Java, found by name in the destination.
     */
    static final Reconstructor JAVA_FUNCTION = (u, args) -> {
        String module = arg(args, 0, String.class);
        String name = arg(args, 1, String.class);
        Object f = u.getInterpreter().importModule(module)
                .getAttribute(name);
        if (!(f instanceof PyJavaFunction)) {
            throw new UnpicklingError("%s.%s is not a built-in function",
                    module, name);
        }
        return f;
    };

    private static void setSlot(PyFunction f, String name, Object v) {
        switch (name) {
            case "__globals__":
                f.getGlobals().putAll((PyDict)v);
                break;
            case "__closure__":
                setClosure(f, v);
                break;
            case "_submodules":
                // Imported already, in unpickling them
                break;
            case "__name__":
                f.setName((String)v);
                break;
            case "__qualname__":
                f.setQualname((String)v);
                break;
            case "__module__":
                f.setModule(v);
                break;
            case "__doc__":
                f.setDoc(v);
                break;
            case "__defaults__":
                f.setDefaults(v == Py.None ? null : (PyTuple)v);
                break;
            case "__kwdefaults__":
                f.setKwdefaults(v == Py.None ? null : (PyDict)v);
                break;
            case "__annotations__":
                f.setAnnotations(v == Py.None ? null : (PyDict)v);
                break;
            default:
                Abstract.setAttr(f, name, v);
        }
    }

    /** Set or empty each closure cell from the recorded contents. */
    private static void setClosure(PyFunction f, Object v) {
        PyCell[] cells = f.getClosure();
        if (v == Py.None) { return; }
        PyTuple contents = (PyTuple)v;
        if (cells == null || cells.length != contents.size()) {
            throw new UnpicklingError(
                    "closure of %s needs %d values, not %d",
                    f.getQualname(), cells == null ? 0 : cells.length,
                    contents.size());
        }
        for (int i = 0; i < cells.length; i++) {
            Object c = contents.get(i);
            if (c == EmptyCell.INSTANCE) {
                cells[i].del();
            } else {
                cells[i].set(c);
            }
        }
    }

    /**
     * Reduce a function by value.
     *
     * @param f to reduce
     * @param pickler on whose behalf
     * @return the reduction
     * @throws PicklingRefusedError if the function makes coroutines
     */
    static Reduction reduce(PyFunction f, ValuePickler pickler)
            throws PicklingRefusedError {
        PyCode code = f.getCode();
        for (Trait t : code.traits) {
            if (REFUSED.contains(t)) {
                throw new PicklingRefusedError("Can't pickle %s: %s"
                        + " functions are not supported", f,
                        t.name().toLowerCase());
            }
        }

        PickleContext context = pickler.getContext();
        PyDict fGlobals = f.getGlobals();

        // Only the globals the code uses, and only if they exist now
        PyDict globals = new PyDict();
        List<PyModule> dependencies = new ArrayList<>();
        for (String name : context.getGlobalNames().extract(code)) {
            Object v = fGlobals.get(name);
            if (v != null) {
                globals.put(name, v);
                if (v instanceof PyModule) {
                    dependencies.add((PyModule)v);
                }
            }
        }
        List<PyModule> submodules = context.getGlobalNames()
                .findSubmodules(code, dependencies);

        PyCell[] cells = f.getClosure();
        Object closure = Py.None, contents = Py.None;
        if (cells != null) {
            Object[] values = new Object[cells.length];
            for (int i = 0; i < cells.length; i++) {
                pickler.markClosureShell(cells[i]);
                Object c = cells[i].get();
                values[i] = c == null ? EmptyCell.INSTANCE : c;
            }
            closure = new PyTuple((Object[])cells);
            contents = new PyTuple(values);
        }

        PyDict slots = new PyDict();
        slots.put("__name__", f.getName());
        slots.put("__qualname__", f.getQualname());
        slots.put("__module__", f.getModule());
        slots.put("__doc__", f.getDoc());
        Object[] defaults = f.getDefaults();
        slots.put("__defaults__",
                defaults == null ? Py.None : new PyTuple(defaults));
        slots.put("__kwdefaults__", Py.noneIfNull(f.getKwdefaults()));
        slots.put("__annotations__", f.getAnnotations());
        slots.put("__globals__", globals);
        slots.put("__closure__", contents);
        slots.put("_submodules", PyTuple.from(submodules));

        logger.atDebug().setMessage("Function {} by value with globals {}")
                .addArgument(f).addArgument(globals::keySet).log();

        return new Reduction(MAKE_FUNCTION,
                Py.tuple(code, pickler.baseGlobalsFor(fGlobals),
                        f.getName(), closure),
                Py.tuple(new PyDict(f.getDict()), slots),
                FUNCTION_SETSTATE);
    }

    /**
     * Reduce a function implemented in Java to its module and name.
     *
     * @param f to reduce
     * @return the reduction
     */
    static Reduction reduce(PyJavaFunction f) {
        return new Reduction(JAVA_FUNCTION,
                Py.tuple(f.getModule(), f.getName()));
    }
}
