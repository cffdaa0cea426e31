// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static uk.co.farowl.ferry.rt.pickle.Reconstructors.arg;

import java.util.Locale;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.AttributeError;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyClassMethod;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyDictView;
import uk.co.farowl.ferry.rt.PyList;
import uk.co.farowl.ferry.rt.PyLock;
import uk.co.farowl.ferry.rt.PyLogger;
import uk.co.farowl.ferry.rt.PyMappingProxy;
import uk.co.farowl.ferry.rt.PyMethod;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyPartial;
import uk.co.farowl.ferry.rt.PyProperty;
import uk.co.farowl.ferry.rt.PyStaticMethod;
import uk.co.farowl.ferry.rt.PyTextIO;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyWeakSet;
import uk.co.farowl.ferry.rt.pickle.PicklingRefusedError;
import uk.co.farowl.ferry.rt.pickle.Reconstructor;
import uk.co.farowl.ferry.rt.pickle.Reconstructors;
import uk.co.farowl.ferry.rt.pickle.Reduction;
import uk.co.farowl.ferry.rt.pickle.UnpicklingError;

/**
 * Reducers for the objects of the run-time system that neither reduce
 * themselves nor may be found by name: descriptors, weak sets, locks,
 * loggers, mapping views, code, cells, text streams, bound methods,
 * partial applications and modules.
 */
final class CatalogReducers {

    private CatalogReducers() {} // only static methods here

    /** {@code make_code(argcount, ..., firstlineno)}: a code object. */
    static final Reconstructor MAKE_CODE = (u, args) -> new PyCode(
            arg(args, 0, Integer.class), arg(args, 1, Integer.class),
            arg(args, 2, Integer.class), arg(args, 3, Integer.class),
            arg(args, 4, Integer.class), arg(args, 5, byte[].class),
            arg(args, 6, PyTuple.class).toArray(), strings(args, 7),
            strings(args, 8), strings(args, 9), strings(args, 10),
            arg(args, 11, String.class), arg(args, 12, String.class),
            arg(args, 13, String.class), arg(args, 14, Integer.class));

    /** {@code make_cell_shell()}: an empty cell. */
    static final Reconstructor MAKE_CELL_SHELL = (u, args) -> new PyCell();

    /** {@code cell_set(cell, value)}: set or (for the sentinel) empty. */
    static final Reconstructor CELL_SET = (u, args) -> {
        PyCell cell = arg(args, 0, PyCell.class);
        Object v = args.get(1);
        if (v == EmptyCell.INSTANCE) {
            cell.del();
        } else {
            cell.set(v);
        }
        return cell;
    };

    /** {@code dict_view(kind, dict)}: keys, values or items view. */
    static final Reconstructor DICT_VIEW = (u, args) -> {
        String kind = arg(args, 0, String.class);
        PyDict dict = arg(args, 1, PyDict.class);
        try {
            return new PyDictView(
                    PyDictView.Kind.valueOf(kind.toUpperCase(Locale.ROOT)),
                    dict);
        } catch (IllegalArgumentException iae) {
            throw new UnpicklingError("no dictionary view '%s'", kind);
        }
    };

    /** {@code string_io(content, position)}: a readable text stream. */
    static final Reconstructor STRING_IO =
            (u, args) -> PyTextIO.stringIO(arg(args, 0, String.class),
                    arg(args, 1, Integer.class));

    /** {@code partial_keywords(partial, keywords)}. */
    static final Reconstructor PARTIAL_KEYWORDS = (u, args) -> {
        PyPartial p = arg(args, 0, PyPartial.class);
        p.getKeywords().putAll(arg(args, 1, PyDict.class));
        return p;
    };

    /**
     * {@code make_module(name)}: a module outside the module table, to
     * be filled by {@code module_setstate}.
     */
    static final Reconstructor MAKE_MODULE =
            (u, args) -> new PyModule(arg(args, 0, String.class));

    /** {@code module_setstate(module, dict)}. */
    static final Reconstructor MODULE_SETSTATE = (u, args) -> {
        PyModule m = arg(args, 0, PyModule.class);
        PyDict dict = m.getDict();
        dict.putAll(arg(args, 1, PyDict.class));
        dict.put("__builtins__", u.getInterpreter().getBuiltins());
        return m;
    };

    private static String[] strings(PyTuple args, int i) {
        PyTuple t = arg(args, i, PyTuple.class);
        String[] s = new String[t.size()];
        for (int j = 0; j < s.length; j++) {
            s[j] = arg(t, j, String.class);
        }
        return s;
    }

    /**
     * Add the reducers to the table of a pickler.
     *
     * @param p to receive them
     */
    static void installIn(ValuePickler p) {
        p.addReducer(PyCode.class, (o, pickler) -> reduceCode((PyCode)o));
        p.addReducer(PyCell.class,
                (o, pickler) -> reduceCell((PyCell)o, p));
        p.addReducer(PyProperty.class, (o, pickler) -> {
            PyProperty prop = (PyProperty)o;
            return new Reduction(PyProperty.TYPE, Py.tuple(prop.getGetter(),
                    prop.getSetter(), prop.getDeleter(), prop.getDoc()));
        });
        p.addReducer(PyStaticMethod.class,
                (o, pickler) -> new Reduction(PyStaticMethod.TYPE,
                        Py.tuple(((PyStaticMethod)o).getCallable())));
        p.addReducer(PyClassMethod.class,
                (o, pickler) -> new Reduction(PyClassMethod.TYPE,
                        Py.tuple(((PyClassMethod)o).getCallable())));
        p.addReducer(PyWeakSet.class,
                (o, pickler) -> new Reduction(PyWeakSet.TYPE, Py.tuple(
                        new PyList(((PyWeakSet)o).liveMembers()))));
        p.addReducer(PyLock.class, (o, pickler) -> reduceLock((PyLock)o));
        p.addReducer(PyLogger.class,
                (o, pickler) -> reduceLogger((PyLogger)o, p));
        p.addReducer(PyMappingProxy.class,
                (o, pickler) -> new Reduction(PyMappingProxy.TYPE,
                        Py.tuple(((PyMappingProxy)o).copy())));
        p.addReducer(PyDictView.class, (o, pickler) -> {
            PyDictView v = (PyDictView)o;
            return new Reduction(DICT_VIEW, Py.tuple(
                    v.getKind().name().toLowerCase(Locale.ROOT),
                    v.getDict()));
        });
        p.addReducer(PyTextIO.class,
                (o, pickler) -> reduceTextIO((PyTextIO)o));
        p.addReducer(PyMethod.class,
                (o, pickler) -> reduceMethod((PyMethod)o));
        p.addReducer(PyPartial.class,
                (o, pickler) -> reducePartial((PyPartial)o));
        p.addReducer(PyModule.class,
                (o, pickler) -> reduceModule((PyModule)o, p));
    }

    private static Reduction reduceCode(PyCode c) {
        return new Reduction(MAKE_CODE, Py.tuple(c.argcount,
                c.posonlyargcount, c.kwonlyargcount, c.stacksize, c.flags,
                c.getCode(), new PyTuple(c.getConsts()),
                new PyTuple((Object[])c.getNames()),
                new PyTuple((Object[])c.getVarnames()),
                new PyTuple((Object[])c.getFreevars()),
                new PyTuple((Object[])c.getCellvars()), c.filename, c.name,
                c.qualname, c.firstlineno));
    }

    /**
     * A cell in the closure of a function being pickled is made empty,
     * and filled when the function state is applied. Any other cell is
     * made empty and filled at once.
     */
    private static Reduction reduceCell(PyCell cell, ValuePickler p) {
        if (p.isClosureShell(cell)) {
            return new Reduction(MAKE_CELL_SHELL, PyTuple.EMPTY);
        }
        Object v = cell.get();
        return new Reduction(MAKE_CELL_SHELL, PyTuple.EMPTY,
                v == null ? EmptyCell.INSTANCE : v, CELL_SET);
    }

    private static Reduction reduceLock(PyLock lock) {
        if (lock.locked()) {
            throw new PicklingRefusedError(
                    "Can't pickle %s: the lock is held", lock);
        }
        return new Reduction(PyLock.TYPE, PyTuple.EMPTY);
    }

    private static Reduction reduceLogger(PyLogger logger, ValuePickler p) {
        Object getLogger = Abstract.lookupDotted(
                p.getInterpreter().importModule("logging"), "getLogger");
        return new Reduction(getLogger, logger.isRoot() ? PyTuple.EMPTY
                : Py.tuple(logger.getName()));
    }

    /**
     * A file open only for reading, or any {@code StringIO}, is
     * captured by its whole content and position, and comes back as an
     * in-memory stream. A file open for writing in any mode is refused.
     */
    private static Reduction reduceTextIO(PyTextIO f) {
        if (f.isClosed()) {
            throw new PicklingRefusedError(
                    "Cannot pickle closed files: %s", f);
        } else if (f.getType() == PyTextIO.TYPE && f.writable()) {
            throw new PicklingRefusedError(
                    "Cannot pickle files that are open for writing: %s",
                    f.getMode());
        } else if (!f.readable()) {
            throw new PicklingRefusedError(
                    "Cannot pickle files that are not opened for"
                            + " reading: %s",
                    f.getMode());
        }
        return new Reduction(STRING_IO,
                Py.tuple(f.getValue(), f.tell()));
    }

    /**
     * A bound method is found again as an attribute of the object it is
     * bound to, when that is where it came from.
     */
    private static Reduction reduceMethod(PyMethod m) {
        Object self = m.getSelf(), func = m.getFunction();
        Object name = Abstract.getAttr(func, "__name__");
        if (name instanceof String) {
            Object found = attrOrNull(self, (String)name);
            if (found instanceof PyMethod
                    && ((PyMethod)found).getFunction() == func) {
                return new Reduction(Reconstructors.GETATTR,
                        Py.tuple(self, name));
            }
        }
        return new Reduction(PyMethod.TYPE, Py.tuple(func, self));
    }

    private static Object attrOrNull(Object obj, String name) {
        try {
            return Abstract.getAttr(obj, name);
        } catch (AttributeError e) {
            return null;
        }
    }

    private static Reduction reducePartial(PyPartial p) {
        PyTuple a = p.getArgs();
        Object[] args = new Object[a.size() + 1];
        args[0] = p.getFunction();
        for (int i = 0; i < a.size(); i++) { args[i + 1] = a.get(i); }
        PyDict kw = p.getKeywords();
        return new Reduction(PyPartial.TYPE, new PyTuple(args),
                kw.isEmpty() ? null : new PyDict(kw), PARTIAL_KEYWORDS);
    }

    /**
     * A module is imported at the destination unless it must go by
     * value, when it is rebuilt (outside the module table) from its
     * dictionary.
     */
    private static Reduction reduceModule(PyModule m, ValuePickler p) {
        if (p.getContext().getResolver()
                .decideModule(m) == ReferenceResolver.Decision.REFERENCE) {
            return new Reduction(Reconstructors.IMPORT_MODULE,
                    Py.tuple(m.getName()));
        }
        PyDict dict = new PyDict(m.getDict());
        dict.remove("__builtins__");
        return new Reduction(MAKE_MODULE, Py.tuple(m.getName()), dict,
                MODULE_SETSTATE);
    }
}
