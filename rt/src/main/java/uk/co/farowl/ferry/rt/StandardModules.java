// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * The modules every {@link Interpreter} starts with. Each exposes the
 * built-in types and functions that Python would find in the module of
 * the same name, so that they can be found again by module and name.
 */
class StandardModules {

    private StandardModules() {} // only static methods here

    /**
     * Create the {@code builtins} module.
     *
     * @return new module
     */
    static PyModule builtins() {
        PyModule m = new PyModule("builtins");
        for (PyType t : new PyType[] {PyType.OBJECT, PyType.TYPE, Py.INT,
                Py.BOOL, Py.FLOAT, Py.STR, Py.BYTES, PyTuple.TYPE,
                PyList.TYPE, PyDict.TYPE, PyProperty.TYPE,
                PyStaticMethod.TYPE, PyClassMethod.TYPE,
                BaseException.TYPE, PyException.TYPE, TypeError.TYPE,
                ValueError.TYPE, AttributeError.TYPE, NameError.TYPE,
                ImportError.TYPE, OSError.TYPE, RuntimeError.TYPE}) {
            m.add(t);
        }
        m.add("None", Py.None);
        m.add("Ellipsis", Py.Ellipsis);
        m.add("NotImplemented", Py.NotImplemented);
        m.add("getattr", new PyJavaFunction("builtins", "getattr",
                StandardModules::getattr));
        m.add("setattr", new PyJavaFunction("builtins", "setattr",
                args -> {
                    Abstract.setAttr(args[0], (String)args[1], args[2]);
                    return Py.None;
                }));
        m.add("len", new PyJavaFunction("builtins", "len",
                args -> len(args[0])));
        m.add("isinstance", new PyJavaFunction("builtins", "isinstance",
                args -> PyType.of(args[0])
                        .isSubTypeOf((PyType)args[1])));
        return m;
    }

    private static Object getattr(Object[] args) {
        if (args.length == 3) {
            try {
                return Abstract.getAttr(args[0], (String)args[1]);
            } catch (AttributeError e) {
                return args[2];
            }
        }
        return Abstract.getAttr(args[0], (String)args[1]);
    }

    private static Object len(Object v) {
        if (v instanceof java.util.Collection) {
            return ((java.util.Collection<?>)v).size();
        } else if (v instanceof java.util.Map) {
            return ((java.util.Map<?, ?>)v).size();
        } else if (v instanceof String) {
            return ((String)v).length();
        } else if (v instanceof byte[]) { return ((byte[])v).length; }
        throw new TypeError("object of type '%s' has no len()",
                PyType.of(v).getName());
    }

    /**
     * Add the standard modules other than {@code builtins}.
     *
     * @param interp to receive them
     */
    static void addTo(Interpreter interp) {
        PyModule types = new PyModule("types");
        for (PyType t : new PyType[] {PyFunction.TYPE, PyCode.TYPE,
                PyCell.TYPE, PyMethod.TYPE, PyModule.TYPE,
                PyJavaFunction.TYPE, PyMappingProxy.TYPE}) {
            types.add(t);
        }
        interp.addModule(types);

        PyModule enumModule = new PyModule("enum");
        enumModule.add(PyEnumType.META);
        enumModule.add(PyEnumType.ENUM);
        interp.addModule(enumModule);

        PyModule functools = new PyModule("functools");
        functools.add(PyPartial.TYPE);
        interp.addModule(functools);

        PyModule io = new PyModule("io");
        io.add(PyTextIO.TYPE);
        io.add(PyTextIO.STRING_IO_TYPE);
        io.add("open", new PyJavaFunction("io", "open",
                args -> PyTextIO.open((String)args[0],
                        args.length > 1 ? (String)args[1] : "r",
                        args.length > 2 ? (String)args[2] : "")));
        interp.addModule(io);

        PyModule logging = new PyModule("logging");
        logging.add(PyLogger.TYPE);
        logging.add("getLogger", new PyJavaFunction("logging",
                "getLogger", args -> PyLogger.getLogger(args.length == 0
                        ? null : (String)Py.nullIfNone(args[0]))));
        interp.addModule(logging);

        PyModule weakref = new PyModule("weakref");
        weakref.add(PyWeakSet.TYPE);
        interp.addModule(weakref);

        PyModule thread = new PyModule("_thread");
        thread.add(PyLock.TYPE);
        thread.add("allocate_lock", new PyJavaFunction("_thread",
                "allocate_lock", args -> new PyLock()));
        interp.addModule(thread);
    }
}
