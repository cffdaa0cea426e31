// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Collection;

/**
 * Python {@code function} object as created by a function definition
 * and subsequently called. The function holds the {@link PyCode} it
 * executes, the global name space in which it was defined, and the
 * closure cells binding its free variables.
 */
public class PyFunction implements DictPyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE =
            PyType.fromSpec("FunctionType", "types");

    /**
     * The interpreter that defines the import context. Not
     * {@code null}.
     */
    final Interpreter interpreter;

    /** The {@code __code__} attribute. Not {@code null}. */
    PyCode code;

    /**
     * The read-only {@code __globals__} attribute is a {@code dict}:
     * other mappings won't do. Not {@code null}.
     */
    final PyDict globals;

    /** The (positional) {@code __defaults__} or {@code null}. */
    Object[] defaults;

    /** The {@code __kwdefaults__} or {@code null}. */
    PyDict kwdefaults;

    /**
     * The read-only {@code __closure__} attribute, or {@code null}. The
     * array is never modified, but the cells are shared.
     */
    final PyCell[] closure;

    /** The {@code __doc__} attribute, can be set to anything. */
    Object doc;

    /** The function name ({@code __name__} attribute). */
    String name;

    /** The function qualified name ({@code __qualname__} attribute). */
    String qualname;

    /**
     * The {@code __module__} attribute, can be anything or
     * {@code None}.
     */
    Object module;

    /** The {@code __annotations__} attribute or {@code null}. */
    PyDict annotations;

    /** The {@code __dict__} attribute. */
    private final PyDict dict = new PyDict();

    /**
     * Create a {@code PyFunction} supplying most of the attributes at
     * construction time.
     *
     * @param interpreter providing the module context not {@code null}
     * @param code to execute not {@code null}
     * @param globals name space to treat as global variables not
     *     {@code null}
     * @param defaults default positional argument values or
     *     {@code null}
     * @param kwdefaults default keyword argument values or {@code null}
     * @param closure variables referenced but not defined here, must be
     *     size expected by code or {@code null} if empty.
     */
    // Compare CPython PyFunction_NewWithQualName in funcobject.c
    public PyFunction(Interpreter interpreter, PyCode code, PyDict globals,
            Object[] defaults, PyDict kwdefaults, PyCell[] closure) {
        assert interpreter != null;
        this.interpreter = interpreter;
        this.globals = globals;
        this.name = code.name;
        this.qualname = code.qualname;

        // Get __doc__ from first constant in code (if str)
        Object[] consts = code.consts;
        this.doc = consts.length >= 1 && consts[0] instanceof String
                ? consts[0] : Py.None;

        // __module__ = globals['__name__'] or None.
        this.module = Py.noneIfNull(globals.get("__name__"));

        this.defaults = defaults;
        this.kwdefaults = kwdefaults;
        this.closure = closure == null || closure.length == 0 ? null
                : closure.clone();
        this.code = checkFreevars(code);
    }

    /**
     * Check that the closure supplied is the length the code requires.
     *
     * @param c to check
     * @return {@code c}
     * @throws ValueError if the closure and code do not match
     */
    private PyCode checkFreevars(PyCode c) throws ValueError {
        int nfree = c.freevars.length;
        int nclosure = closure == null ? 0 : closure.length;
        if (nfree != nclosure) {
            throw new ValueError(
                    "%s requires closure of length %d, not %d", c.name,
                    nfree, nclosure);
        }
        return c;
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public PyDict getDict() { return dict; }

    /** @return the interpreter that defines the import context */
    public Interpreter getInterpreter() { return interpreter; }

    /** @return {@code __code__} */
    public PyCode getCode() { return code; }

    /** @return {@code __globals__} (not a copy) */
    public PyDict getGlobals() { return globals; }

    /**
     * The name space in which names not found in {@code __globals__}
     * are looked up: {@code __globals__['__builtins__']} if that is a
     * module or {@code dict}, otherwise the built-ins of the
     * interpreter.
     *
     * @return the built-ins dictionary
     */
    // Compare CPython _PyEval_BuiltinsFromGlobals in frameobject.c
    public PyDict getBuiltins() {
        Object b = globals.get("__builtins__");
        if (b instanceof PyModule) {
            return ((PyModule)b).getDict();
        } else if (b instanceof PyDict) {
            return (PyDict)b;
        }
        return interpreter.getBuiltins().getDict();
    }

    /** @return a copy of {@code __defaults__} or {@code null} */
    public Object[] getDefaults() {
        return defaults == null ? null : defaults.clone();
    }

    /** @param defaults new {@code __defaults__} or {@code null} */
    public void setDefaults(Collection<?> defaults) {
        this.defaults = defaults == null || defaults.isEmpty() ? null
                : defaults.toArray();
    }

    /** @return {@code __kwdefaults__} or {@code null} */
    public PyDict getKwdefaults() { return kwdefaults; }

    /** @param kwdefaults new {@code __kwdefaults__} or {@code null} */
    public void setKwdefaults(PyDict kwdefaults) {
        this.kwdefaults = kwdefaults;
    }

    /**
     * The {@code __closure__} attribute as an array (of the shared
     * cells themselves) or {@code null} if the function has no free
     * variables.
     *
     * @return the closure or {@code null}
     */
    public PyCell[] getClosure() {
        return closure == null ? null : closure.clone();
    }

    /** @return {@code __name__} */
    public String getName() { return name; }

    /** @param name new {@code __name__} */
    public void setName(String name) { this.name = name; }

    /** @return {@code __qualname__} */
    public String getQualname() { return qualname; }

    /** @param qualname new {@code __qualname__} */
    public void setQualname(String qualname) { this.qualname = qualname; }

    /** @return {@code __module__} (may be {@code None}) */
    public Object getModule() { return module; }

    /** @param module new {@code __module__} */
    public void setModule(Object module) {
        this.module = Py.noneIfNull(module);
    }

    /** @return {@code __doc__} */
    public Object getDoc() { return doc; }

    /** @param doc new {@code __doc__} */
    public void setDoc(Object doc) { this.doc = Py.noneIfNull(doc); }

    /** @return {@code __annotations__} (created if necessary) */
    public PyDict getAnnotations() {
        if (annotations == null) { annotations = new PyDict(); }
        return annotations;
    }

    /** @param annotations new {@code __annotations__} or {@code null} */
    public void setAnnotations(PyDict annotations) {
        this.annotations = annotations;
    }

    /**
     * Call the function with positional and (optionally) keyword
     * arguments.
     *
     * @param args positional arguments
     * @param kwargs keyword arguments or {@code null}
     * @return the result of the call
     */
    public Object call(Object[] args, PyDict kwargs) {
        PyFrame frame = new PyFrame(this, args, kwargs);
        return frame.eval();
    }

    /**
     * Call the function with positional arguments only.
     *
     * @param args positional arguments
     * @return the result of the call
     */
    public Object call(Object... args) { return call(args, null); }

    @Override
    public String toString() {
        return String.format("<function %s at %#x>", qualname,
                System.identityHashCode(this));
    }
}
