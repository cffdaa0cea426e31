// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.AttributeError;
import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyType;

/**
 * Decide whether an object with a name (a class or function) may be
 * pickled as a reference to the module that defines it, or must be
 * pickled by value.
 * <p>
 * The answer depends on the module table of the interpreter at the time
 * of the call, which other threads may change. No attempt is made to
 * prevent that.
 */
public class ReferenceResolver {

    private static final Logger logger =
            LoggerFactory.getLogger(ReferenceResolver.class);

    /** The module in which the program was started. */
    static final String MAIN = "__main__";

    /** Possible decisions. */
    public enum Decision {
        /** Pickle as (module, qualified name). */
        REFERENCE,
        /** Pickle enough to rebuild the object. */
        VALUE
    }

    private final Interpreter interpreter;
    private final ByValueModules byValue;

    ReferenceResolver(Interpreter interpreter, ByValueModules byValue) {
        this.interpreter = interpreter;
        this.byValue = byValue;
    }

    /**
     * Decide how to pickle an object, deriving the name from its
     * {@code __qualname__} or {@code __name__}.
     *
     * @param obj to decide about
     * @return the decision
     */
    public Decision decide(Object obj) { return decide(obj, nameOf(obj)); }

    /**
     * Decide how to pickle an object known by the given name.
     *
     * @param obj to decide about
     * @param name qualified name of {@code obj} or {@code null}
     * @return the decision
     */
    public Decision decide(Object obj, String name) {
        if (name == null) { return Decision.VALUE; }

        String moduleName = whichModule(obj, name);
        if (moduleName == null || MAIN.equals(moduleName)) {
            return Decision.VALUE;
        }

        PyModule module = interpreter.getModule(moduleName);
        if (module == null || isAdHoc(module)
                || byValue.isRegisteredByValue(moduleName)) {
            return Decision.VALUE;
        }

        // Not reachable by that name if nested or replaced
        return lookupOrNull(module, name) == obj ? Decision.REFERENCE
                : Decision.VALUE;
    }

    /**
     * Decide how to pickle a module: by value if it is registered (or
     * is inside a registered package) or is not in the module table,
     * otherwise by reference (an import in the destination).
     *
     * @param module to decide about
     * @return the decision
     */
    public Decision decideModule(PyModule module) {
        String name = module.getName();
        if (byValue.isRegisteredByValue(name)
                || interpreter.getModule(name) != module) {
            return Decision.VALUE;
        }
        return Decision.REFERENCE;
    }

    /**
     * Find the name of the module that defines an object: the one it
     * declares as {@code __module__}, or the first module in the module
     * table (apart from {@code __main__}) in which the name leads to the
     * object. Errors looking in a module are taken to mean the object is
     * not there.
     *
     * @param obj to find
     * @param name qualified name of {@code obj}
     * @return name of the module or {@code null} if not found
     */
    String whichModule(Object obj, String name) {
        String declared = declaredModule(obj);
        if (declared != null) { return declared; }

        for (Map.Entry<String, PyModule> e : interpreter.getModules()
                .entrySet()) {
            String moduleName = e.getKey();
            if (MAIN.equals(moduleName)) { continue; }
            try {
                if (Abstract.lookupDotted(e.getValue(), name) == obj) {
                    return moduleName;
                }
            } catch (RuntimeException ex) {
                // A broken module must not stop the search
                logger.atTrace()
                        .setMessage("Ignored {} looking for {} in {}")
                        .addArgument(ex).addArgument(name)
                        .addArgument(moduleName).log();
            }
        }
        return null;
    }

    /**
     * The {@code __module__} the object declares, if it is a string.
     *
     * @param obj in question
     * @return module name or {@code null}
     */
    static String declaredModule(Object obj) {
        Object m = obj instanceof PyType ? ((PyType)obj).getModule()
                : attrOrNull(obj, "__module__");
        return m instanceof String ? (String)m : null;
    }

    /**
     * The {@code __qualname__} or {@code __name__} of an object.
     *
     * @param obj in question
     * @return the name or {@code null} if it has neither
     */
    static String nameOf(Object obj) {
        for (String attr : new String[] {"__qualname__", "__name__"}) {
            Object n = attrOrNull(obj, attr);
            if (n instanceof String) { return (String)n; }
        }
        return null;
    }

    private static Object attrOrNull(Object obj, String attr) {
        try {
            return Abstract.getAttr(obj, attr);
        } catch (AttributeError e) {
            return null;
        }
    }

    private static Object lookupOrNull(PyModule module, String name) {
        try {
            return Abstract.lookupDotted(module, name);
        } catch (AttributeError e) {
            return null;
        }
    }

    /**
     * A module built at run time rather than loaded from a file
     * declares {@code __file__} as {@code None}.
     */
    private static boolean isAdHoc(PyModule module) {
        PyDict dict = module.getDict();
        return dict.containsKey("__file__")
                && dict.get("__file__") == Py.None;
    }
}
