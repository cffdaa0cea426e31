// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.TypeError;
import uk.co.farowl.ferry.rt.ValueError;

/**
 * The modules whose functions and classes are to be pickled by value,
 * although they could be found by reference. This suits a module under
 * development, that the processes loading the pickle do not have (or
 * have in an older version). The set is empty initially and is never
 * persisted.
 */
public class ByValueModules {

    private static final Logger logger =
            LoggerFactory.getLogger(ByValueModules.class);

    private final Interpreter interpreter;

    /** Names of the registered modules. Guarded by itself. */
    private final Set<String> names = new LinkedHashSet<>();

    ByValueModules(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * Register a module so that its functions and classes are pickled
     * by value. Registering a module again has no further effect.
     *
     * @param module to register
     * @throws TypeError if the argument is not a module
     * @throws ValueError if the module is not in the module table
     */
    public void registerByValue(Object module) throws TypeError, ValueError {
        PyModule m = checkModule(module);
        if (interpreter.getModule(m.getName()) != m) {
            throw new ValueError("%s was not imported correctly, have you"
                    + " used an import statement to access it?", m);
        }
        synchronized (names) {
            if (names.add(m.getName())) {
                logger.atDebug().setMessage("Registered {} by value")
                        .addArgument(m::getName).log();
            }
        }
    }

    /**
     * Reverse {@link #registerByValue(Object)}.
     *
     * @param module to unregister
     * @throws TypeError if the argument is not a module
     * @throws ValueError if the module is not registered
     */
    public void unregisterByValue(Object module)
            throws TypeError, ValueError {
        PyModule m = checkModule(module);
        synchronized (names) {
            if (!names.remove(m.getName())) {
                throw new ValueError("%s is not registered for pickle by"
                        + " value", m);
            }
        }
        logger.atDebug().setMessage("Unregistered {}")
                .addArgument(m::getName).log();
    }

    /**
     * Whether a module, or any package that contains it, is registered.
     *
     * @param moduleName (dotted) name of the module
     * @return {@code true} if registered
     */
    public boolean isRegisteredByValue(String moduleName) {
        synchronized (names) {
            for (String n = moduleName; n != null; n = parentOf(n)) {
                if (names.contains(n)) { return true; }
            }
            return false;
        }
    }

    /**
     * Whether a module, or any package that contains it, is registered.
     *
     * @param module to test
     * @return {@code true} if registered
     */
    public boolean isRegisteredByValue(PyModule module) {
        return isRegisteredByValue(module.getName());
    }

    private static String parentOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? null : name.substring(0, dot);
    }

    private static PyModule checkModule(Object module) throws TypeError {
        if (module instanceof PyModule) { return (PyModule)module; }
        throw new TypeError("Input should be a module, not '%s'",
                PyType.of(module).getName());
    }
}
