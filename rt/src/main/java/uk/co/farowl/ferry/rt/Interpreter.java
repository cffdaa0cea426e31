// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An interpreter is responsible for certain variable aspects of the
 * "context" within which Python code executes. Chief among these is the
 * dictionary of imported modules, through which objects are found again
 * by module and qualified name.
 * <p>
 * Two interpreters in one JVM share nothing except the Java classes and
 * the built-in types. Subsystems that need state scoped to one
 * interpreter (a registry, a cache) attach it with
 * {@link #getAttachment(Class, Supplier)}.
 */
public class Interpreter {

    /** Logger for the run-time system. */
    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    /**
     * The modules created by or added to this interpreter, in the order
     * they were added ({@code sys.modules}). Guarded by itself.
     */
    private final Map<String, PyModule> modules = new LinkedHashMap<>();

    /**
     * The builtins module. An instance is created with each
     * {@code Interpreter}. Not {@code null}.
     */
    private final PyModule builtinsModule;

    /** Per-interpreter state of other subsystems, by class. */
    private final Map<Class<?>, Object> attachments =
            new ConcurrentHashMap<>();

    /**
     * Create a new {@code Interpreter} with the standard modules
     * installed.
     */
    public Interpreter() {
        builtinsModule = StandardModules.builtins();
        addModule(builtinsModule);
        StandardModules.addTo(this);
        logger.atDebug().setMessage("Interpreter created with {} modules")
                .addArgument(modules::size).log();
    }

    /**
     * Add a module to the module table.
     *
     * @param m to add
     * @throws InterpreterError if a module of that name is present
     */
    public void addModule(PyModule m) throws InterpreterError {
        synchronized (modules) {
            if (modules.putIfAbsent(m.name, m) != null) {
                throw new InterpreterError(
                        "Interpreter.addModule: Module already added %s",
                        m.name);
            }
        }
    }

    /**
     * Remove a module from the module table.
     *
     * @param name of module
     * @return the module removed or {@code null}
     */
    public PyModule removeModule(String name) {
        synchronized (modules) {
            return modules.remove(name);
        }
    }

    /**
     * Find a module in the module table.
     *
     * @param name of module
     * @return the module or {@code null} if not present
     */
    public PyModule getModule(String name) {
        synchronized (modules) {
            return modules.get(name);
        }
    }

    /**
     * A snapshot of the module table in the order modules were added.
     *
     * @return copy of the module table
     */
    public Map<String, PyModule> getModules() {
        synchronized (modules) {
            return new LinkedHashMap<>(modules);
        }
    }

    /**
     * Import a module by (possibly dotted) name from the module table.
     * Importing {@code pkg.sub} also makes {@code sub} an attribute of
     * {@code pkg}, as the import statement would.
     *
     * @param name of module
     * @return the module
     * @throws ImportError if the module (or a parent) is not present
     */
    public PyModule importModule(String name) throws ImportError {
        PyModule m = getModule(name);
        if (m == null) {
            throw new ImportError("No module named '%s'", name);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            PyModule parent = importModule(name.substring(0, dot));
            parent.getDict().putIfAbsent(name.substring(dot + 1), m);
        }
        return m;
    }

    /** @return the {@code builtins} module of this interpreter */
    public PyModule getBuiltins() { return builtinsModule; }

    /**
     * Get the state of some subsystem attached to this interpreter,
     * creating it on first request.
     *
     * @param <T> type of the attachment
     * @param key class of the attachment
     * @param factory to create it if absent
     * @return the attachment
     */
    public <T> T getAttachment(Class<T> key, Supplier<T> factory) {
        return key.cast(attachments.computeIfAbsent(key,
                k -> factory.get()));
    }
}
