// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code logging.Logger} object, implemented over an SLF4J logger
 * of the same name. As in Python, there is one logger per name, so
 * {@link #getLogger(String)} is the only way to obtain one.
 */
public class PyLogger implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE =
            PyType.fromSpec("Logger", "logging");

    /** The name of the root logger. */
    public static final String ROOT_NAME = "root";

    private static final ConcurrentMap<String, PyLogger> loggers =
            new ConcurrentHashMap<>();

    private final String name;
    private final Logger logger;

    private PyLogger(String name) {
        this.name = name;
        this.logger = LoggerFactory.getLogger(
                ROOT_NAME.equals(name) ? Logger.ROOT_LOGGER_NAME : name);
    }

    /**
     * Return the logger with the given name, creating it if necessary.
     * A {@code null} name (or {@code None}) designates the root logger.
     *
     * @param name of the logger or {@code null}
     * @return the logger
     */
    public static PyLogger getLogger(String name) {
        String n = name == null ? ROOT_NAME : name;
        return loggers.computeIfAbsent(n, PyLogger::new);
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return the name of this logger */
    public String getName() { return name; }

    /** @return whether this is the root logger */
    public boolean isRoot() { return ROOT_NAME.equals(name); }

    /** @param msg to log at INFO level */
    public void info(String msg) { logger.info(msg); }

    /** @param msg to log at WARNING level */
    public void warning(String msg) { logger.warn(msg); }

    /** @param msg to log at DEBUG level */
    public void debug(String msg) { logger.debug(msg); }

    @Override
    public String toString() {
        return String.format("<Logger %s>", name);
    }
}
