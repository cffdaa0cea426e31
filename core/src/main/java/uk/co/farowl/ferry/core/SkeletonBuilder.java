// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyEnumType;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.pickle.UnpicklingError;

/**
 * Rebuilds dynamic classes in two steps. {@link #begin(ClassShape)}
 * makes a shell with no body and registers it under its tracking id, so
 * that the methods of the class (which may refer to it) can be rebuilt.
 * {@link #commit(Skeleton, Map)} then fills in the body. If the id is
 * already known in this interpreter, the class registered under it is
 * used instead and neither step changes it.
 */
public class SkeletonBuilder {

    static final Logger logger =
            LoggerFactory.getLogger(SkeletonBuilder.class);

    private final ClassTracker tracker;

    /** Shells awaiting their body. Guarded by itself. */
    private final Set<PyType> pending =
            Collections.newSetFromMap(new WeakHashMap<>());

    SkeletonBuilder(ClassTracker tracker) { this.tracker = tracker; }

    /**
     * Make (or find) the class described by the shape.
     *
     * @param shape recorded in the pickle
     * @return handle on the class
     * @throws UnpicklingError if a class registered under the same id
     *     is of a different kind or has a different name
     */
    public Skeleton begin(ClassShape shape) throws UnpicklingError {
        PyType shell = makeShell(shape);
        PyType type = tracker.registerIfAbsent(shape.getId(), shell);
        synchronized (pending) {
            if (type == shell) {
                pending.add(shell);
                logger.atDebug().setMessage("Created shell {} for {}")
                        .addArgument(shell).addArgument(shape::getId)
                        .log();
                return new Skeleton(shell, false, Skeleton.State.SKELETON);
            }
            checkCompatible(type, shape);
            logger.atDebug().setMessage("Reusing {} for {}")
                    .addArgument(type).addArgument(shape::getId).log();
            return new Skeleton(type, true, pending.contains(type)
                    ? Skeleton.State.SKELETON : Skeleton.State.FILLED);
        }
    }

    private static PyType makeShell(ClassShape shape) {
        if (shape.getKind() == TypeKind.ENUM) {
            PyEnumType e = new PyEnumType(shape.getName(),
                    shape.getBases(), shape.getNamespace());
            for (Map.Entry<String, Object> m : shape.getMembers()
                    .entrySet()) {
                e.addMember(m.getKey(), m.getValue());
            }
            return e;
        }
        return new PyType(shape.getName(), shape.getBases(),
                shape.getNamespace());
    }

    private static void checkCompatible(PyType type, ClassShape shape)
            throws UnpicklingError {
        TypeKind kind = TypeKind.of(type);
        if (kind != shape.getKind()
                || !type.getName().equals(shape.getName())) {
            throw new UnpicklingError(
                    "tracking id %s is %s (%s), not %s %s", shape.getId(),
                    type, kind, shape.getKind(), shape.getName());
        }
    }

    /**
     * Fill in the body of a shell. Only the first commit of a new shell
     * changes anything: a reused class, or a shell already filled, is
     * left as it is.
     *
     * @param handle from {@link #begin(ClassShape)}
     * @param body attributes to set on the class
     * @return {@code true} if the body was applied
     */
    public boolean commit(Skeleton handle, Map<?, ?> body) {
        PyType type = handle.getType();
        synchronized (pending) {
            if (handle.isReused() || !pending.remove(type)) {
                return false;
            }
        }
        for (Map.Entry<?, ?> e : body.entrySet()) {
            type.setAttribute((String)e.getKey(), e.getValue());
        }
        handle.filled();
        logger.atDebug().setMessage("Filled {} with {} attributes")
                .addArgument(type).addArgument(body::size).log();
        return true;
    }

    /**
     * Find the handle of a shell still awaiting its body.
     *
     * @param type possibly a shell
     * @return its handle or {@code null} if it is not a pending shell
     */
    public Skeleton pendingFor(PyType type) {
        synchronized (pending) {
            return pending.contains(type)
                    ? new Skeleton(type, false, Skeleton.State.SKELETON)
                    : null;
        }
    }

    /**
     * Convenience for a body that is a class dictionary.
     *
     * @param type a shell
     * @param body attributes to set on the class
     * @return {@code true} if the body was applied
     */
    boolean fill(PyType type, PyDict body) {
        Skeleton handle = pendingFor(type);
        return handle != null && commit(handle, body);
    }
}
