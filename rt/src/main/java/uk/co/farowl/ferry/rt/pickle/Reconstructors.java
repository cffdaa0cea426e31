// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.InterpreterError;
import uk.co.farowl.ferry.rt.PyBaseObject;
import uk.co.farowl.ferry.rt.PyEnumMember;
import uk.co.farowl.ferry.rt.PyEnumType;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;

/**
 * The table of {@link Reconstructor}s by name, shared by all picklers
 * and unpicklers in the JVM. It holds those the generic pickler needs,
 * and those of every {@link PicklerProvider} on the class path.
 */
public final class Reconstructors {

    private Reconstructors() {} // only static methods here

    /** Guarded by itself. */
    private static final Map<String, Reconstructor> byName =
            new HashMap<>();
    /** Guarded by {@link #byName}. */
    private static final Map<Reconstructor, String> nameOf =
            new IdentityHashMap<>();

    /**
     * {@code object_new(type)}: an instance of a Python-defined class,
     * without calling {@code __init__}.
     */
    public static final Reconstructor OBJECT_NEW = (u, args) -> {
        PyType type = arg(args, 0, PyType.class);
        if (type.isBuiltin()) {
            throw new UnpicklingError("object_new(%s) is not safe", type);
        }
        return new PyBaseObject(type);
    };

    /** {@code enum_member(type, name)}: an existing member by name. */
    public static final Reconstructor ENUM_MEMBER = (u, args) -> {
        PyEnumType type = arg(args, 0, PyEnumType.class);
        String name = arg(args, 1, String.class);
        PyEnumMember m = type.getMembers().get(name);
        if (m == null) {
            throw new UnpicklingError("%s has no member '%s'",
                    type.getQualname(), name);
        }
        return m;
    };

    /** {@code getattr(obj, name)}. */
    public static final Reconstructor GETATTR = (u, args) -> Abstract
            .getAttr(args.get(0), arg(args, 1, String.class));

    /** {@code import_module(name)} in the destination interpreter. */
    public static final Reconstructor IMPORT_MODULE = (u, args) -> u
            .getInterpreter().importModule(arg(args, 0, String.class));

    static {
        register("object_new", OBJECT_NEW);
        register("enum_member", ENUM_MEMBER);
        register("getattr", GETATTR);
        register("import_module", IMPORT_MODULE);
        for (PicklerProvider p : PicklerSelection.providers()) {
            p.reconstructors(Reconstructors::register);
        }
    }

    /**
     * Add a reconstructor to the table. Registering the same object
     * again under the same name has no effect.
     *
     * @param name to record in streams
     * @param r the reconstructor
     * @throws InterpreterError if the name or object is already
     *     registered differently
     */
    public static void register(String name, Reconstructor r)
            throws InterpreterError {
        synchronized (byName) {
            Reconstructor old = byName.get(name);
            String oldName = nameOf.get(r);
            if (old == r && name.equals(oldName)) {
                return;
            } else if (old != null || oldName != null) {
                throw new InterpreterError(
                        "reconstructor '%s' already registered", name);
            }
            byName.put(name, r);
            nameOf.put(r, name);
        }
    }

    /**
     * Find a reconstructor by the name recorded in a stream.
     *
     * @param name recorded
     * @return the reconstructor
     * @throws UnpicklingError if there is none of that name
     */
    public static Reconstructor get(String name) throws UnpicklingError {
        synchronized (byName) {
            Reconstructor r = byName.get(name);
            if (r == null) {
                throw new UnpicklingError("unknown reconstructor '%s'",
                        name);
            }
            return r;
        }
    }

    /**
     * The name under which a reconstructor is registered.
     *
     * @param r the reconstructor
     * @return its name
     * @throws PicklingError if it is not registered
     */
    public static String nameOf(Reconstructor r) throws PicklingError {
        synchronized (byName) {
            String name = nameOf.get(r);
            if (name == null) {
                throw new PicklingError(
                        "Can't pickle %s: reconstructor not registered",
                        r);
            }
            return name;
        }
    }

    /**
     * Get an argument of a reconstructor, checking its class.
     *
     * @param <T> expected class
     * @param args arguments as recorded
     * @param i index of argument
     * @param c expected class
     * @return the argument
     * @throws UnpicklingError if missing or of the wrong class
     */
    public static <T> T arg(PyTuple args, int i, Class<T> c)
            throws UnpicklingError {
        if (i >= args.size()) {
            throw new UnpicklingError("reconstructor expected %d arguments,"
                    + " got %d", i + 1, args.size());
        }
        Object a = args.get(i);
        if (!c.isInstance(a)) {
            throw new UnpicklingError(
                    "reconstructor argument %d: expected %s, got %s", i,
                    c.getSimpleName(), PyType.of(a).getName());
        }
        return c.cast(a);
    }
}
