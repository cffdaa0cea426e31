// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static uk.co.farowl.ferry.rt.pickle.Reconstructors.arg;

import java.util.Map;

import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyEnumMember;
import uk.co.farowl.ferry.rt.PyEnumType;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.pickle.Reconstructor;
import uk.co.farowl.ferry.rt.pickle.Reduction;
import uk.co.farowl.ferry.rt.pickle.UnpicklingError;

/**
 * Reduction of type objects by value. A dynamic class is recorded in two
 * parts: a shape (name, bases, tracking id and, for an enumeration, its
 * members) from which the destination makes or finds the class, and the
 * class dictionary, applied afterwards so that it may refer to the class
 * itself.
 */
final class ClassReducer {

    private ClassReducer() {} // only static methods here

    /**
     * {@code make_skeleton_class(name, bases, namespace, id)}: a class
     * shell, or the class already registered under the id.
     */
    static final Reconstructor MAKE_SKELETON_CLASS = (u, args) -> {
        ClassShape shape = ClassShape.plain(arg(args, 3, String.class),
                arg(args, 0, String.class), bases(args, 1),
                arg(args, 2, PyDict.class));
        return PickleContext.of(u.getInterpreter()).getSkeletons()
                .begin(shape).getType();
    };

    /**
     * {@code make_skeleton_enum(name, qualname, module, bases, members,
     * id)}: an enumeration with its members but no other body, or the
     * enumeration already registered under the id.
     */
    static final Reconstructor MAKE_SKELETON_ENUM = (u, args) -> {
        String id = arg(args, 5, String.class);
        Object module = args.get(2);
        ClassShape shape = ClassShape.enumeration(id,
                arg(args, 0, String.class),
                arg(args, 1, String.class),
                module instanceof String ? (String)module : null,
                bases(args, 3), arg(args, 4, PyDict.class));
        return PickleContext.of(u.getInterpreter()).getSkeletons()
                .begin(shape).getType();
    };

    /**
     * {@code class_setstate(type, (dict, slots))}: fill in the body of a
     * shell. A class that is not a shell awaiting its body is unchanged.
     */
    static final Reconstructor CLASS_SETSTATE = (u, args) -> {
        PyType type = arg(args, 0, PyType.class);
        PyTuple state = arg(args, 1, PyTuple.class);
        SkeletonBuilder skeletons =
                PickleContext.of(u.getInterpreter()).getSkeletons();
        Skeleton handle = skeletons.pendingFor(type);
        if (handle != null) {
            PyDict body = new PyDict(arg(state, 0, PyDict.class));
            if (state.size() > 1 && state.get(1) instanceof PyDict) {
                body.putAll((PyDict)state.get(1));
            }
            skeletons.commit(handle, body);
        }
        return type;
    };

    /** {@code type_of(obj)}: the type of a special singleton. */
    static final Reconstructor TYPE_OF =
            (u, args) -> PyType.of(args.get(0));

    private static PyType[] bases(PyTuple args, int i) {
        PyTuple t = arg(args, i, PyTuple.class);
        PyType[] bases = new PyType[t.size()];
        for (int j = 0; j < bases.length; j++) {
            Object b = t.get(j);
            if (!(b instanceof PyType)) {
                throw new UnpicklingError("base %d is not a type: %s", j,
                        b);
            }
            bases[j] = (PyType)b;
        }
        return bases;
    }

    /**
     * Reduce a type object, or decline so that it is pickled by
     * reference. Built-in types are always pickled by reference, and
     * fail there if they cannot be found.
     *
     * @param type to reduce
     * @param pickler on whose behalf
     * @return the reduction or {@code null}
     */
    static Reduction reduce(PyType type, ValuePickler pickler) {
        TypeKind kind = TypeKind.of(type);
        if (kind == TypeKind.SINGLETON) {
            return new Reduction(TYPE_OF,
                    Py.tuple(TypeKind.singletonOf(type)));
        }
        PickleContext context = pickler.getContext();
        if (type.isBuiltin() || context.getResolver()
                .decide(type) == ReferenceResolver.Decision.REFERENCE) {
            return null;
        }

        String id = context.getTracker().getOrCreateId(type);
        PyTuple bases = new PyTuple((Object[])type.getBases());
        String module = type.getModule();
        PyTuple state = Py.tuple(classDict(type), new PyDict());

        if (kind == TypeKind.ENUM) {
            PyDict members = new PyDict();
            for (PyEnumMember m : ((PyEnumType)type).getMembers()
                    .values()) {
                members.put(m.getName(), m.getValue());
            }
            return new Reduction(MAKE_SKELETON_ENUM,
                    Py.tuple(type.getName(), type.getQualname(),
                            Py.noneIfNull(module), bases, members, id),
                    state, CLASS_SETSTATE);
        }

        PyDict namespace = new PyDict();
        namespace.put("__qualname__", type.getQualname());
        if (module != null) { namespace.put("__module__", module); }
        return new Reduction(MAKE_SKELETON_CLASS,
                Py.tuple(type.getName(), bases, namespace, id), state,
                CLASS_SETSTATE);
    }

    /**
     * The part of the class dictionary the destination must set: not
     * {@code __dict__} or {@code __weakref__}, not what the bases
     * already supply, and not the members of an enumeration.
     */
    static PyDict classDict(PyType type) {
        PyDict body = new PyDict();
        PyType[] bases = type.getBases();
        Map<String, PyEnumMember> members = type instanceof PyEnumType
                ? ((PyEnumType)type).getMembers() : Map.of();
        for (Map.Entry<Object, Object> e : type.getDict().entrySet()) {
            Object k = e.getKey(), v = e.getValue();
            if ("__dict__".equals(k) || "__weakref__".equals(k)
                    || members.containsKey(k) || inherited(bases, k, v)) {
                continue;
            }
            body.put(k, v);
        }
        return body;
    }

    private static boolean inherited(PyType[] bases, Object k, Object v) {
        if (k instanceof String) {
            for (PyType b : bases) {
                if (b.lookup((String)k) == v) { return true; }
            }
        }
        return false;
    }
}
