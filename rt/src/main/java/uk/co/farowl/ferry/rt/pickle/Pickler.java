// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import static uk.co.farowl.ferry.rt.pickle.PickleFormat.*;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.BaseException;
import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.OSError;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyJavaFunction;
import uk.co.farowl.ferry.rt.PyList;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;

/**
 * Write objects to a stream in a form the {@link Unpickler} can rebuild
 * them from. This is the generic pickler: it encodes data (numbers,
 * strings, tuples, lists and dictionaries) itself, objects that reduce
 * themselves, and types and functions by reference to the module that
 * defines them.
 * <p>
 * A sub-class adds strategies by overriding
 * {@link #reducerOverride(Object)}, which sees every object that is not
 * plain data before anything else does, or by adding entries to the
 * table of {@link Reducer}s with {@link #addReducer(Class, Reducer)}.
 * <p>
 * Every object other than a scalar is assigned a memo index when it has
 * been constructed and before its state is written. A repeat occurrence
 * (including one reached through its own state) is written as a
 * reference to that index, so sharing and cycles survive.
 */
public class Pickler {

    /*
     * High water mark to determine when the pickled object is
     * dangerously deep. When the walk gets this deep, raise an
     * exception instead of continuing.
     */
    private static final int MAX_PICKLE_DEPTH = 2000;

    /** The interpreter in which objects are resolved. */
    protected final Interpreter interpreter;

    /** The destination of the pickle. */
    private final Writer out;

    /** Objects written so far and their memo indexes. */
    private final Map<Object, Integer> memo = new IdentityHashMap<>();

    /** Reducers by exact Java class. */
    private final Map<Class<?>, Reducer> dispatchTable = new HashMap<>();

    /** Current depth of {@link #save(Object)} calls. */
    private int depth;

    /**
     * Create a pickler onto the given stream.
     *
     * @param interpreter in which objects are resolved
     * @param out destination of the pickle
     */
    public Pickler(Interpreter interpreter, OutputStream out) {
        this.interpreter = interpreter;
        this.out = new Writer(out);
    }

    /** @return the interpreter in which objects are resolved */
    public Interpreter getInterpreter() { return interpreter; }

    /**
     * Add (or replace) the reducer for objects of exactly the given
     * Java class.
     *
     * @param c Java class of objects to reduce
     * @param r reducer for them
     */
    public void addReducer(Class<?> c, Reducer r) {
        dispatchTable.put(c, r);
    }

    /**
     * Write a complete pickle of one object.
     *
     * @param obj to pickle
     * @throws PicklingError if some object reached cannot be pickled
     */
    public void dump(Object obj) throws PicklingError {
        out.writeByte(PROTO);
        out.writeByte(VERSION);
        save(obj);
        out.writeByte(STOP);
        out.flush();
    }

    /**
     * A strategy that takes precedence over every other for objects
     * that are not plain data. The generic pickler declines everything.
     *
     * @param obj to reduce
     * @return how to rebuild the object, or {@code null} to decline
     * @throws PicklingError if the object must not be pickled
     */
    protected Reduction reducerOverride(Object obj) throws PicklingError {
        return null;
    }

    /**
     * Whether an object has been written already in this pickle.
     *
     * @param obj to test
     * @return {@code true} if it has a memo index
     */
    public boolean isMemoized(Object obj) { return memo.containsKey(obj); }

    /**
     * Write one object (and everything reachable from it).
     *
     * @param obj to write
     * @throws PicklingError if some object reached cannot be pickled
     */
    public final void save(Object obj) throws PicklingError {
        if (++depth > MAX_PICKLE_DEPTH) {
            throw new PicklingError("Could not pickle object as"
                    + " excessively deep recursion required.");
        }
        try {
            if (!saveScalar(obj)) {
                Integer index = memo.get(obj);
                if (index != null) {
                    out.writeGet(index);
                } else if (!saveContainer(obj)) {
                    saveObject(obj);
                }
            }
        } finally {
            --depth;
        }
    }

    /** Write the object if it is a scalar, returning true if it was. */
    private boolean saveScalar(Object obj) {
        if (obj == Py.None) {
            out.writeByte(NONE);
        } else if (obj instanceof Boolean) {
            out.writeByte((Boolean)obj ? NEWTRUE : NEWFALSE);
        } else if (obj instanceof Integer) {
            out.writeByte(INT);
            out.writeInt((Integer)obj);
        } else if (obj instanceof BigInteger) {
            byte[] b = ((BigInteger)obj).toByteArray();
            out.writeByte(LONG);
            out.writeInt(b.length);
            // Little-endian to match the other numbers
            for (int i = b.length - 1; i >= 0; --i) { out.writeByte(b[i]); }
        } else if (obj instanceof Double) {
            out.writeByte(FLOAT);
            out.writeLong(Double.doubleToRawLongBits((Double)obj));
        } else if (obj instanceof String) {
            out.writeByte(UNICODE);
            out.writeBytes(((String)obj).getBytes(StandardCharsets.UTF_8));
        } else if (obj instanceof byte[]) {
            out.writeByte(BYTES);
            out.writeBytes((byte[])obj);
        } else if (obj == null) {
            throw new PicklingError("Can't pickle a Java null");
        } else {
            return false;
        }
        return true;
    }

    /** Write the object if it is a container, returning true if it was. */
    private boolean saveContainer(Object obj) {
        Class<?> c = obj.getClass();
        if (c == PyTuple.class) {
            PyTuple t = (PyTuple)obj;
            if (t.isEmpty()) {
                out.writeByte(EMPTY_TUPLE);
                return true;
            }
            out.writeByte(MARK);
            for (Object v : t) { save(v); }
            Integer index = memo.get(t);
            if (index != null) {
                // Reached through its own elements: use that copy
                out.writeByte(POP_MARK);
                out.writeGet(index);
            } else {
                out.writeByte(TUPLE);
                memoize(t);
            }
        } else if (c == PyList.class) {
            out.writeByte(EMPTY_LIST);
            memoize(obj);
            PyList list = (PyList)obj;
            if (!list.isEmpty()) {
                out.writeByte(MARK);
                for (Object v : list) { save(v); }
                out.writeByte(APPENDS);
            }
        } else if (c == PyDict.class) {
            out.writeByte(EMPTY_DICT);
            memoize(obj);
            PyDict dict = (PyDict)obj;
            if (!dict.isEmpty()) {
                out.writeByte(MARK);
                for (Map.Entry<Object, Object> e : dict.entrySet()) {
                    save(e.getKey());
                    save(e.getValue());
                }
                out.writeByte(SETITEMS);
            }
        } else {
            return false;
        }
        return true;
    }

    /** Write an object that is not plain data, by the first strategy. */
    private void saveObject(Object obj) {
        Reduction r = reducerOverride(obj);
        if (r == null) {
            Reducer reducer = dispatchTable.get(obj.getClass());
            if (reducer != null) {
                r = reducer.reduce(obj, this);
            } else if (obj instanceof Reducible) {
                r = ((Reducible)obj).reduce();
            }
        }
        if (r != null) {
            saveReduce(obj, r);
        } else if (obj instanceof PyType) {
            PyType t = (PyType)obj;
            saveGlobal(obj, t.getModule(), t.getQualname());
        } else if (obj instanceof PyFunction) {
            PyFunction f = (PyFunction)obj;
            Object m = f.getModule();
            saveGlobal(obj, m instanceof String ? (String)m : null,
                    f.getQualname());
        } else if (obj instanceof PyJavaFunction) {
            PyJavaFunction f = (PyJavaFunction)obj;
            saveGlobal(obj, f.getModule(), f.getName());
        } else if (obj == Py.Ellipsis || obj == Py.NotImplemented) {
            saveGlobal(obj, "builtins", obj.toString());
        } else {
            throw new PicklingError("Can't pickle %s: no way to reduce"
                    + " '%s' objects", obj, PyType.of(obj).getName());
        }
    }

    /**
     * Write the reduction of an object: its constructor and arguments,
     * then its memo entry, then any state.
     *
     * @param obj being written
     * @param r its reduction
     */
    protected void saveReduce(Object obj, Reduction r) {
        saveCallable(r.getConstructor());
        save(r.getArgs());
        out.writeByte(REDUCE);

        Integer index = memo.get(obj);
        if (index != null) {
            // Reached through its own arguments: use that copy
            out.writeByte(POP);
            out.writeGet(index);
        } else {
            index = memoize(obj);
        }

        Object state = r.getState();
        if (state != null) {
            Object setter = r.getSetter();
            if (setter != null) {
                // setter(obj, state), leaving obj on the stack
                saveCallable(setter);
                out.writeByte(MARK);
                out.writeGet(index);
                save(state);
                out.writeByte(TUPLE);
                out.writeByte(REDUCE);
                out.writeByte(POP);
            } else {
                save(state);
                out.writeByte(BUILD);
            }
        }
    }

    /** Write a constructor or setter. */
    private void saveCallable(Object c) {
        if (c instanceof Reconstructor) {
            out.writeByte(RECONSTRUCTOR);
            out.writeString(Reconstructors.nameOf((Reconstructor)c));
        } else {
            save(c);
        }
    }

    /**
     * Write an object as a reference to its module and qualified name,
     * after checking that this is how it may be found again.
     *
     * @param obj being written
     * @param module declared module of {@code obj} or {@code null}
     * @param qualname qualified name of {@code obj}
     * @throws PicklingError if the reference does not lead to
     *     {@code obj}
     */
    protected void saveGlobal(Object obj, String module, String qualname)
            throws PicklingError {
        String m = module == null ? "__main__" : module;
        Object found;
        try {
            PyModule mod = interpreter.importModule(m);
            found = Abstract.lookupDotted(mod, qualname);
        } catch (BaseException e) {
            PicklingError pe = new PicklingError(
                    "Can't pickle %s: it's not found as %s.%s", obj, m,
                    qualname);
            pe.initCause(e);
            throw pe;
        }
        if (found != obj) {
            throw new PicklingError(
                    "Can't pickle %s: it's not the same object as %s.%s",
                    obj, m, qualname);
        }
        out.writeByte(GLOBAL);
        out.writeString(m);
        out.writeString(qualname);
        memoize(obj);
    }

    private int memoize(Object obj) {
        int index = memo.size();
        memo.put(obj, index);
        out.writeByte(MEMOIZE);
        return index;
    }

    /**
     * The destination wrapped in a {@code DataOutputStream}. The stream
     * is little-endian, while Java writes big-endian data, so we reverse
     * the bytes of numbers.
     */
    private static class Writer {

        private final DataOutputStream file;

        Writer(OutputStream file) { this.file = new DataOutputStream(file); }

        void writeByte(int b) {
            try {
                file.write(b);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        void writeInt(int v) {
            try {
                file.writeInt(Integer.reverseBytes(v));
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        void writeLong(long v) {
            try {
                file.writeLong(Long.reverseBytes(v));
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        /** Write a counted array of bytes. */
        void writeBytes(byte[] b) {
            writeInt(b.length);
            try {
                file.write(b);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        void writeString(String s) {
            writeBytes(s.getBytes(StandardCharsets.UTF_8));
        }

        void writeGet(int index) {
            writeByte(GET);
            writeInt(index);
        }

        void flush() {
            try {
                file.flush();
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }
    }
}
