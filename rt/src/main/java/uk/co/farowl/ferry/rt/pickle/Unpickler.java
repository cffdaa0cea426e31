// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import static uk.co.farowl.ferry.rt.pickle.PickleFormat.*;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.Callables;
import uk.co.farowl.ferry.rt.DictPyObject;
import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.OSError;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyList;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;

/**
 * Rebuild objects from a stream written by a {@link Pickler}, in a
 * destination {@link Interpreter}. References to modules are resolved
 * in that interpreter's module table, and {@link Reconstructor}s run
 * with access to it.
 */
public class Unpickler {

    private final Interpreter interpreter;
    private final Reader in;

    /** Objects by memo index. */
    private final List<Object> memo = new ArrayList<>();

    /** The stack of the machine. */
    private final List<Object> stack = new ArrayList<>();

    /** Stack depths recorded by {@code MARK}. */
    private final Deque<Integer> marks = new ArrayDeque<>();

    /**
     * Create an unpickler reading the given stream.
     *
     * @param interpreter in which to rebuild objects
     * @param in source of the pickle
     */
    public Unpickler(Interpreter interpreter, InputStream in) {
        this.interpreter = interpreter;
        this.in = new Reader(in);
    }

    /**
     * Create an unpickler reading the given bytes.
     *
     * @param interpreter in which to rebuild objects
     * @param data the pickle
     */
    public Unpickler(Interpreter interpreter, byte[] data) {
        this(interpreter, new ByteArrayInputStream(data));
    }

    /** @return the interpreter in which objects are rebuilt */
    public Interpreter getInterpreter() { return interpreter; }

    /**
     * Read one complete pickle and return the object it encodes.
     *
     * @return the object rebuilt
     * @throws UnpicklingError if the stream is malformed
     */
    public Object load() throws UnpicklingError {
        int op = in.readByte();
        if (op != PROTO) {
            throw new UnpicklingError("invalid load key, '%#x'.", op);
        }
        int version = in.readByte();
        if (version != VERSION) {
            throw new UnpicklingError("unsupported pickle protocol: %d",
                    version);
        }
        for (;;) {
            op = in.readByte();
            switch (op) {
                case STOP:
                    Object result = pop();
                    if (!stack.isEmpty() || !marks.isEmpty()) {
                        throw new UnpicklingError(
                                "pickle stream ended with %d on the stack",
                                stack.size());
                    }
                    return result;
                case NONE:
                    push(Py.None);
                    break;
                case NEWTRUE:
                    push(Boolean.TRUE);
                    break;
                case NEWFALSE:
                    push(Boolean.FALSE);
                    break;
                case INT:
                    push(in.readInt());
                    break;
                case LONG:
                    push(Py.val(readLong()));
                    break;
                case FLOAT:
                    push(Double.longBitsToDouble(in.readLong()));
                    break;
                case UNICODE:
                    push(in.readString());
                    break;
                case BYTES:
                    push(in.readBytes());
                    break;
                case MARK:
                    marks.push(stack.size());
                    break;
                case TUPLE:
                    push(PyTuple.from(popMark()));
                    break;
                case EMPTY_TUPLE:
                    push(PyTuple.EMPTY);
                    break;
                case POP_MARK:
                    popMark();
                    break;
                case EMPTY_LIST:
                    push(new PyList());
                    break;
                case APPENDS:
                    appends();
                    break;
                case EMPTY_DICT:
                    push(new PyDict());
                    break;
                case SETITEMS:
                    setItems();
                    break;
                case GLOBAL:
                    push(findGlobal(in.readString(), in.readString()));
                    break;
                case RECONSTRUCTOR:
                    push(Reconstructors.get(in.readString()));
                    break;
                case REDUCE:
                    reduce();
                    break;
                case BUILD:
                    build();
                    break;
                case POP:
                    pop();
                    break;
                case MEMOIZE:
                    memo.add(top());
                    break;
                case GET:
                    push(getMemo(in.readInt()));
                    break;
                default:
                    throw new UnpicklingError("invalid load key, '%#x'.",
                            op);
            }
        }
    }

    private void push(Object v) { stack.add(v); }

    private Object pop() {
        if (stack.isEmpty()) {
            throw new UnpicklingError("unpickling stack underflow");
        }
        return stack.remove(stack.size() - 1);
    }

    private Object top() {
        if (stack.isEmpty()) {
            throw new UnpicklingError("unpickling stack underflow");
        }
        return stack.get(stack.size() - 1);
    }

    /** Remove and return everything above the last mark. */
    private List<Object> popMark() {
        if (marks.isEmpty()) {
            throw new UnpicklingError("could not find MARK");
        }
        int k = marks.pop();
        List<Object> above = stack.subList(k, stack.size());
        List<Object> items = new ArrayList<>(above);
        above.clear();
        return items;
    }

    private Object getMemo(int index) {
        if (index < 0 || index >= memo.size()) {
            throw new UnpicklingError("Memo value not found at index %d",
                    index);
        }
        return memo.get(index);
    }

    private BigInteger readLong() {
        byte[] b = in.readBytes();
        // Stored little-endian
        for (int i = 0, j = b.length - 1; i < j; i++, j--) {
            byte t = b[i];
            b[i] = b[j];
            b[j] = t;
        }
        return b.length == 0 ? BigInteger.ZERO : new BigInteger(b);
    }

    private void appends() {
        List<Object> items = popMark();
        Object list = top();
        if (!(list instanceof PyList)) {
            throw new UnpicklingError("APPENDS to a non-list");
        }
        ((PyList)list).addAll(items);
    }

    private void setItems() {
        List<Object> items = popMark();
        Object dict = top();
        if (!(dict instanceof PyDict) || items.size() % 2 != 0) {
            throw new UnpicklingError("SETITEMS to a non-dict");
        }
        PyDict d = (PyDict)dict;
        for (int i = 0; i < items.size(); i += 2) {
            d.put(items.get(i), items.get(i + 1));
        }
    }

    /**
     * Find an object by module and qualified name, importing the module
     * in the destination interpreter.
     *
     * @param module name of module
     * @param qualname of the object in the module
     * @return the object found
     */
    protected Object findGlobal(String module, String qualname) {
        return Abstract.lookupDotted(interpreter.importModule(module),
                qualname);
    }

    private void reduce() {
        Object args = pop();
        Object callable = pop();
        if (!(args instanceof PyTuple)) {
            throw new UnpicklingError("REDUCE arguments are not a tuple");
        }
        PyTuple a = (PyTuple)args;
        if (callable instanceof Reconstructor) {
            push(((Reconstructor)callable).construct(this, a));
        } else {
            push(Callables.call(callable, a.toArray()));
        }
    }

    /**
     * Apply state to the object on the top of the stack. An object with
     * {@code __setstate__} receives the state by calling it. Otherwise
     * the state is a {@code dict} to merge into the instance dictionary,
     * or a pair of such a {@code dict} (or {@code None}) and a
     * {@code dict} of attributes to set.
     */
    private void build() {
        Object state = pop();
        Object obj = top();
        Object setstate = PyType.of(obj).lookup("__setstate__");
        if (setstate != null) {
            Callables.call(setstate, obj, state);
            return;
        }
        Object slots = null;
        if (state instanceof PyTuple && ((PyTuple)state).size() == 2) {
            PyTuple t = (PyTuple)state;
            state = t.get(0);
            slots = t.get(1);
        }
        if (state instanceof PyDict && !((PyDict)state).isEmpty()) {
            if (!(obj instanceof DictPyObject)) {
                throw new UnpicklingError("state for %s needs __dict__",
                        PyType.of(obj).getName());
            }
            ((DictPyObject)obj).getDict().putAll((PyDict)state);
        } else if (state != Py.None && !(state instanceof PyDict)) {
            throw new UnpicklingError("state is not a dictionary");
        }
        if (slots instanceof PyDict) {
            for (Map.Entry<Object, Object> e : ((PyDict)slots).entrySet()) {
                Abstract.setAttr(obj, (String)e.getKey(), e.getValue());
            }
        } else if (slots != null && slots != Py.None) {
            throw new UnpicklingError("slot state is not a dictionary");
        }
    }

    /**
     * The source wrapped in a {@code DataInputStream}. The stream is
     * little-endian, while Java reads big-endian data, so we reverse the
     * bytes of numbers. The end of data within a record means the pickle
     * was truncated.
     */
    private static class Reader {

        private final DataInputStream file;

        Reader(InputStream file) { this.file = new DataInputStream(file); }

        int readByte() {
            try {
                return file.readByte() & 0xff;
            } catch (EOFException eofe) {
                throw truncated(eofe);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        int readInt() {
            try {
                return Integer.reverseBytes(file.readInt());
            } catch (EOFException eofe) {
                throw truncated(eofe);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        long readLong() {
            try {
                return Long.reverseBytes(file.readLong());
            } catch (EOFException eofe) {
                throw truncated(eofe);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
        }

        /** Read a counted array of bytes. */
        byte[] readBytes() {
            int n = readInt();
            if (n < 0) {
                throw new UnpicklingError("negative byte count %d", n);
            }
            byte[] b = new byte[n];
            try {
                file.readFully(b);
            } catch (EOFException eofe) {
                throw truncated(eofe);
            } catch (IOException ioe) {
                throw new OSError(ioe);
            }
            return b;
        }

        String readString() {
            return new String(readBytes(), StandardCharsets.UTF_8);
        }

        private static UnpicklingError truncated(EOFException eofe) {
            UnpicklingError e =
                    new UnpicklingError("pickle data was truncated");
            e.initCause(eofe);
            return e;
        }
    }
}
