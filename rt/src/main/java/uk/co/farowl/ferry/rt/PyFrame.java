// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Arrays;
import java.util.Map;

/**
 * A {@code PyFrame} is the context for one execution of the code of a
 * {@link PyFunction}. It holds the local variables, the cell and free
 * variables, and the value stack, and it executes the instructions of
 * the code in {@link #eval()}.
 */
class PyFrame {

    /** The function of which this is an execution. */
    final PyFunction func;

    /** The code this frame executes (from {@link #func}). */
    final PyCode code;

    /** Global name space (from {@link #func}). */
    final PyDict globals;

    /** Built-in name space consulted after {@link #globals}. */
    final PyDict builtins;

    /** Simple local variables, named in {@link PyCode#varnames}. */
    final Object[] fastlocals;

    /**
     * The concatenation of the cell and free variables (in that order).
     * We use the slightly confusing CPython name, to maximise
     * similarity with the CPython code for opcodes LOAD_DEREF,
     * STORE_DEREF, etc..
     */
    final PyCell[] freevars;

    /** Value stack. */
    final Object[] valuestack;

    /**
     * Create a frame for a call to the function, binding the arguments
     * to local variables.
     *
     * @param func being called
     * @param args positional arguments
     * @param kwargs keyword arguments or {@code null}
     */
    PyFrame(PyFunction func, Object[] args, PyDict kwargs) {
        this.func = func;
        this.code = func.code;
        this.globals = func.globals;
        this.builtins = func.getBuiltins();
        this.fastlocals = new Object[code.varnames.length];
        this.valuestack = new Object[code.stacksize];
        bindArguments(args, kwargs);

        int ncells = code.cellvars.length, nfree = code.freevars.length;
        this.freevars = ncells + nfree == 0 ? PyCell.EMPTY_ARRAY
                : new PyCell[ncells + nfree];
        for (int i = 0; i < ncells; i++) {
            // A cell variable that is also an argument starts full
            int arg = argIndex(code.cellvars[i]);
            freevars[i] = new PyCell(arg < 0 ? null : fastlocals[arg]);
        }
        if (nfree > 0) {
            System.arraycopy(func.closure, 0, freevars, ncells, nfree);
        }
    }

    private int argIndex(String name) {
        int n = code.argcount + code.kwonlyargcount;
        for (int i = 0; i < n; i++) {
            if (code.varnames[i].equals(name)) { return i; }
        }
        return -1;
    }

    // Compare CPython _PyEval_EvalCodeWithName in ceval.c
    private void bindArguments(Object[] args, PyDict kwargs) {
        int argcount = code.argcount;
        int total = argcount + code.kwonlyargcount;
        if (args.length > argcount) {
            throw new TypeError(
                    "%s() takes %d positional arguments but %d were given",
                    func.name, argcount, args.length);
        }
        System.arraycopy(args, 0, fastlocals, 0, args.length);

        if (kwargs != null) {
            for (Map.Entry<Object, Object> e : kwargs.entrySet()) {
                Object key = e.getKey();
                int i = code.posonlyargcount;
                while (i < total && !code.varnames[i].equals(key)) { i++; }
                if (i >= total) {
                    throw new TypeError(
                            "%s() got an unexpected keyword argument '%s'",
                            func.name, key);
                } else if (fastlocals[i] != null) {
                    throw new TypeError(
                            "%s() got multiple values for argument '%s'",
                            func.name, key);
                }
                fastlocals[i] = e.getValue();
            }
        }

        int ndefaults = func.defaults == null ? 0 : func.defaults.length;
        for (int i = args.length; i < total; i++) {
            if (fastlocals[i] != null) { continue; }
            Object v = null;
            if (i < argcount) {
                int d = i - (argcount - ndefaults);
                if (d >= 0) { v = func.defaults[d]; }
            } else if (func.kwdefaults != null) {
                v = func.kwdefaults.get(code.varnames[i]);
            }
            if (v == null) {
                throw new TypeError(
                        "%s() missing required argument: '%s'",
                        func.name, code.varnames[i]);
            }
            fastlocals[i] = v;
        }
    }

    /**
     * Execute the code of the function in this frame.
     *
     * @return the return value
     */
    Object eval() {
        // Evaluation stack index
        int sp = 0;
        // Cached references from code
        String[] names = code.names;
        Object[] consts = code.consts;
        byte[] inst = code.code;
        int ip = 0, oparg = 0;
        // Local variables used repeatedly in the loop
        String name;
        Object v, w, res;

        for (;;) {
            int opcode = inst[ip] & 0xff;
            oparg = (oparg << 8) | (inst[ip + 1] & 0xff);
            ip += 2;

            try {
                // Interpret opcode
                switch (opcode) {

                    case Opcode.EXTENDED_ARG:
                        // Keep the shifted oparg for the next opcode
                        continue;

                    case Opcode.NOP:
                        break;

                    case Opcode.POP_TOP:
                        sp -= 1;
                        break;

                    case Opcode.ROT_TWO:
                        v = valuestack[sp - 1]; // TOP
                        valuestack[sp - 1] = valuestack[sp - 2];
                        valuestack[sp - 2] = v; // SET_SECOND
                        break;

                    case Opcode.DUP_TOP:
                        valuestack[sp] = valuestack[sp++ - 1]; // DUP
                        break;

                    case Opcode.BINARY_MULTIPLY:
                        w = valuestack[--sp]; // POP
                        v = valuestack[sp - 1]; // TOP
                        res = Abstract.multiply(v, w);
                        valuestack[sp - 1] = res; // SET_TOP
                        break;

                    case Opcode.BINARY_ADD:
                        w = valuestack[--sp]; // POP
                        v = valuestack[sp - 1]; // TOP
                        res = Abstract.add(v, w);
                        valuestack[sp - 1] = res; // SET_TOP
                        break;

                    case Opcode.BINARY_SUBTRACT:
                        w = valuestack[--sp]; // POP
                        v = valuestack[sp - 1]; // TOP
                        res = Abstract.subtract(v, w);
                        valuestack[sp - 1] = res; // SET_TOP
                        break;

                    case Opcode.RETURN_VALUE:
                        return valuestack[--sp]; // POP

                    case Opcode.STORE_ATTR: // v.name = w
                        sp -= 2; // SHRINK 2
                        w = valuestack[sp];
                        v = valuestack[sp + 1];
                        Abstract.setAttr(v, names[oparg], w);
                        break;

                    case Opcode.DELETE_ATTR: // del v.name
                        v = valuestack[--sp];
                        Abstract.delAttr(v, names[oparg]);
                        break;

                    case Opcode.STORE_GLOBAL:
                        globals.put(names[oparg], valuestack[--sp]);
                        break;

                    case Opcode.DELETE_GLOBAL:
                        name = names[oparg];
                        if (globals.remove(name) == null) {
                            throw new NameError(NAME_ERROR_MSG, name);
                        }
                        break;

                    case Opcode.LOAD_CONST:
                        valuestack[sp++] = consts[oparg]; // PUSH
                        break;

                    case Opcode.BUILD_TUPLE:
                        sp -= oparg;
                        res = new PyTuple(Arrays.copyOfRange(
                                valuestack, sp, sp + oparg));
                        valuestack[sp++] = res; // PUSH
                        break;

                    case Opcode.BUILD_LIST:
                        sp -= oparg;
                        res = new PyList(Arrays.asList(
                                valuestack).subList(sp, sp + oparg));
                        valuestack[sp++] = res; // PUSH
                        break;

                    case Opcode.LOAD_ATTR: // v.name
                        v = valuestack[sp - 1]; // TOP
                        valuestack[sp - 1] =
                                Abstract.getAttr(v, names[oparg]);
                        break;

                    case Opcode.COMPARE_OP:
                        w = valuestack[--sp]; // POP
                        v = valuestack[sp - 1]; // TOP
                        valuestack[sp - 1] =
                                Abstract.richCompare(v, w, oparg);
                        break;

                    case Opcode.JUMP_FORWARD:
                        ip += oparg;
                        break;

                    case Opcode.JUMP_ABSOLUTE:
                        ip = oparg;
                        break;

                    case Opcode.POP_JUMP_IF_FALSE:
                        if (!Abstract.isTrue(valuestack[--sp])) {
                            ip = oparg;
                        }
                        break;

                    case Opcode.POP_JUMP_IF_TRUE:
                        if (Abstract.isTrue(valuestack[--sp])) {
                            ip = oparg;
                        }
                        break;

                    case Opcode.LOAD_GLOBAL:
                        name = names[oparg];
                        v = globals.get(name);
                        if (v == null) {
                            v = builtins.get(name);
                            if (v == null) {
                                throw new NameError(NAME_ERROR_MSG, name);
                            }
                        }
                        valuestack[sp++] = v; // PUSH
                        break;

                    case Opcode.LOAD_FAST:
                        v = fastlocals[oparg];
                        if (v == null) {
                            throw new NameError(UNBOUNDLOCAL_ERROR_MSG,
                                    code.varnames[oparg]);
                        }
                        valuestack[sp++] = v; // PUSH
                        break;

                    case Opcode.STORE_FAST:
                        fastlocals[oparg] = valuestack[--sp]; // POP
                        break;

                    case Opcode.DELETE_FAST:
                        fastlocals[oparg] = null;
                        break;

                    case Opcode.CALL_FUNCTION:
                        // func | args[n] |
                        // ----------------^sp
                        sp -= oparg;
                        v = valuestack[sp - 1];
                        res = Callables.call(v, Arrays
                                .copyOfRange(valuestack, sp, sp + oparg),
                                null);
                        valuestack[sp - 1] = res; // SET_TOP
                        break;

                    case Opcode.MAKE_FUNCTION:
                        sp = makeFunction(sp, oparg);
                        break;

                    case Opcode.LOAD_CLOSURE:
                        valuestack[sp++] = freevars[oparg]; // PUSH
                        break;

                    case Opcode.LOAD_DEREF:
                        v = freevars[oparg].obj;
                        if (v == null) { throw unboundDeref(oparg); }
                        valuestack[sp++] = v; // PUSH
                        break;

                    case Opcode.STORE_DEREF:
                        freevars[oparg].obj = valuestack[--sp]; // POP
                        break;

                    case Opcode.DELETE_DEREF:
                        if (freevars[oparg].obj == null) {
                            throw unboundDeref(oparg);
                        }
                        freevars[oparg].obj = null;
                        break;

                    default:
                        throw new InterpreterError("ip: %d, opcode: %d",
                                ip - 2, opcode);
                } // switch

            } catch (BaseException | InterpreterError e) {
                // No exception handlers in this code: propagate.
                throw e;
            } catch (RuntimeException e) {
                /*
                 * A non-Python exception signals an internal error, in
                 * our implementation or in user-supplied Java.
                 */
                throw new InterpreterError(e, "Non-PyException at ip %d",
                        ip - 2);
            }
            oparg = 0;
        } // loop
    }

    /**
     * Implement {@code MAKE_FUNCTION}: the stack holds the optional
     * parts indicated by {@code oparg}, then the code and qualified
     * name.
     *
     * @param sp stack pointer before
     * @param oparg flags
     * @return stack pointer after
     */
    private int makeFunction(int sp, int oparg) {
        String qualname = (String)valuestack[--sp];
        PyCode c = (PyCode)valuestack[--sp];
        PyCell[] closure = null;
        PyDict annotations = null, kwdefaults = null;
        Object[] defaults = null;
        if ((oparg & 8) != 0) {
            Object[] cells = ((PyTuple)valuestack[--sp]).value;
            closure = Arrays.copyOf(cells, cells.length, PyCell[].class);
        }
        if ((oparg & 4) != 0) { annotations = (PyDict)valuestack[--sp]; }
        if ((oparg & 2) != 0) { kwdefaults = (PyDict)valuestack[--sp]; }
        if ((oparg & 1) != 0) {
            defaults = ((PyTuple)valuestack[--sp]).toArray();
        }
        PyFunction f = new PyFunction(func.interpreter, c, globals,
                defaults, kwdefaults, closure);
        f.setQualname(qualname);
        f.setAnnotations(annotations);
        valuestack[sp++] = f; // PUSH
        return sp;
    }

    private NameError unboundDeref(int oparg) {
        int ncells = code.cellvars.length;
        if (oparg < ncells) {
            return new NameError(UNBOUNDLOCAL_ERROR_MSG,
                    code.cellvars[oparg]);
        } else {
            return new NameError(UNBOUNDFREE_ERROR_MSG,
                    code.freevars[oparg - ncells]);
        }
    }

    private static final String NAME_ERROR_MSG =
            "name '%.200s' is not defined";
    private static final String UNBOUNDLOCAL_ERROR_MSG =
            "local variable '%.200s' referenced before assignment";
    private static final String UNBOUNDFREE_ERROR_MSG =
            "free variable '%.200s' referenced before assignment"
                    + " in enclosing scope";
}
