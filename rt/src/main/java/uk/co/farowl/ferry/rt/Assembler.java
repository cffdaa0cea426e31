// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

/**
 * Build a {@link PyCode} from symbolic instructions, in place of a
 * compiler. Names, constants and variables are interned as they are
 * used, {@link Opcode#EXTENDED_ARG} prefixes are inserted where an
 * argument needs more than one byte, jumps are resolved to
 * {@link Label}s, and the stack size is computed.
 * <pre>
 * PyCode c = new Assembler("inc").freevars("count")
 *         .loadDeref("count").loadConst(1).op(Opcode.BINARY_ADD)
 *         .storeDeref("count").loadDeref("count")
 *         .op(Opcode.RETURN_VALUE).assemble();
 * </pre>
 */
public class Assembler {

    /** A position in the instruction stream, the target of jumps. */
    public static class Label {
        /** Index of the instruction at the label, or -1 if unbound. */
        private int index = -1;
    }

    /** One instruction (with its argument or jump target). */
    private static class Instruction {
        final int opcode;
        final int oparg;
        final Label target;

        Instruction(int opcode, int oparg, Label target) {
            this.opcode = opcode;
            this.oparg = oparg;
            this.target = target;
        }
    }

    private final String name;
    private String qualname;
    private String filename = "<assembled>";
    private int firstlineno = 1;
    private int argcount, posonlyargcount, kwonlyargcount;
    private final EnumSet<PyCode.Trait> traits =
            EnumSet.of(PyCode.Trait.OPTIMIZED, PyCode.Trait.NEWLOCALS);

    private final List<Object> consts = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<String> varnames = new ArrayList<>();
    private final List<String> cellvars = new ArrayList<>();
    private final List<String> freevars = new ArrayList<>();
    private final List<Instruction> instructions = new ArrayList<>();

    /**
     * Begin assembling a code object with the given name. The
     * qualified name defaults to the name.
     *
     * @param name {@code co_name}
     */
    public Assembler(String name) {
        this.name = name;
        this.qualname = name;
        this.consts.add(Py.None);
    }

    /**
     * @param qualname {@code co_qualname}
     * @return {@code this}
     */
    public Assembler qualname(String qualname) {
        this.qualname = qualname;
        return this;
    }

    /**
     * @param filename {@code co_filename}
     * @return {@code this}
     */
    public Assembler filename(String filename) {
        this.filename = filename;
        return this;
    }

    /**
     * Declare the positional parameters, which become the first local
     * variables.
     *
     * @param args names of the parameters
     * @return {@code this}
     */
    public Assembler args(String... args) {
        if (!varnames.isEmpty()) {
            throw new InterpreterError("args must be declared first");
        }
        varnames.addAll(Arrays.asList(args));
        argcount = args.length;
        return this;
    }

    /**
     * Declare keyword-only parameters, after the positional ones.
     *
     * @param args names of the parameters
     * @return {@code this}
     */
    public Assembler kwonlyargs(String... args) {
        if (varnames.size() != argcount) {
            throw new InterpreterError(
                    "keyword-only args must follow positional args");
        }
        varnames.addAll(Arrays.asList(args));
        kwonlyargcount = args.length;
        return this;
    }

    /**
     * @param n number of the positional parameters that are
     *     positional-only
     * @return {@code this}
     */
    public Assembler posonly(int n) {
        posonlyargcount = n;
        return this;
    }

    /**
     * Declare variables of this code that nested code refers to.
     *
     * @param names of the cell variables
     * @return {@code this}
     */
    public Assembler cellvars(String... names) {
        cellvars.addAll(Arrays.asList(names));
        return this;
    }

    /**
     * Declare variables this code refers to from an enclosing scope.
     *
     * @param names of the free variables
     * @return {@code this}
     */
    public Assembler freevars(String... names) {
        freevars.addAll(Arrays.asList(names));
        traits.add(PyCode.Trait.NESTED);
        return this;
    }

    /**
     * Add a trait (a {@code co_flags} bit).
     *
     * @param trait to add
     * @return {@code this}
     */
    public Assembler trait(PyCode.Trait trait) {
        traits.add(trait);
        return this;
    }

    /**
     * Set the doc string, which is the first constant. (Until set,
     * the first constant is {@code None}.)
     *
     * @param doc the doc string
     * @return {@code this}
     */
    public Assembler doc(String doc) {
        consts.set(0, doc);
        return this;
    }

    /**
     * Emit an instruction without an argument.
     *
     * @param opcode to emit
     * @return {@code this}
     */
    public Assembler op(int opcode) { return op(opcode, 0); }

    /**
     * Emit an instruction with a numeric argument.
     *
     * @param opcode to emit
     * @param oparg its argument
     * @return {@code this}
     */
    public Assembler op(int opcode, int oparg) {
        instructions.add(new Instruction(opcode, oparg, null));
        return this;
    }

    /** @return a new unbound label */
    public Label label() { return new Label(); }

    /**
     * Bind the label to the position of the next instruction.
     *
     * @param label to bind
     * @return {@code this}
     */
    public Assembler bind(Label label) {
        label.index = instructions.size();
        return this;
    }

    /**
     * Emit a jump instruction to a label.
     *
     * @param opcode a jump opcode
     * @param target label to jump to
     * @return {@code this}
     */
    public Assembler jump(int opcode, Label target) {
        instructions.add(new Instruction(opcode, 0, target));
        return this;
    }

    /**
     * @param value to push
     * @return {@code this}
     */
    public Assembler loadConst(Object value) {
        return op(Opcode.LOAD_CONST, intern(consts, value));
    }

    /**
     * @param name of global to push
     * @return {@code this}
     */
    public Assembler loadGlobal(String name) {
        return op(Opcode.LOAD_GLOBAL, intern(names, name));
    }

    /**
     * @param name of global to assign
     * @return {@code this}
     */
    public Assembler storeGlobal(String name) {
        return op(Opcode.STORE_GLOBAL, intern(names, name));
    }

    /**
     * @param name of global to delete
     * @return {@code this}
     */
    public Assembler deleteGlobal(String name) {
        return op(Opcode.DELETE_GLOBAL, intern(names, name));
    }

    /**
     * @param name of attribute to get from the top of the stack
     * @return {@code this}
     */
    public Assembler loadAttr(String name) {
        return op(Opcode.LOAD_ATTR, intern(names, name));
    }

    /**
     * @param name of attribute to set on TOS to the value under it
     * @return {@code this}
     */
    public Assembler storeAttr(String name) {
        return op(Opcode.STORE_ATTR, intern(names, name));
    }

    /**
     * @param name of local variable to push
     * @return {@code this}
     */
    public Assembler loadFast(String name) {
        return op(Opcode.LOAD_FAST, intern(varnames, name));
    }

    /**
     * @param name of local variable to assign
     * @return {@code this}
     */
    public Assembler storeFast(String name) {
        return op(Opcode.STORE_FAST, intern(varnames, name));
    }

    /**
     * @param name of cell or free variable to push the contents of
     * @return {@code this}
     */
    public Assembler loadDeref(String name) {
        return op(Opcode.LOAD_DEREF, derefIndex(name));
    }

    /**
     * @param name of cell or free variable to assign
     * @return {@code this}
     */
    public Assembler storeDeref(String name) {
        return op(Opcode.STORE_DEREF, derefIndex(name));
    }

    /**
     * @param name of cell or free variable to push the cell of
     * @return {@code this}
     */
    public Assembler loadClosure(String name) {
        return op(Opcode.LOAD_CLOSURE, derefIndex(name));
    }

    /**
     * @param n number of arguments on the stack above the callable
     * @return {@code this}
     */
    public Assembler call(int n) { return op(Opcode.CALL_FUNCTION, n); }

    /**
     * Emit the instructions to make a function of the given code,
     * closing over the named cell or free variables of this code.
     *
     * @param code of the function
     * @param closure names of variables to close over (may be empty)
     * @return {@code this}
     */
    public Assembler makeFunction(PyCode code, String... closure) {
        int flags = 0;
        if (closure.length > 0) {
            for (String n : closure) { loadClosure(n); }
            op(Opcode.BUILD_TUPLE, closure.length);
            flags |= 8;
        }
        loadConst(code);
        loadConst(code.qualname);
        return op(Opcode.MAKE_FUNCTION, flags);
    }

    private int derefIndex(String name) {
        int i = cellvars.indexOf(name);
        if (i >= 0) { return i; }
        i = freevars.indexOf(name);
        if (i >= 0) { return cellvars.size() + i; }
        throw new InterpreterError("'%s' is not a cell or free variable",
                name);
    }

    private static <T> int intern(List<T> list, T value) {
        // Identity for objects like code, equality for names and values
        for (int i = 0; i < list.size(); i++) {
            T v = list.get(i);
            if (v == value || (v instanceof String
                    && v.equals(value))) {
                return i;
            }
        }
        list.add(value);
        return list.size() - 1;
    }

    /** Number of two-byte units needed by an argument. */
    private static int units(int oparg) {
        int n = 1;
        while ((oparg >>>= 8) != 0) { n++; }
        return n;
    }

    /**
     * Produce the code object from the instructions emitted so far.
     *
     * @return the code object
     */
    public PyCode assemble() {
        int n = instructions.size();
        int[] offset = new int[n + 1];
        int[] arg = new int[n];

        // Widen jump arguments until the offsets stop changing
        boolean changed = true;
        while (changed) {
            changed = false;
            int pos = 0;
            for (int i = 0; i < n; i++) {
                if (offset[i] != pos) { changed = true; }
                offset[i] = pos;
                pos += 2 * units(arg[i]);
            }
            offset[n] = pos;
            for (int i = 0; i < n; i++) {
                Instruction inst = instructions.get(i);
                int a = inst.oparg;
                if (inst.target != null) {
                    if (inst.target.index < 0) {
                        throw new InterpreterError("unbound label");
                    }
                    int dest = offset[inst.target.index];
                    a = inst.opcode == Opcode.JUMP_FORWARD
                            ? dest - offset[i + 1] : dest;
                }
                if (arg[i] != a) {
                    changed = true;
                    arg[i] = a;
                }
            }
        }

        byte[] bytes = new byte[offset[n]];
        int depth = 0, maxDepth = 0;
        for (int i = 0; i < n; i++) {
            Instruction inst = instructions.get(i);
            int pos = offset[i], u = units(arg[i]);
            for (int k = u - 1; k >= 0; k--) {
                bytes[pos++] = (byte)(k == 0 ? inst.opcode
                        : Opcode.EXTENDED_ARG);
                bytes[pos++] = (byte)(arg[i] >>> (8 * k));
            }
            depth += Opcode.stackEffect(inst.opcode, arg[i]);
            maxDepth = Math.max(maxDepth, depth);
        }

        int flags = 0;
        for (PyCode.Trait t : traits) { flags |= t.flag; }
        if (freevars.isEmpty() && cellvars.isEmpty()) {
            flags |= PyCode.Trait.NOFREE.flag;
        }
        return new PyCode(argcount, posonlyargcount, kwonlyargcount,
                Math.max(maxDepth, 1), flags, bytes, consts.toArray(),
                names.toArray(new String[0]),
                varnames.toArray(new String[0]),
                freevars.toArray(new String[0]),
                cellvars.toArray(new String[0]), filename, name, qualname,
                firstlineno);
    }
}
