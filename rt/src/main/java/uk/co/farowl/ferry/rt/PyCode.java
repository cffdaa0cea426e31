// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.EnumSet;

/**
 * The Python {@code code} object: the compiled body of a function or
 * module, in the instruction set defined by {@link Opcode}. A code
 * object is immutable once created, which is what allows analyses of
 * it to be cached against its identity.
 */
public class PyCode implements PyObject {

    /** The Python type {@code code}. */
    public static final PyType TYPE =
            PyType.fromSpec("CodeType", "types");

    /** Characteristics of a {@code PyCode} (as CPython co_flags). */
    public enum Trait {
        OPTIMIZED(0x1), NEWLOCALS(0x2), VARARGS(0x4), VARKEYWORDS(0x8),
        NESTED(0x10), GENERATOR(0x20), NOFREE(0x40), COROUTINE(0x80),
        ITERABLE_COROUTINE(0x100), ASYNC_GENERATOR(0x200);

        /** Corresponding bit in {@code co_flags}. */
        public final int flag;

        Trait(int flag) { this.flag = flag; }
    }

    /** Number of positional arguments (including positional-only). */
    public final int argcount;
    /** Number of positional-only arguments. */
    public final int posonlyargcount;
    /** Number of keyword-only arguments. */
    public final int kwonlyargcount;
    /** Maximum depth of the value stack. */
    public final int stacksize;
    /** {@code co_flags} as an integer. */
    public final int flags;
    /** Characteristics of the code, equivalent to {@link #flags}. */
    public final EnumSet<Trait> traits;

    /** Instruction stream (opcode and argument in each pair). */
    final byte[] code;
    /** Constant objects needed by the code. */
    final Object[] consts;
    /** Names referenced in the code (globals and attributes). */
    final String[] names;
    /** Args and non-cell locals. */
    final String[] varnames;
    /** Names referenced but not defined here. */
    final String[] freevars;
    /** Names defined here and referenced in nested scopes. */
    final String[] cellvars;

    /** Where it was loaded from. */
    public final String filename;
    /** Name of the function etc. */
    public final String name;
    /** Fully qualified name of the function etc. */
    public final String qualname;
    /** First source line number. */
    public final int firstlineno;

    /**
     * Full constructor. The arrays are copied, so it is safe for the
     * caller to modify them afterwards.
     *
     * @param argcount {@code co_argcount}
     * @param posonlyargcount {@code co_posonlyargcount}
     * @param kwonlyargcount {@code co_kwonlyargcount}
     * @param stacksize {@code co_stacksize}
     * @param flags {@code co_flags}
     * @param code {@code co_code}
     * @param consts {@code co_consts}
     * @param names {@code co_names}
     * @param varnames {@code co_varnames}
     * @param freevars {@code co_freevars}
     * @param cellvars {@code co_cellvars}
     * @param filename {@code co_filename}
     * @param name {@code co_name}
     * @param qualname {@code co_qualname}
     * @param firstlineno {@code co_firstlineno}
     */
    public PyCode(int argcount, int posonlyargcount, int kwonlyargcount,
            int stacksize, int flags, byte[] code, Object[] consts,
            String[] names, String[] varnames, String[] freevars,
            String[] cellvars, String filename, String name,
            String qualname, int firstlineno) {
        if (argcount + kwonlyargcount > varnames.length) {
            throw new ValueError("code: varnames is too small");
        } else if (code.length % 2 != 0) {
            throw new ValueError("code: odd length instruction stream");
        }
        this.argcount = argcount;
        this.posonlyargcount = posonlyargcount;
        this.kwonlyargcount = kwonlyargcount;
        this.stacksize = stacksize;
        this.flags = flags;
        this.traits = traitsFrom(flags);
        this.code = code.clone();
        this.consts = consts.clone();
        this.names = names.clone();
        this.varnames = varnames.clone();
        this.freevars = freevars.clone();
        this.cellvars = cellvars.clone();
        this.filename = filename;
        this.name = name;
        this.qualname = qualname;
        this.firstlineno = firstlineno;
    }

    /**
     * Convert a CPython-style {@code co_flags} integer to a set of
     * traits.
     *
     * @param flags from a code object
     * @return the equivalent traits
     */
    public static EnumSet<Trait> traitsFrom(int flags) {
        EnumSet<Trait> traits = EnumSet.noneOf(Trait.class);
        for (Trait t : Trait.values()) {
            if ((flags & t.flag) != 0) { traits.add(t); }
        }
        return traits;
    }

    @Override
    public PyType getType() { return TYPE; }

    /** @return a copy of {@code co_code} */
    public byte[] getCode() { return code.clone(); }

    /** @return a copy of {@code co_consts} */
    public Object[] getConsts() { return consts.clone(); }

    /** @return a copy of {@code co_names} */
    public String[] getNames() { return names.clone(); }

    /** @return a copy of {@code co_varnames} */
    public String[] getVarnames() { return varnames.clone(); }

    /** @return a copy of {@code co_freevars} */
    public String[] getFreevars() { return freevars.clone(); }

    /** @return a copy of {@code co_cellvars} */
    public String[] getCellvars() { return cellvars.clone(); }

    /** @return number of free variables (length of the closure) */
    public int getFreevarCount() { return freevars.length; }

    /** @return number of local variables */
    public int getNlocals() { return varnames.length; }

    // Compare CPython code_repr in codeobject.c
    @Override
    public String toString() {
        return String.format("<code object %s at %#x, file \"%s\", line %d>",
                name, System.identityHashCode(this), filename,
                firstlineno);
    }
}
