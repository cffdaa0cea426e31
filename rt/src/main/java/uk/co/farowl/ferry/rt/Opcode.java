// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * The instruction codes understood by {@link PyFrame}. The values are
 * those of CPython 3.8 for the subset we implement. Every instruction
 * occupies two bytes: the opcode and an argument, which
 * {@link #EXTENDED_ARG} prefixes may widen.
 */
public final class Opcode {

    private Opcode() {} // no instances

    public static final int POP_TOP = 1;
    public static final int ROT_TWO = 2;
    public static final int DUP_TOP = 4;
    public static final int NOP = 9;
    public static final int BINARY_MULTIPLY = 20;
    public static final int BINARY_ADD = 23;
    public static final int BINARY_SUBTRACT = 24;
    public static final int RETURN_VALUE = 83;

    /** Opcodes from here on take an argument. */
    public static final int HAVE_ARGUMENT = 90;

    public static final int STORE_ATTR = 95;
    public static final int DELETE_ATTR = 96;
    public static final int STORE_GLOBAL = 97;
    public static final int DELETE_GLOBAL = 98;
    public static final int LOAD_CONST = 100;
    public static final int BUILD_TUPLE = 102;
    public static final int BUILD_LIST = 103;
    public static final int LOAD_ATTR = 106;
    public static final int COMPARE_OP = 107;
    public static final int JUMP_FORWARD = 110;
    public static final int JUMP_ABSOLUTE = 113;
    public static final int POP_JUMP_IF_FALSE = 114;
    public static final int POP_JUMP_IF_TRUE = 115;
    public static final int LOAD_GLOBAL = 116;
    public static final int LOAD_FAST = 124;
    public static final int STORE_FAST = 125;
    public static final int DELETE_FAST = 126;
    public static final int CALL_FUNCTION = 131;
    public static final int MAKE_FUNCTION = 132;
    public static final int LOAD_CLOSURE = 135;
    public static final int LOAD_DEREF = 136;
    public static final int STORE_DEREF = 137;
    public static final int DELETE_DEREF = 138;
    public static final int EXTENDED_ARG = 144;

    /**
     * Net effect of an instruction on the depth of the value stack
     * (for the jump-not-taken path where it matters).
     *
     * @param opcode of the instruction
     * @param oparg its argument
     * @return change in stack depth
     */
    public static int stackEffect(int opcode, int oparg) {
        switch (opcode) {
            case NOP:
            case ROT_TWO:
            case EXTENDED_ARG:
            case LOAD_ATTR:
            case JUMP_FORWARD:
            case JUMP_ABSOLUTE:
            case DELETE_FAST:
            case DELETE_GLOBAL:
            case DELETE_DEREF:
                return 0;
            case DUP_TOP:
            case LOAD_CONST:
            case LOAD_GLOBAL:
            case LOAD_FAST:
            case LOAD_CLOSURE:
            case LOAD_DEREF:
                return 1;
            case POP_TOP:
            case BINARY_MULTIPLY:
            case BINARY_ADD:
            case BINARY_SUBTRACT:
            case RETURN_VALUE:
            case DELETE_ATTR:
            case STORE_GLOBAL:
            case COMPARE_OP:
            case POP_JUMP_IF_FALSE:
            case POP_JUMP_IF_TRUE:
            case STORE_FAST:
            case STORE_DEREF:
                return -1;
            case STORE_ATTR:
                return -2;
            case BUILD_TUPLE:
            case BUILD_LIST:
                return 1 - oparg;
            case CALL_FUNCTION:
                return -oparg;
            case MAKE_FUNCTION:
                return -1 - Integer.bitCount(oparg & 0xf);
            default:
                throw new InterpreterError("unknown opcode %d", opcode);
        }
    }
}
