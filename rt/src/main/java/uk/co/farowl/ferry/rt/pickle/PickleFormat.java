// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

/**
 * The record types of the pickle stream. Each record is a one-byte
 * code, sometimes followed by data. The stream is a program for a stack
 * machine: the {@link Unpickler} executes it to rebuild the objects the
 * {@link Pickler} walked. Multi-byte numbers are little-endian.
 */
final class PickleFormat {

    private PickleFormat() {} // only constants here

    /** Version of the stream this implementation writes and reads. */
    static final int VERSION = 1;

    /** Protocol marker then version (1 byte). */
    static final int PROTO = 0x80;
    /** End of the pickle: the top of the stack is the result. */
    static final int STOP = '.';

    /** Push {@code None}. */
    static final int NONE = 'N';
    /** Push {@code True}. */
    static final int NEWTRUE = 0x88;
    /** Push {@code False}. */
    static final int NEWFALSE = 0x89;
    /** Push an {@code int} (4 bytes follow). */
    static final int INT = 'J';
    /** Push an {@code int} (4-byte length, two's complement bytes). */
    static final int LONG = 0x8a;
    /** Push a {@code float} (8 bytes of IEEE 754). */
    static final int FLOAT = 'G';
    /** Push a {@code str} (4-byte length, UTF-8 bytes). */
    static final int UNICODE = 'X';
    /** Push a {@code bytes} (4-byte length, bytes). */
    static final int BYTES = 'B';

    /** Push a mark on the mark stack. */
    static final int MARK = '(';
    /** Replace everything above the last mark with a tuple of it. */
    static final int TUPLE = 't';
    /** Push the empty tuple. */
    static final int EMPTY_TUPLE = ')';
    /** Discard everything above the last mark, and the mark. */
    static final int POP_MARK = '1';
    /** Push an empty list. */
    static final int EMPTY_LIST = ']';
    /** Append everything above the last mark to the list under it. */
    static final int APPENDS = 'e';
    /** Push an empty dict. */
    static final int EMPTY_DICT = '}';
    /** Add key-value pairs above the last mark to the dict under it. */
    static final int SETITEMS = 'u';

    /** Push an object found by module and qualified name (2 strings). */
    static final int GLOBAL = 'c';
    /** Push a {@link Reconstructor} found by name (1 string). */
    static final int RECONSTRUCTOR = 'k';
    /** Pop arguments and callable, push the result of the call. */
    static final int REDUCE = 'R';
    /** Pop state and apply it to the object on top of the stack. */
    static final int BUILD = 'b';
    /** Discard the top of the stack. */
    static final int POP = '0';

    /** Store the top of the stack at the next memo index. */
    static final int MEMOIZE = 0x94;
    /** Push a memoized object (4-byte index). */
    static final int GET = 'j';
}
