// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Test the {@link Assembler} produces code the frame can run. */
@DisplayName("The Assembler")
class AssemblerTest extends UnitTestSupport {

    @Test
    @DisplayName("interns names and sets the traits")
    void namesAndTraits() {
        PyCode c = new Assembler("g").loadGlobal("a").loadAttr("b")
                .loadGlobal("a").op(Opcode.POP_TOP)
                .op(Opcode.RETURN_VALUE).assemble();
        assertArrayEquals(new String[] {"a", "b"}, c.getNames());
        assertTrue(c.traits.contains(PyCode.Trait.NOFREE));
        assertEquals(2, c.stacksize);
    }

    @Test
    @DisplayName("inserts EXTENDED_ARG for large arguments")
    void extendedArg() {
        Assembler a = new Assembler("big");
        for (int i = 0; i < 300; i++) { a.loadConst("k" + i); }
        PyCode c = a.op(Opcode.RETURN_VALUE).assemble();
        byte[] code = c.getCode();
        // Last load is of const 300 = 0x012c
        int n = code.length;
        assertEquals(Opcode.EXTENDED_ARG, code[n - 6] & 0xff);
        assertEquals(0x01, code[n - 5] & 0xff);
        assertEquals(Opcode.LOAD_CONST, code[n - 4] & 0xff);
        assertEquals(0x2c, code[n - 3] & 0xff);

        Interpreter interp = new Interpreter();
        PyFunction f = define(interp, mainModule(interp), c);
        assertEquals("k299", f.call());
    }

    @Test
    @DisplayName("resolves jumps to labels")
    void jumps() {
        // def choose(x): return "yes" if x else "no"
        Assembler a = new Assembler("choose").args("x");
        Assembler.Label no = a.label();
        a.loadFast("x").jump(Opcode.POP_JUMP_IF_FALSE, no)
                .loadConst("yes").op(Opcode.RETURN_VALUE).bind(no)
                .loadConst("no").op(Opcode.RETURN_VALUE);
        Interpreter interp = new Interpreter();
        PyFunction f = define(interp, mainModule(interp), a.assemble());
        assertEquals("yes", f.call(true));
        assertEquals("no", f.call(0));
    }
}
